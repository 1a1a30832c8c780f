package reminders.dispatcher.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Process-local set of task ids currently being dispatched.
 * <p>
 * Keeps two overlapping ticks from notifying the same task before its sent state is
 * committed. Ids are released after a fixed delay so a tick that read the due list
 * just before the commit still finds the id held. This is duplicate suppression
 * within one process only; the durable renotify gap covers restarts and other
 * processes.
 */
public final class InFlightGuard implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InFlightGuard.class);

    private final ScheduledExecutorService releaser = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "in-flight-release");
        t.setDaemon(true);
        return t;
    });
    private final Duration releaseDelay;

    // guarded by this
    private final Set<String> inFlight = new HashSet<>();
    private final Map<String, PendingRelease> pendingReleases = new HashMap<>();

    public InFlightGuard(Duration releaseDelay) {
        this.releaseDelay = releaseDelay;
    }

    /**
     * Claim a task id. Never blocks.
     *
     * @return true if the caller now owns the id
     */
    public synchronized boolean tryAcquire(String taskId) {
        return inFlight.add(taskId);
    }

    /**
     * Release an id immediately, cancelling any pending delayed release.
     */
    public synchronized void release(String taskId) {
        PendingRelease pending = pendingReleases.remove(taskId);
        if (pending != null) {
            pending.cancel();
        }
        inFlight.remove(taskId);
    }

    /**
     * Release an id once the configured delay has passed.
     */
    public synchronized void releaseAfterDelay(String taskId) {
        if (releaseDelay.isZero() || releaseDelay.isNegative()) {
            release(taskId);
            return;
        }
        try {
            PendingRelease pending = new PendingRelease(taskId);
            pending.handle = releaser.schedule(pending, releaseDelay.toMillis(), TimeUnit.MILLISECONDS);
            PendingRelease previous = pendingReleases.put(taskId, pending);
            if (previous != null) {
                previous.cancel();
            }
        } catch (RejectedExecutionException e) {
            // guard already closed
            release(taskId);
        }
    }

    /**
     * A delayed release only frees the id if it is still the pending release for it.
     * One that was cancelled or replaced after it started running is a no-op, so it
     * cannot drop a claim taken later by another tick.
     */
    private synchronized void releaseScheduled(PendingRelease pending) {
        if (!pendingReleases.remove(pending.taskId, pending)) {
            log.trace("Stale release of task {} ignored", pending.taskId);
            return;
        }
        inFlight.remove(pending.taskId);
        log.trace("Released in-flight task {}", pending.taskId);
    }

    synchronized PendingRelease pendingRelease(String taskId) {
        return pendingReleases.get(taskId);
    }

    public synchronized boolean isInFlight(String taskId) {
        return inFlight.contains(taskId);
    }

    public synchronized int size() {
        return inFlight.size();
    }

    public synchronized int pendingReleaseCount() {
        return pendingReleases.size();
    }

    /**
     * Cancel all pending releases and drop every held id.
     */
    @Override
    public void close() {
        synchronized (this) {
            pendingReleases.values().forEach(PendingRelease::cancel);
            pendingReleases.clear();
            inFlight.clear();
        }
        releaser.shutdownNow();
    }

    final class PendingRelease implements Runnable {
        private final String taskId;
        private ScheduledFuture<?> handle; // guarded by the enclosing guard

        private PendingRelease(String taskId) {
            this.taskId = taskId;
        }

        @Override
        public void run() {
            releaseScheduled(this);
        }

        private void cancel() {
            if (handle != null) {
                handle.cancel(false);
            }
        }
    }
}
