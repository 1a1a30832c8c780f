package reminders.dispatcher.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A named recurring timer. Fires its action on a {@link TickSchedule}, re-arming after
 * every firing, until cancelled. {@link #tickNow()} fires it on the calling thread.
 */
public final class Ticker {

    private static final Logger log = LoggerFactory.getLogger(Ticker.class);

    private final String name;
    private final TickSchedule schedule;
    private final Runnable action;
    private final Clock clock;
    private final AtomicLong firings = new AtomicLong();

    // guarded by this
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> pending;
    private Instant lastTarget;
    private boolean cancelled;

    public Ticker(String name, TickSchedule schedule, Runnable action, Clock clock) {
        this.name = name;
        this.schedule = schedule;
        this.action = action;
        this.clock = clock;
    }

    /**
     * Arm the ticker on the given executor.
     */
    public synchronized void start(ScheduledExecutorService executor) {
        if (this.executor != null) {
            throw new IllegalStateException(name + " already started");
        }
        this.executor = executor;
        scheduleNext();
    }

    /**
     * Fire the action immediately on the calling thread. Errors are logged, not thrown.
     */
    public void tickNow() {
        firings.incrementAndGet();
        try {
            action.run();
        } catch (Exception e) {
            log.error("{} error", name, e);
        }
    }

    /**
     * Stop firing. A firing already in progress is not interrupted.
     */
    public synchronized void cancel() {
        cancelled = true;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public String name() {
        return name;
    }

    public TickSchedule schedule() {
        return schedule;
    }

    /** Number of times the action has been fired */
    public long firings() {
        return firings.get();
    }

    private void fire() {
        try {
            tickNow();
        } finally {
            scheduleNext();
        }
    }

    /**
     * Arm the next firing. The next target is computed from the previous target while
     * that is still ahead of the clock, so a firing that the executor delivers a little
     * early never re-arms for the same instant.
     */
    private synchronized void scheduleNext() {
        if (cancelled || executor.isShutdown()) {
            return;
        }
        Instant now = clock.instant();
        Instant base = lastTarget != null && lastTarget.isAfter(now) ? lastTarget : now;
        Instant target = base.plus(schedule.delayUntilNext(base));
        Duration delay = Duration.between(now, target);
        try {
            pending = executor.schedule(this::fire, ceilMillis(delay), TimeUnit.MILLISECONDS);
            lastTarget = target;
            log.debug("{} next firing at {} (in {})", name, target, delay);
        } catch (RejectedExecutionException e) {
            log.debug("{} not re-armed, executor is shutting down", name);
        }
    }

    static long ceilMillis(Duration delay) {
        long millis = delay.toMillis();
        return delay.minusMillis(millis).isZero() ? millis : millis + 1;
    }
}
