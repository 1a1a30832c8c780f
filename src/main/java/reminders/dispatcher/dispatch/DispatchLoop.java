package reminders.dispatcher.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.model.Task;
import reminders.dispatcher.notify.NotifyException;
import reminders.dispatcher.notify.Notifier;
import reminders.dispatcher.repository.RepositoryException;
import reminders.dispatcher.repository.TaskRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One pass over the due reminders, executed once per scheduler tick.
 * <p>
 * For each due task: claim it in the in-flight guard, re-read it, deliver the
 * reminder, record the delivery, and schedule the guard release. The re-read after
 * the claim drops tasks that another tick notified, or an author edited or deleted,
 * since the due list was read. A failed delivery leaves the task untouched so the
 * next tick selects it again. Safe to run concurrently with itself.
 */
public class DispatchLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    private enum Outcome {
        NOTIFIED,
        STALE,
        NOTIFY_FAILED,
        RECORD_FAILED
    }

    private final DueSelector dueSelector;
    private final InFlightGuard inFlightGuard;
    private final Notifier notifier;
    private final TaskRepository taskRepository;
    private final Duration notifyTimeout;
    private final Clock clock;
    private final DispatchListener listener;
    private final ExecutorService notifyExecutor;

    public DispatchLoop(DueSelector dueSelector,
            InFlightGuard inFlightGuard,
            Notifier notifier,
            TaskRepository taskRepository,
            Duration notifyTimeout,
            Clock clock,
            DispatchListener listener) {
        this.dueSelector = dueSelector;
        this.inFlightGuard = inFlightGuard;
        this.notifier = notifier;
        this.taskRepository = taskRepository;
        this.notifyTimeout = notifyTimeout;
        this.clock = clock;
        this.listener = listener != null ? listener : DispatchListener.NOOP;

        AtomicInteger threadCount = new AtomicInteger();
        this.notifyExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "reminder-notify-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run one dispatch pass.
     *
     * @param trigger name of the timer (or caller) that fired, for logs
     * @return counts of what happened; aborted if the due list could not be read
     */
    public TickReport tick(String trigger) {
        Instant startedAt = clock.instant();

        List<Task> due;
        try {
            due = dueSelector.selectDue(startedAt);
        } catch (RepositoryException e) {
            if (e.isTransient()) {
                log.warn("[{}] Could not read due tasks, skipping tick: {}", trigger, e.getMessage());
            } else {
                log.error("[{}] Due task query failed", trigger, e);
            }
            listener.onTickAborted(trigger, e);
            return TickReport.aborted(trigger, startedAt, e.getMessage());
        }

        if (due.isEmpty()) {
            log.debug("[{}] No tasks due", trigger);
            return TickReport.empty(trigger, startedAt);
        }

        log.info("[{}] Found {} task(s) needing reminders", trigger, due.size());

        int skipped = 0;
        int stale = 0;
        int notified = 0;
        int failed = 0;
        int recordFailed = 0;

        for (Task task : due) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("[{}] Interrupted, leaving remaining tasks for the next tick", trigger);
                break;
            }

            log.debug("[{}] Selected task {} ({}, priority {})", trigger, task.id(), task.cadence(), task.priority());
            listener.onSelected(trigger, task);

            if (!inFlightGuard.tryAcquire(task.id())) {
                log.info("[{}] Task {} is already being processed, skipping", trigger, task.id());
                listener.onSkippedInFlight(trigger, task);
                skipped++;
                continue;
            }

            try {
                switch (dispatch(trigger, task)) {
                    case NOTIFIED -> notified++;
                    case STALE -> stale++;
                    case NOTIFY_FAILED -> failed++;
                    case RECORD_FAILED -> recordFailed++;
                }
            } catch (RuntimeException e) {
                log.error("[{}] Unexpected error dispatching task {}", trigger, task.id(), e);
                failed++;
            } finally {
                inFlightGuard.releaseAfterDelay(task.id());
            }
        }

        TickReport report = new TickReport(trigger, startedAt, due.size(), skipped, stale, notified, failed,
                recordFailed, null);
        log.info("[{}] Tick done: {} notified, {} failed, {} not recorded, {} skipped in flight, {} no longer due",
                trigger, notified, failed, recordFailed, skipped, stale);
        return report;
    }

    private Outcome dispatch(String trigger, Task selected) {
        Optional<Task> current;
        try {
            current = taskRepository.findById(selected.id());
        } catch (RepositoryException e) {
            log.warn("[{}] Could not re-read task {}, leaving it for the next tick: {}",
                    trigger, selected.id(), e.getMessage());
            listener.onNotifyFailed(trigger, selected, e);
            return Outcome.NOTIFY_FAILED;
        }
        if (current.isEmpty() || !dueSelector.isDue(current.get(), clock.instant())) {
            log.info("[{}] Task {} is no longer due, skipping", trigger, selected.id());
            listener.onSkippedStale(trigger, selected);
            return Outcome.STALE;
        }

        Task task = current.get();
        try {
            deliver(task);
        } catch (NotifyException e) {
            log.warn("[{}] Failed to send reminder for task {}: {}", trigger, task.id(), e.getMessage());
            listener.onNotifyFailed(trigger, task, e);
            return Outcome.NOTIFY_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while sending reminder for task {}", trigger, task.id());
            listener.onNotifyFailed(trigger, task, e);
            return Outcome.NOTIFY_FAILED;
        }

        Instant notifiedAt = clock.instant();
        try {
            boolean recorded = taskRepository.recordNotification(task.id(), notifiedAt);
            if (!recorded) {
                log.info("[{}] Task {} was deleted while its reminder was being sent", trigger, task.id());
            }
        } catch (RepositoryException e) {
            if (e.isTransient()) {
                log.warn("[{}] Reminder sent for task {} but recording it failed: {}",
                        trigger, task.id(), e.getMessage());
            } else {
                log.error("[{}] Reminder sent for task {} but recording it failed", trigger, task.id(), e);
            }
            listener.onRecordFailed(trigger, task, e);
            return Outcome.RECORD_FAILED;
        }

        log.info("[{}] Reminder sent for task {} (cadence: {})", trigger, task.id(), task.cadence());
        listener.onNotified(trigger, task, notifiedAt);
        return Outcome.NOTIFIED;
    }

    /**
     * Call the notifier, waiting at most {@code notifyTimeout}.
     */
    private void deliver(Task task) throws NotifyException, InterruptedException {
        Future<?> delivery = notifyExecutor.submit(() -> {
            notifier.notify(task);
            return null;
        });
        try {
            delivery.get(notifyTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof NotifyException notifyException) {
                throw notifyException;
            }
            throw new NotifyException("notifier error: " + cause, cause);
        } catch (TimeoutException e) {
            delivery.cancel(true);
            throw new NotifyException("notifier timed out after " + notifyTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            delivery.cancel(true);
            throw e;
        }
    }

    @Override
    public void close() {
        notifyExecutor.shutdownNow();
    }
}
