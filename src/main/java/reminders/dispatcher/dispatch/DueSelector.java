package reminders.dispatcher.dispatch;

import reminders.dispatcher.config.DispatcherConfig;
import reminders.dispatcher.model.Cadence;
import reminders.dispatcher.model.Task;
import reminders.dispatcher.repository.TaskRepository;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;

/**
 * Decides which tasks are due for a reminder at a given instant.
 * <p>
 * A task is due when its trigger time has passed, it was not notified within the
 * renotify gap, and its cadence allows another notification: one-shot tasks only
 * until sent, recurring tasks once per period measured from the last notification.
 * <p>
 * Repository failures propagate; retrying is left to the next tick.
 */
public class DueSelector {

    /**
     * Shortest recurring period first, then higher priority, then earlier trigger.
     */
    static final Comparator<Task> DISPATCH_ORDER = Comparator
            .comparingInt((Task t) -> cadenceRank(t.cadence()))
            .thenComparing(Task::priority, Comparator.reverseOrder())
            .thenComparing(Task::triggerAt)
            .thenComparing(Task::id);

    private final TaskRepository taskRepository;
    private final Duration minRenotifyGap;
    private final Duration clockSkewTolerance;
    private final ZoneId zone;

    public DueSelector(TaskRepository taskRepository, DispatcherConfig config) {
        this(taskRepository, config.minRenotifyGap(), config.clockSkewTolerance(), config.zone());
    }

    public DueSelector(TaskRepository taskRepository, Duration minRenotifyGap, Duration clockSkewTolerance,
            ZoneId zone) {
        this.taskRepository = taskRepository;
        this.minRenotifyGap = minRenotifyGap;
        this.clockSkewTolerance = clockSkewTolerance;
        this.zone = zone;
    }

    /**
     * Tasks due at {@code now}, in dispatch order.
     */
    public List<Task> selectDue(Instant now) {
        return taskRepository.listDueCandidates(now.plus(clockSkewTolerance)).stream()
                .filter(task -> isDue(task, now))
                .sorted(DISPATCH_ORDER)
                .toList();
    }

    public boolean isDue(Task task, Instant now) {
        return !task.triggerAt().isAfter(now.plus(clockSkewTolerance))
                && outsideRenotifyGap(task, now)
                && cadenceAllows(task, now);
    }

    private boolean outsideRenotifyGap(Task task, Instant now) {
        Instant last = task.lastNotifiedAt();
        return last == null || Duration.between(last, now).compareTo(minRenotifyGap) >= 0;
    }

    private boolean cadenceAllows(Task task, Instant now) {
        if (task.cadence() == Cadence.NONE) {
            return !task.sentOnce();
        }
        Instant last = task.lastNotifiedAt();
        return last == null || !now.isBefore(task.cadence().nextEligibleAfter(last, zone));
    }

    private static int cadenceRank(Cadence cadence) {
        return switch (cadence) {
            case DAILY -> 0;
            case WEEKLY -> 1;
            case MONTHLY -> 2;
            case NONE -> 3;
        };
    }
}
