package reminders.dispatcher.repository;

import reminders.dispatcher.model.Task;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for reminder task persistence.
 * All operations fail with {@link RepositoryException}.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     *
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * All tasks, earliest trigger first.
     */
    List<Task> findAll();

    /**
     * Apply an author edit to an existing task. Only author-editable fields are
     * written; the stored notification state is kept, except that downgrading a
     * notified recurring task to a one-shot marks it as sent.
     *
     * @param task the edited task
     * @return true if updated, false if not found
     */
    boolean update(Task task);

    /**
     * Delete a task.
     *
     * @param taskId the task ID
     * @return true if deleted, false if not found
     */
    boolean delete(String taskId);

    /**
     * Count all tasks.
     */
    int count();

    /**
     * Tasks that may be due at {@code now}: trigger time reached and not an
     * already-sent one-shot. Callers still apply the full due predicate
     * (renotify gap and cadence periods). Rows that cannot be decoded are skipped.
     *
     * @param now the selection instant
     * @return candidate tasks
     */
    List<Task> listDueCandidates(Instant now);

    /**
     * Atomically record a successful notification: sets {@code last_notified_at}
     * and, for one-shot tasks, {@code sent_once}.
     *
     * @param taskId     the task ID
     * @param notifiedAt when the notification was delivered
     * @return true if recorded, false if the task no longer exists
     */
    boolean recordNotification(String taskId, Instant notifiedAt);
}
