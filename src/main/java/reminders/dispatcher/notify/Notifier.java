package reminders.dispatcher.notify;

import reminders.dispatcher.model.Task;

/**
 * Delivers a single reminder for a task.
 * Implementations never change task state; the dispatch loop owns that.
 */
public interface Notifier {

    /**
     * @param task the due task
     * @throws NotifyException if the reminder could not be delivered
     */
    void notify(Task task) throws NotifyException;
}
