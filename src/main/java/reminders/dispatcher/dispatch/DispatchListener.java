package reminders.dispatcher.dispatch;

import reminders.dispatcher.model.Task;
import reminders.dispatcher.repository.RepositoryException;

import java.time.Instant;

/**
 * Observer of dispatch decisions. Every method has a no-op default.
 * Called on dispatch threads; implementations must be thread-safe and must not throw.
 */
public interface DispatchListener {

    DispatchListener NOOP = new DispatchListener() {
    };

    default void onSelected(String trigger, Task task) {
    }

    default void onSkippedInFlight(String trigger, Task task) {
    }

    /** The task was claimed but is no longer due once re-read, or is gone. */
    default void onSkippedStale(String trigger, Task task) {
    }

    default void onNotified(String trigger, Task task, Instant notifiedAt) {
    }

    default void onNotifyFailed(String trigger, Task task, Exception error) {
    }

    default void onRecordFailed(String trigger, Task task, RepositoryException error) {
    }

    default void onTickAborted(String trigger, RepositoryException error) {
    }
}
