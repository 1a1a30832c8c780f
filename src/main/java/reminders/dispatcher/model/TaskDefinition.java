package reminders.dispatcher.model;

import java.time.Instant;

/**
 * Author-editable fields of a task, as submitted when creating or editing it.
 */
public record TaskDefinition(
        String name,
        String description,
        Priority priority,
        Instant triggerAt,
        Cadence cadence,
        String recipients,
        Visibility visibility) {

    /** Definition of a public task. */
    public TaskDefinition(String name, String description, Priority priority, Instant triggerAt,
            Cadence cadence, String recipients) {
        this(name, description, priority, triggerAt, cadence, recipients, Visibility.PUBLIC);
    }
}
