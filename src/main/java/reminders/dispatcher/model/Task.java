package reminders.dispatcher.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a scheduled reminder.
 * State transitions produce new instances through {@link #toBuilder()}.
 */
public final class Task {
    private final String id;
    private final String name;
    private final String description;
    private final Priority priority;
    private final Instant triggerAt;
    private final Cadence cadence;
    private final boolean sentOnce;
    private final Instant lastNotifiedAt;
    private final String recipients; // comma separated e-mail addresses
    private final Visibility visibility;
    private final String createdBy;
    private final String updatedBy;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.description = builder.description;
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.triggerAt = Objects.requireNonNull(builder.triggerAt, "triggerAt is required");
        this.cadence = Objects.requireNonNull(builder.cadence, "cadence is required");
        this.sentOnce = builder.sentOnce;
        this.lastNotifiedAt = builder.lastNotifiedAt;
        this.recipients = builder.recipients;
        this.visibility = builder.visibility != null ? builder.visibility : Visibility.PUBLIC;
        this.createdBy = builder.createdBy;
        this.updatedBy = builder.updatedBy;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Priority priority() {
        return priority;
    }

    public Instant triggerAt() {
        return triggerAt;
    }

    public Cadence cadence() {
        return cadence;
    }

    public boolean sentOnce() {
        return sentOnce;
    }

    public Instant lastNotifiedAt() {
        return lastNotifiedAt;
    }

    public String recipients() {
        return recipients;
    }

    public Visibility visibility() {
        return visibility;
    }

    public String createdBy() {
        return createdBy;
    }

    public String updatedBy() {
        return updatedBy;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Whether this task has ever been notified successfully */
    public boolean hasBeenNotified() {
        return lastNotifiedAt != null || sentOnce;
    }

    /**
     * Public tasks are visible to everyone, private ones only to their creator.
     */
    public boolean isVisibleTo(String viewer) {
        return visibility == Visibility.PUBLIC || (viewer != null && viewer.equals(createdBy));
    }

    /**
     * State after a successful notification at {@code notifiedAt}.
     * One-shot tasks become permanently satisfied.
     */
    public Task notifiedAt(Instant notifiedAt) {
        return toBuilder()
                .lastNotifiedAt(notifiedAt)
                .sentOnce(sentOnce || cadence == Cadence.NONE)
                .build();
    }

    /**
     * Apply an author edit.
     * <p>
     * Downgrading a recurring task that already fired to {@link Cadence#NONE} marks it
     * as sent: a cadence downgrade never re-arms a task. The notification history is
     * kept as is, so an edit never makes a recurring task due before its cadence
     * period since the last notification has elapsed.
     */
    public Task revise(TaskDefinition definition, String actor, Instant now) {
        boolean downgraded = definition.cadence() == Cadence.NONE && cadence.isRecurring()
                && lastNotifiedAt != null;

        return toBuilder()
                .name(definition.name())
                .description(definition.description())
                .priority(definition.priority())
                .triggerAt(definition.triggerAt())
                .cadence(definition.cadence())
                .recipients(definition.recipients())
                .visibility(definition.visibility())
                .sentOnce(sentOnce || downgraded)
                .updatedBy(actor)
                .updatedAt(now)
                .build();
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .priority(priority)
                .triggerAt(triggerAt)
                .cadence(cadence)
                .sentOnce(sentOnce)
                .lastNotifiedAt(lastNotifiedAt)
                .recipients(recipients)
                .visibility(visibility)
                .createdBy(createdBy)
                .updatedBy(updatedBy)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private Priority priority = Priority.MEDIUM;
        private Instant triggerAt;
        private Cadence cadence = Cadence.NONE;
        private boolean sentOnce = false;
        private Instant lastNotifiedAt;
        private String recipients;
        private Visibility visibility = Visibility.PUBLIC;
        private String createdBy;
        private String updatedBy;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder triggerAt(Instant triggerAt) {
            this.triggerAt = triggerAt;
            return this;
        }

        public Builder cadence(Cadence cadence) {
            this.cadence = cadence;
            return this;
        }

        public Builder sentOnce(boolean sentOnce) {
            this.sentOnce = sentOnce;
            return this;
        }

        public Builder lastNotifiedAt(Instant lastNotifiedAt) {
            this.lastNotifiedAt = lastNotifiedAt;
            return this;
        }

        public Builder recipients(String recipients) {
            this.recipients = recipients;
            return this;
        }

        public Builder visibility(Visibility visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder updatedBy(String updatedBy) {
            this.updatedBy = updatedBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', cadence=" + cadence + ", sentOnce=" + sentOnce
                + ", lastNotifiedAt=" + lastNotifiedAt + "}";
    }
}
