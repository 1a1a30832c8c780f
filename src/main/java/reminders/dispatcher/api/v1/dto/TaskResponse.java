package reminders.dispatcher.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import reminders.dispatcher.model.Task;

import java.time.Instant;

/**
 * Response DTO for a task.
 */
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("priority") String priority,
        @JsonProperty("triggerAt") Instant triggerAt,
        @JsonProperty("cadence") String cadence,
        @JsonProperty("sentOnce") boolean sentOnce,
        @JsonProperty("lastNotifiedAt") Instant lastNotifiedAt,
        @JsonProperty("recipients") String recipients,
        @JsonProperty("visibility") String visibility,
        @JsonProperty("createdBy") String createdBy,
        @JsonProperty("updatedBy") String updatedBy,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.name(),
                task.description(),
                task.priority().name(),
                task.triggerAt(),
                task.cadence().name(),
                task.sentOnce(),
                task.lastNotifiedAt(),
                task.recipients(),
                task.visibility().name(),
                task.createdBy(),
                task.updatedBy(),
                task.createdAt(),
                task.updatedAt());
    }
}
