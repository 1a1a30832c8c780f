package reminders.dispatcher.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import reminders.dispatcher.model.Cadence;
import reminders.dispatcher.model.Priority;
import reminders.dispatcher.model.TaskDefinition;
import reminders.dispatcher.model.Visibility;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Request DTO for creating or editing a task.
 * POST /api/v1/tasks, PUT /api/v1/tasks/{id}
 *
 * {@code triggerAt} accepts an ISO instant ({@code 2025-03-01T09:00:00Z}) or a local
 * date-time without offset ({@code 2025-03-01T09:00}), read in the server zone.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("priority") String priority,
        @JsonProperty("triggerAt") String triggerAt,
        @JsonProperty("cadence") String cadence,
        @JsonProperty("recipients") String recipients,
        @JsonProperty("visibility") String visibility) {

    public TaskDefinition toDefinition(ZoneId zone) {
        return new TaskDefinition(
                name,
                description,
                Priority.parse(priority),
                parseTrigger(triggerAt, zone),
                Cadence.parse(cadence),
                recipients,
                Visibility.parse(visibility));
    }

    static Instant parseTrigger(String value, ZoneId zone) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException ignored) {
            // fall through to local date-time
        }
        try {
            return LocalDateTime.parse(trimmed.replace(' ', 'T')).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("triggerAt is not a valid date-time: " + value);
        }
    }
}
