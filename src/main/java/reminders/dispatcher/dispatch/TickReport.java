package reminders.dispatcher.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outcome counts of one dispatch loop execution.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TickReport(
        @JsonProperty("trigger") String trigger,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("selected") int selected,
        @JsonProperty("skippedInFlight") int skippedInFlight,
        @JsonProperty("skippedStale") int skippedStale,
        @JsonProperty("notified") int notified,
        @JsonProperty("failed") int failed,
        @JsonProperty("recordFailed") int recordFailed,
        @JsonProperty("error") String error) {

    public static TickReport empty(String trigger, Instant startedAt) {
        return new TickReport(trigger, startedAt, 0, 0, 0, 0, 0, 0, null);
    }

    public static TickReport aborted(String trigger, Instant startedAt, String error) {
        return new TickReport(trigger, startedAt, 0, 0, 0, 0, 0, 0, error);
    }

    public boolean isAborted() {
        return error != null;
    }
}
