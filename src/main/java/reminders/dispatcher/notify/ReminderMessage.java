package reminders.dispatcher.notify;

import com.fasterxml.jackson.annotation.JsonProperty;
import reminders.dispatcher.model.Task;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Reminder rendered from a task, as plain text and as an HTML alternative.
 */
public record ReminderMessage(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("recipients") List<String> recipients,
        @JsonProperty("subject") String subject,
        @JsonProperty("text") String text,
        @JsonProperty("html") String html) {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    public static ReminderMessage of(Task task, ZoneId zone) {
        String description = task.description() == null || task.description().isBlank()
                ? "No description provided."
                : task.description();

        String text = "This is a reminder for the task \"" + task.name() + "\".\n\n"
                + "Task Name: " + task.name() + "\n"
                + "Task Description: " + description + "\n"
                + "Created At: " + format(task.createdAt(), zone) + "\n"
                + "Created By: " + orDash(task.createdBy()) + "\n"
                + "Trigger At: " + format(task.triggerAt(), zone) + "\n"
                + "Priority: " + capitalize(task.priority().name()) + "\n"
                + "Repeats: " + capitalize(task.cadence().name()) + "\n"
                + "Type: " + task.visibility().label() + "\n"
                + "Updated At: " + format(task.updatedAt(), zone) + "\n"
                + "Updated By: " + orDash(task.updatedBy()) + "\n";

        return new ReminderMessage(task.id(), parseRecipients(task.recipients()),
                "Reminder: " + task.name(), text, html(task, description, zone));
    }

    private static String html(Task task, String description, ZoneId zone) {
        return "<div style=\"font-family: Arial, sans-serif; max-width: 600px;\">"
                + "<h2>Task Reminder</h2>"
                + "<p><strong>" + escapeHtml(task.name()) + "</strong> "
                + "<span>" + capitalize(task.priority().name()) + " priority</span></p>"
                + "<table>"
                + row("Created At", format(task.createdAt(), zone))
                + row("Trigger At", format(task.triggerAt(), zone))
                + row("Repeats", capitalize(task.cadence().name()))
                + row("Task Type", task.visibility().label())
                + "</table>"
                + "<h3>Description</h3>"
                + "<p>" + escapeHtml(description).replace("\n", "<br/>") + "</p>"
                + "<h3>Audit</h3>"
                + "<table>"
                + row("Created By", orDash(task.createdBy()))
                + row("Updated At", format(task.updatedAt(), zone))
                + row("Updated By", orDash(task.updatedBy()))
                + "</table>"
                + "<p style=\"color: #888; font-size: 12px;\">You received this email because a reminder "
                + "was scheduled in the Future Task Reminders app.</p>"
                + "</div>";
    }

    private static String row(String label, String value) {
        return "<tr><td><strong>" + label + ":</strong></td><td>" + escapeHtml(value) + "</td></tr>";
    }

    static String escapeHtml(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append("&amp;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    public boolean hasRecipients() {
        return !recipients.isEmpty();
    }

    static List<String> parseRecipients(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String format(Instant instant, ZoneId zone) {
        return instant == null ? "-" : FORMAT.format(instant.atZone(zone));
    }

    private static String orDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }

    private static String capitalize(String value) {
        String lower = value.toLowerCase();
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
