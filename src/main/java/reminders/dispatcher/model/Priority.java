package reminders.dispatcher.model;

/**
 * Task priority. Only used to order simultaneously due tasks, never for eligibility.
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Parse a priority name, case-insensitive. Null or blank means {@link #MEDIUM}.
     */
    public static Priority parse(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return Priority.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown priority: " + value);
        }
    }
}
