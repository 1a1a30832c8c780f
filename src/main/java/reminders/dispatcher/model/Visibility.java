package reminders.dispatcher.model;

/**
 * Who may see a task in listings. Private tasks are shown to their creator only.
 */
public enum Visibility {
    PUBLIC,
    PRIVATE;

    /**
     * Parse a visibility name, case-insensitive. Null or blank means {@link #PUBLIC}.
     * Anything other than {@code private} is treated as public.
     */
    public static Visibility parse(String value) {
        if (value != null && "private".equalsIgnoreCase(value.trim())) {
            return PRIVATE;
        }
        return PUBLIC;
    }

    /**
     * Capitalized label used in reminder messages, e.g. {@code Public}.
     */
    public String label() {
        String lower = name().toLowerCase();
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
