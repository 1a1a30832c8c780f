package reminders.dispatcher.repository;

/**
 * Failure of a task repository operation.
 * Transient failures (connectivity, timeouts) are expected to clear on the next tick;
 * permanent failures point at schema or data problems.
 */
public class RepositoryException extends RuntimeException {

    public enum Kind {
        TRANSIENT,
        PERMANENT
    }

    private final Kind kind;

    public RepositoryException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static RepositoryException transientFailure(String message, Throwable cause) {
        return new RepositoryException(Kind.TRANSIENT, message, cause);
    }

    public static RepositoryException permanentFailure(String message, Throwable cause) {
        return new RepositoryException(Kind.PERMANENT, message, cause);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }
}
