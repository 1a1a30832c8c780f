package reminders.dispatcher.notify;

/**
 * Delivery of a reminder failed (transport or formatting).
 */
public class NotifyException extends Exception {

    public NotifyException(String reason) {
        super(reason);
    }

    public NotifyException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
