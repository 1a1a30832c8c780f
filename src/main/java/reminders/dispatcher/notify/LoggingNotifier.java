package reminders.dispatcher.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.model.Task;

import java.time.ZoneId;

/**
 * Notifier that only writes reminders to the log.
 * Used when no delivery endpoint is configured.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    private final ZoneId zone;

    public LoggingNotifier(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public void notify(Task task) {
        ReminderMessage message = ReminderMessage.of(task, zone);
        if (!message.hasRecipients()) {
            log.debug("Task {} has no recipients, nothing to send", task.id());
            return;
        }
        log.info("{} -> {}\n{}", message.subject(), String.join(", ", message.recipients()), message.text());
    }
}
