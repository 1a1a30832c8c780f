package reminders.dispatcher.notify;

import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.config.DispatcherConfig;
import reminders.dispatcher.model.Task;

import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.Date;
import java.util.Properties;

/**
 * E-mails reminders through an SMTP server.
 * <p>
 * Each reminder is one message to all task recipients, with a plain-text body and
 * an HTML alternative. Connection, read and write timeouts are bounded by the
 * notify timeout.
 */
public class SmtpNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(SmtpNotifier.class);

    private final Session session;
    private final String from;
    private final ZoneId zone;

    public SmtpNotifier(DispatcherConfig config) {
        if (config.smtpFrom() == null || config.smtpFrom().isBlank()) {
            throw new IllegalArgumentException("REMINDER_SMTP_FROM or REMINDER_SMTP_USER is required for e-mail");
        }
        this.session = Session.getInstance(sessionProperties(config), authenticator(config));
        this.from = config.smtpFrom();
        this.zone = config.zone();
        log.info("E-mail delivery via {}:{} as {}", config.smtpHost(), config.smtpPort(), from);
    }

    static Properties sessionProperties(DispatcherConfig config) {
        String timeoutMillis = String.valueOf(Math.max(1, config.notifyTimeout().toMillis()));

        Properties props = new Properties();
        props.put("mail.smtp.host", config.smtpHost());
        props.put("mail.smtp.port", String.valueOf(config.smtpPort()));
        props.put("mail.smtp.connectiontimeout", timeoutMillis);
        props.put("mail.smtp.timeout", timeoutMillis);
        props.put("mail.smtp.writetimeout", timeoutMillis);
        props.put("mail.smtp.auth", String.valueOf(config.smtpUser() != null));
        if (config.smtpSecure()) {
            props.put("mail.smtp.ssl.enable", "true");
        } else {
            props.put("mail.smtp.starttls.enable", "true");
        }
        return props;
    }

    private static Authenticator authenticator(DispatcherConfig config) {
        if (config.smtpUser() == null) {
            return null;
        }
        String user = config.smtpUser();
        String password = config.smtpPassword() != null ? config.smtpPassword() : "";
        return new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(user, password);
            }
        };
    }

    @Override
    public void notify(Task task) throws NotifyException {
        ReminderMessage reminder = ReminderMessage.of(task, zone);
        if (!reminder.hasRecipients()) {
            log.debug("Task {} has no recipients, nothing to send", task.id());
            return;
        }

        try {
            Transport.send(compose(reminder));
        } catch (MessagingException e) {
            throw new NotifyException("smtp delivery failed: " + e.getMessage(), e);
        }
        log.debug("Mailed reminder for task {} to {}", task.id(), reminder.recipients());
    }

    /**
     * Build the MIME message for a reminder without sending it.
     */
    MimeMessage compose(ReminderMessage reminder) throws NotifyException {
        try {
            MimeBodyPart text = new MimeBodyPart();
            text.setText(reminder.text(), StandardCharsets.UTF_8.name());

            MimeBodyPart html = new MimeBodyPart();
            html.setContent(reminder.html(), "text/html; charset=UTF-8");

            MimeMultipart body = new MimeMultipart("alternative");
            body.addBodyPart(text);
            body.addBodyPart(html);

            MimeMessage message = new MimeMessage(session);
            message.setFrom(new InternetAddress(from));
            message.setRecipients(Message.RecipientType.TO,
                    InternetAddress.parse(String.join(",", reminder.recipients())));
            message.setSubject(reminder.subject(), StandardCharsets.UTF_8.name());
            message.setSentDate(new Date());
            message.setContent(body);
            return message;
        } catch (MessagingException e) {
            throw new NotifyException("cannot compose reminder for task " + reminder.taskId(), e);
        }
    }
}
