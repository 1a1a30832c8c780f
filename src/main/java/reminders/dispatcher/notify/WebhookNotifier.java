package reminders.dispatcher.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.model.Task;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Delivers reminders by POSTing them as JSON to an HTTP endpoint
 * (mail relay, chat hook, etc).
 */
public class WebhookNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI endpoint;
    private final Duration timeout;
    private final ZoneId zone;
    private final HttpClient httpClient;

    public WebhookNotifier(String endpoint, Duration timeout, ZoneId zone) {
        this.endpoint = URI.create(endpoint);
        this.timeout = timeout;
        this.zone = zone;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public void notify(Task task) throws NotifyException {
        ReminderMessage message = ReminderMessage.of(task, zone);
        if (!message.hasRecipients()) {
            log.debug("Task {} has no recipients, nothing to send", task.id());
            return;
        }

        String body;
        try {
            body = MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new NotifyException("cannot encode reminder for task " + task.id(), e);
        }

        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new NotifyException("webhook delivery failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotifyException("webhook delivery interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new NotifyException("webhook returned HTTP " + status);
        }
        log.debug("Webhook accepted reminder for task {} (HTTP {})", task.id(), status);
    }
}
