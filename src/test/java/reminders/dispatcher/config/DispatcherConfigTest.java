package reminders.dispatcher.config;

import org.junit.jupiter.api.Test;
import reminders.dispatcher.notify.LoggingNotifier;
import reminders.dispatcher.notify.SmtpNotifier;
import reminders.dispatcher.notify.WebhookNotifier;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DispatcherConfigTest {

    @Test
    void defaults() {
        DispatcherConfig config = DispatcherConfig.defaults();

        assertEquals(Duration.ofMinutes(1), config.fastTickInterval());
        assertEquals(LocalTime.of(9, 0), config.slowTickTimeOfDay());
        assertFalse(config.hasSlowTickInterval());
        assertEquals(Duration.ofMinutes(2), config.minRenotifyGap());
        assertEquals(Duration.ofSeconds(5), config.inFlightReleaseDelay());
        assertEquals(Duration.ofSeconds(30), config.notifyTimeout());
        assertEquals(Duration.ZERO, config.clockSkewTolerance());
        assertEquals(8080, config.serverPort());
        assertFalse(config.hasWebhookUrl());
        assertFalse(config.hasApiKey());
    }

    @Test
    void readsEnvironment() {
        DispatcherConfig config = DispatcherConfig.fromEnv(Map.of(
                "REMINDER_FAST_TICK_INTERVAL", "PT30S",
                "REMINDER_SLOW_TICK_TIME", "07:15",
                "REMINDER_MIN_RENOTIFY_GAP", "300",
                "REMINDER_IN_FLIGHT_RELEASE_DELAY", "PT10S",
                "REMINDER_CLOCK_SKEW_TOLERANCE", "2",
                "REMINDER_ZONE", "Asia/Almaty",
                "REMINDER_PORT", "9090",
                "REMINDER_WEBHOOK_URL", " http://hooks.local/remind ",
                "REMINDER_API_KEY", "secret"));

        assertEquals(Duration.ofSeconds(30), config.fastTickInterval());
        assertEquals(LocalTime.of(7, 15), config.slowTickTimeOfDay());
        assertEquals(Duration.ofMinutes(5), config.minRenotifyGap());
        assertEquals(Duration.ofSeconds(10), config.inFlightReleaseDelay());
        assertEquals(Duration.ofSeconds(2), config.clockSkewTolerance());
        assertEquals(ZoneId.of("Asia/Almaty"), config.zone());
        assertEquals(9090, config.serverPort());
        assertEquals("http://hooks.local/remind", config.webhookUrl());
        assertTrue(config.hasApiKey());
    }

    @Test
    void slowTickIntervalOverridesTimeOfDay() {
        DispatcherConfig config = DispatcherConfig.fromEnv(Map.of("REMINDER_SLOW_TICK_INTERVAL", "PT6H"));

        assertTrue(config.hasSlowTickInterval());
        assertEquals(Duration.ofHours(6), config.slowTickInterval());
    }

    @Test
    void blankValuesKeepDefaults() {
        DispatcherConfig config = DispatcherConfig.fromEnv(Map.of("REMINDER_MIN_RENOTIFY_GAP", "  "));

        assertEquals(Duration.ofMinutes(2), config.minRenotifyGap());
    }

    @Test
    void rejectsMalformedValues() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DispatcherConfig.fromEnv(Map.of("REMINDER_NOTIFY_TIMEOUT", "soon")));
        assertTrue(e.getMessage().startsWith("REMINDER_NOTIFY_TIMEOUT"));

        assertThrows(IllegalArgumentException.class,
                () -> DispatcherConfig.fromEnv(Map.of("REMINDER_SLOW_TICK_TIME", "9am")));
    }

    @Test
    void toStringHidesSecrets() {
        String text = DispatcherConfig.defaults().withApiKey("top-secret").toString();

        assertFalse(text.contains("top-secret"));
        assertTrue(text.contains("apiKeySet=true"));
    }

    @Test
    void readsSmtpSettings() {
        DispatcherConfig config = DispatcherConfig.fromEnv(Map.of(
                "REMINDER_SMTP_HOST", "smtp.example.com",
                "REMINDER_SMTP_USER", "bot@example.com",
                "REMINDER_SMTP_PASSWORD", "pw",
                "REMINDER_SMTP_SECURE", "true"));

        assertTrue(config.hasSmtpHost());
        assertEquals(587, config.smtpPort());
        assertTrue(config.smtpSecure());
        assertEquals("bot@example.com", config.smtpFrom());
        assertFalse(config.toString().contains("pw"));

        DispatcherConfig explicitSender = DispatcherConfig.fromEnv(Map.of(
                "REMINDER_SMTP_HOST", "smtp.example.com",
                "REMINDER_SMTP_PORT", "2525",
                "REMINDER_SMTP_FROM", "Reminders <noreply@example.com>"));
        assertEquals(2525, explicitSender.smtpPort());
        assertEquals("Reminders <noreply@example.com>", explicitSender.smtpFrom());
        assertFalse(explicitSender.smtpSecure());
    }

    @Test
    void notifierFollowsConfiguredTransport() {
        DispatcherConfig none = DispatcherConfig.defaults();
        DispatcherConfig webhook = DispatcherConfig.defaults().withWebhookUrl("http://hooks.local/remind");
        DispatcherConfig smtp = DispatcherConfig.defaults().withWebhookUrl("http://hooks.local/remind")
                .withSmtp("smtp.example.com", 587, "noreply@example.com");

        assertInstanceOf(LoggingNotifier.class, Dependencies.createNotifier(none));
        assertInstanceOf(WebhookNotifier.class, Dependencies.createNotifier(webhook));
        assertInstanceOf(SmtpNotifier.class, Dependencies.createNotifier(smtp));
    }
}
