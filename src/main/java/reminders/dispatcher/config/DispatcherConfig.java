package reminders.dispatcher.config;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Configuration holder for dispatcher settings.
 * All settings have sensible defaults.
 */
public final class DispatcherConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/reminders;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Scheduling settings
    private Duration fastTickInterval = Duration.ofMinutes(1);
    private LocalTime slowTickTimeOfDay = LocalTime.of(9, 0);
    private Duration slowTickInterval = null; // If set, replaces the daily time-of-day slow tick
    private ZoneId zone = ZoneId.systemDefault();
    private int dispatchThreads = 2;

    // Dispatch settings
    private Duration minRenotifyGap = Duration.ofMinutes(2);
    private Duration inFlightReleaseDelay = Duration.ofSeconds(5);
    private Duration notifyTimeout = Duration.ofSeconds(30);
    private Duration repositoryTimeout = Duration.ofSeconds(10);
    private Duration clockSkewTolerance = Duration.ZERO;

    // Notification settings
    private String webhookUrl = null; // If unset (and no SMTP host), reminders are only logged
    private String smtpHost = null; // If set, reminders are e-mailed and the webhook is ignored
    private int smtpPort = 587;
    private String smtpUser = null;
    private String smtpPassword = null;
    private boolean smtpSecure = false; // implicit TLS (usually port 465); otherwise STARTTLS when offered
    private String smtpFrom = null;

    // Auth settings (optional)
    private String apiKey = null; // If set, API callers must provide X-Reminder-Key header

    private DispatcherConfig() {
    }

    public static DispatcherConfig defaults() {
        return new DispatcherConfig();
    }

    public static DispatcherConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static DispatcherConfig fromEnv(Map<String, String> env) {
        DispatcherConfig config = new DispatcherConfig();

        String dbUrl = env.get("REMINDER_DB_URL");
        if (isSet(dbUrl)) {
            config.databaseUrl = dbUrl;
        }

        String port = env.get("REMINDER_PORT");
        if (isSet(port)) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String fastTick = env.get("REMINDER_FAST_TICK_INTERVAL");
        if (isSet(fastTick)) {
            config.fastTickInterval = parseDuration("REMINDER_FAST_TICK_INTERVAL", fastTick);
        }

        String slowTickTime = env.get("REMINDER_SLOW_TICK_TIME");
        if (isSet(slowTickTime)) {
            try {
                config.slowTickTimeOfDay = LocalTime.parse(slowTickTime.trim());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("REMINDER_SLOW_TICK_TIME is not a time of day: " + slowTickTime);
            }
        }

        String slowTickInterval = env.get("REMINDER_SLOW_TICK_INTERVAL");
        if (isSet(slowTickInterval)) {
            config.slowTickInterval = parseDuration("REMINDER_SLOW_TICK_INTERVAL", slowTickInterval);
        }

        String zone = env.get("REMINDER_ZONE");
        if (isSet(zone)) {
            config.zone = ZoneId.of(zone.trim());
        }

        String gap = env.get("REMINDER_MIN_RENOTIFY_GAP");
        if (isSet(gap)) {
            config.minRenotifyGap = parseDuration("REMINDER_MIN_RENOTIFY_GAP", gap);
        }

        String releaseDelay = env.get("REMINDER_IN_FLIGHT_RELEASE_DELAY");
        if (isSet(releaseDelay)) {
            config.inFlightReleaseDelay = parseDuration("REMINDER_IN_FLIGHT_RELEASE_DELAY", releaseDelay);
        }

        String notifyTimeout = env.get("REMINDER_NOTIFY_TIMEOUT");
        if (isSet(notifyTimeout)) {
            config.notifyTimeout = parseDuration("REMINDER_NOTIFY_TIMEOUT", notifyTimeout);
        }

        String repositoryTimeout = env.get("REMINDER_REPOSITORY_TIMEOUT");
        if (isSet(repositoryTimeout)) {
            config.repositoryTimeout = parseDuration("REMINDER_REPOSITORY_TIMEOUT", repositoryTimeout);
        }

        String skew = env.get("REMINDER_CLOCK_SKEW_TOLERANCE");
        if (isSet(skew)) {
            config.clockSkewTolerance = parseDuration("REMINDER_CLOCK_SKEW_TOLERANCE", skew);
        }

        String webhookUrl = env.get("REMINDER_WEBHOOK_URL");
        if (isSet(webhookUrl)) {
            config.webhookUrl = webhookUrl.trim();
        }

        String smtpHost = env.get("REMINDER_SMTP_HOST");
        if (isSet(smtpHost)) {
            config.smtpHost = smtpHost.trim();
        }

        String smtpPort = env.get("REMINDER_SMTP_PORT");
        if (isSet(smtpPort)) {
            config.smtpPort = Integer.parseInt(smtpPort.trim());
        }

        String smtpUser = env.get("REMINDER_SMTP_USER");
        if (isSet(smtpUser)) {
            config.smtpUser = smtpUser.trim();
        }

        String smtpPassword = env.get("REMINDER_SMTP_PASSWORD");
        if (isSet(smtpPassword)) {
            config.smtpPassword = smtpPassword;
        }

        String smtpSecure = env.get("REMINDER_SMTP_SECURE");
        if (isSet(smtpSecure)) {
            config.smtpSecure = Boolean.parseBoolean(smtpSecure.trim());
        }

        String smtpFrom = env.get("REMINDER_SMTP_FROM");
        if (isSet(smtpFrom)) {
            config.smtpFrom = smtpFrom.trim();
        }

        String apiKey = env.get("REMINDER_API_KEY");
        if (isSet(apiKey)) {
            config.apiKey = apiKey;
        }

        return config;
    }

    /**
     * Accepts ISO-8601 durations ({@code PT90S}) or a plain number of seconds.
     */
    static Duration parseDuration(String name, String value) {
        String trimmed = value.trim();
        try {
            if (trimmed.chars().allMatch(Character::isDigit)) {
                return Duration.ofSeconds(Long.parseLong(trimmed));
            }
            return Duration.parse(trimmed);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException(name + " is not a duration: " + value);
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration fastTickInterval() {
        return fastTickInterval;
    }

    public LocalTime slowTickTimeOfDay() {
        return slowTickTimeOfDay;
    }

    public Duration slowTickInterval() {
        return slowTickInterval;
    }

    public boolean hasSlowTickInterval() {
        return slowTickInterval != null;
    }

    public ZoneId zone() {
        return zone;
    }

    public int dispatchThreads() {
        return dispatchThreads;
    }

    public Duration minRenotifyGap() {
        return minRenotifyGap;
    }

    public Duration inFlightReleaseDelay() {
        return inFlightReleaseDelay;
    }

    public Duration notifyTimeout() {
        return notifyTimeout;
    }

    public Duration repositoryTimeout() {
        return repositoryTimeout;
    }

    public Duration clockSkewTolerance() {
        return clockSkewTolerance;
    }

    public String webhookUrl() {
        return webhookUrl;
    }

    public boolean hasWebhookUrl() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    public String smtpHost() {
        return smtpHost;
    }

    public boolean hasSmtpHost() {
        return smtpHost != null && !smtpHost.isBlank();
    }

    public int smtpPort() {
        return smtpPort;
    }

    public String smtpUser() {
        return smtpUser;
    }

    public String smtpPassword() {
        return smtpPassword;
    }

    public boolean smtpSecure() {
        return smtpSecure;
    }

    /** Sender address; falls back to the SMTP user. */
    public String smtpFrom() {
        return smtpFrom != null ? smtpFrom : smtpUser;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    // Fluent setters for testing/customization
    public DispatcherConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public DispatcherConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public DispatcherConfig withFastTickInterval(Duration interval) {
        this.fastTickInterval = interval;
        return this;
    }

    public DispatcherConfig withSlowTickTimeOfDay(LocalTime timeOfDay) {
        this.slowTickTimeOfDay = timeOfDay;
        return this;
    }

    public DispatcherConfig withSlowTickInterval(Duration interval) {
        this.slowTickInterval = interval;
        return this;
    }

    public DispatcherConfig withZone(ZoneId zone) {
        this.zone = zone;
        return this;
    }

    public DispatcherConfig withMinRenotifyGap(Duration gap) {
        this.minRenotifyGap = gap;
        return this;
    }

    public DispatcherConfig withInFlightReleaseDelay(Duration delay) {
        this.inFlightReleaseDelay = delay;
        return this;
    }

    public DispatcherConfig withNotifyTimeout(Duration timeout) {
        this.notifyTimeout = timeout;
        return this;
    }

    public DispatcherConfig withClockSkewTolerance(Duration tolerance) {
        this.clockSkewTolerance = tolerance;
        return this;
    }

    public DispatcherConfig withWebhookUrl(String url) {
        this.webhookUrl = url;
        return this;
    }

    public DispatcherConfig withSmtp(String host, int port, String from) {
        this.smtpHost = host;
        this.smtpPort = port;
        this.smtpFrom = from;
        return this;
    }

    public DispatcherConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    @Override
    public String toString() {
        return "DispatcherConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", fastTick=" + fastTickInterval +
                ", slowTick=" + (hasSlowTickInterval() ? slowTickInterval : slowTickTimeOfDay + " " + zone) +
                ", minRenotifyGap=" + minRenotifyGap +
                ", inFlightReleaseDelay=" + inFlightReleaseDelay +
                ", webhookSet=" + hasWebhookUrl() +
                ", smtp=" + (hasSmtpHost() ? smtpHost + ":" + smtpPort : "-") +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
