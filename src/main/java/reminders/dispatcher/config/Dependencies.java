package reminders.dispatcher.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.api.v1.DispatchController;
import reminders.dispatcher.api.v1.HealthController;
import reminders.dispatcher.api.v1.TaskController;
import reminders.dispatcher.dispatch.DispatchListener;
import reminders.dispatcher.dispatch.DispatchLoop;
import reminders.dispatcher.dispatch.DueSelector;
import reminders.dispatcher.dispatch.InFlightGuard;
import reminders.dispatcher.notify.LoggingNotifier;
import reminders.dispatcher.notify.Notifier;
import reminders.dispatcher.notify.SmtpNotifier;
import reminders.dispatcher.notify.WebhookNotifier;
import reminders.dispatcher.repository.TaskRepository;
import reminders.dispatcher.scheduler.Scheduler;
import reminders.dispatcher.server.RouterHandler;
import reminders.dispatcher.service.TaskService;
import reminders.dispatcher.store.Database;
import reminders.dispatcher.store.JdbcTaskRepository;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(DispatcherConfig.fromEnv());
 * deps.startScheduler(); // start the dispatch timers
 * TaskService taskService = deps.taskService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final DispatcherConfig config;
    private final Clock clock;
    private final Database database;
    private final TaskRepository taskRepository;
    private final TaskService taskService;
    private final Notifier notifier;
    private final InFlightGuard inFlightGuard;
    private final DispatchLoop dispatchLoop;
    private final Scheduler scheduler;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;
    private final DispatchController dispatchController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(DispatcherConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.taskRepository = new JdbcTaskRepository(database);

        // Services
        this.taskService = new TaskService(taskRepository, clock);

        // Dispatch
        this.notifier = createNotifier(config);
        this.inFlightGuard = new InFlightGuard(config.inFlightReleaseDelay());
        this.dispatchLoop = new DispatchLoop(
                new DueSelector(taskRepository, config),
                inFlightGuard,
                notifier,
                taskRepository,
                config.notifyTimeout(),
                clock,
                DispatchListener.NOOP);
        this.scheduler = new Scheduler(dispatchLoop, config, clock);

        // Controllers
        this.healthController = new HealthController(database, taskService, scheduler, inFlightGuard);
        this.taskController = new TaskController(taskService, config.zone());
        this.dispatchController = new DispatchController(dispatchLoop);

        log.info("Dependencies initialized successfully (notifier: {})", notifier.getClass().getSimpleName());
    }

    /**
     * E-mail when an SMTP host is configured, else the webhook, else the log.
     */
    static Notifier createNotifier(DispatcherConfig config) {
        if (config.hasSmtpHost()) {
            return new SmtpNotifier(config);
        }
        if (config.hasWebhookUrl()) {
            return new WebhookNotifier(config.webhookUrl(), config.notifyTimeout(), config.zone());
        }
        return new LoggingNotifier(config.zone());
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(DispatcherConfig config) {
        return create(config, Clock.systemUTC());
    }

    /**
     * Create dependencies with the given config and time source.
     */
    public static Dependencies create(DispatcherConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(DispatcherConfig.fromEnv());
    }

    // Getters
    public DispatcherConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public TaskService taskService() {
        return taskService;
    }

    public Notifier notifier() {
        return notifier;
    }

    public InFlightGuard inFlightGuard() {
        return inFlightGuard;
    }

    public DispatchLoop dispatchLoop() {
        return dispatchLoop;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(taskController)
                    .registerController(dispatchController);
            log.info("RouterHandler created with {} controllers", 3);
        }
        return routerHandler;
    }

    /**
     * Start the fast and slow dispatch timers.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler.start();
    }

    public void stopScheduler() {
        scheduler.stop();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop timers first so no new pass starts
        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            dispatchLoop.close();
        } catch (Exception e) {
            log.warn("Error closing dispatch loop: {}", e.getMessage());
        }

        try {
            inFlightGuard.close();
        } catch (Exception e) {
            log.warn("Error closing in-flight guard: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
