package reminders;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.config.Dependencies;
import reminders.dispatcher.config.DispatcherConfig;
import reminders.dispatcher.server.DispatcherHttpServer;

import java.util.concurrent.CountDownLatch;

/**
 * Application entry point.
 *
 * Starts the HTTP API before the dispatch timers so tasks can be managed as soon as
 * the first tick fires, and tears both down on JVM shutdown.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        DispatcherConfig config = DispatcherConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        DispatcherHttpServer server = new DispatcherHttpServer(deps.routerHandler());

        try {
            server.start(config.serverHost(), config.serverPort());
        } catch (RuntimeException e) {
            log.error("Failed to start HTTP server on port {}", config.serverPort(), e);
            deps.close();
            System.exit(1);
            return;
        }

        deps.startScheduler();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Application closing, stopping server...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "reminder-shutdown"));

        log.info("Reminder dispatcher started");
        stopped.await();
    }
}
