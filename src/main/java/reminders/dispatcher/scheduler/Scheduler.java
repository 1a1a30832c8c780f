package reminders.dispatcher.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.config.DispatcherConfig;
import reminders.dispatcher.dispatch.DispatchLoop;
import reminders.dispatcher.dispatch.TickReport;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives the dispatch loop from two independent timers:
 * - fast tick: prompt delivery of one-shot and short-cadence reminders
 * - slow tick: daily catch-up for longer cadences
 *
 * Timers run on a single scheduling thread; every firing hands one dispatch pass to a
 * worker pool, so passes from the two timers may overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    public static final String FAST_TICK = "fast-tick";
    public static final String SLOW_TICK = "slow-tick";

    private final ScheduledExecutorService executor;
    private final ExecutorService dispatchPool;
    private final DispatchLoop dispatchLoop;
    private final Ticker fastTicker;
    private final Ticker slowTicker;
    private final Clock clock;

    private volatile boolean running = false;

    public Scheduler(DispatchLoop dispatchLoop, DispatcherConfig config, Clock clock) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reminder-scheduler");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger threadCount = new AtomicInteger();
        this.dispatchPool = Executors.newFixedThreadPool(config.dispatchThreads(), r -> {
            Thread t = new Thread(r, "reminder-dispatch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.dispatchLoop = dispatchLoop;
        this.clock = clock;

        this.fastTicker = new Ticker(FAST_TICK, TickSchedule.every(config.fastTickInterval()),
                () -> submitTick(FAST_TICK), clock);

        TickSchedule slowSchedule = config.hasSlowTickInterval()
                ? TickSchedule.every(config.slowTickInterval())
                : TickSchedule.dailyAt(config.slowTickTimeOfDay(), config.zone());
        this.slowTicker = new Ticker(SLOW_TICK, slowSchedule, () -> submitTick(SLOW_TICK), clock);
    }

    /**
     * Start both timers.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        if (executor.isShutdown()) {
            throw new IllegalStateException("Scheduler was stopped and cannot be restarted");
        }

        running = true;

        fastTicker.start(executor);
        log.info("Fast tick scheduled: {}", fastTicker.schedule());

        slowTicker.start(executor);
        log.info("Slow tick scheduled: {}", slowTicker.schedule());

        log.info("Scheduler started");
    }

    /**
     * Stop the timers and wait briefly for running dispatch passes.
     */
    public synchronized void stop() {
        if (executor.isShutdown()) {
            return;
        }

        running = false;
        fastTicker.cancel();
        slowTicker.cancel();
        executor.shutdown();
        dispatchPool.shutdown();

        try {
            if (!dispatchPool.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatchPool.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
            executor.shutdownNow();
        } catch (InterruptedException e) {
            dispatchPool.shutdownNow();
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Check if scheduler is running.
     */
    public boolean isRunning() {
        return running;
    }

    public Ticker fastTicker() {
        return fastTicker;
    }

    public Ticker slowTicker() {
        return slowTicker;
    }

    /**
     * Queue one dispatch pass on the worker pool.
     *
     * @param trigger name reported in logs and in the tick report
     */
    public Future<TickReport> submitTick(String trigger) {
        return dispatchPool.submit(() -> runTick(trigger));
    }

    private TickReport runTick(String trigger) {
        try {
            return dispatchLoop.tick(trigger);
        } catch (Exception e) {
            log.error("{} error", trigger, e);
            return TickReport.aborted(trigger, clock.instant(), e.toString());
        }
    }
}
