package reminders.dispatcher.dispatch;

import org.junit.jupiter.api.*;
import reminders.dispatcher.config.DispatcherConfig;
import reminders.dispatcher.model.Cadence;
import reminders.dispatcher.model.Priority;
import reminders.dispatcher.model.Task;
import reminders.dispatcher.notify.Notifier;
import reminders.dispatcher.repository.RepositoryException;
import reminders.dispatcher.store.Database;
import reminders.dispatcher.store.JdbcTaskRepository;
import reminders.dispatcher.support.FaultyTaskRepository;
import reminders.dispatcher.support.MutableClock;
import reminders.dispatcher.support.RecordingListener;
import reminders.dispatcher.support.RecordingNotifier;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DispatchLoopTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final Duration GAP = Duration.ofMinutes(2);

    private static Database db;
    private static JdbcTaskRepository jdbcRepo;

    private FaultyTaskRepository repo;
    private MutableClock clock;
    private RecordingNotifier notifier;
    private RecordingListener listener;
    private InFlightGuard guard;
    private DispatchLoop loop;

    @BeforeAll
    static void setup() {
        db = new Database(DispatcherConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-dispatch;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        jdbcRepo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setUp() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
        repo = new FaultyTaskRepository(jdbcRepo);
        clock = new MutableClock(NOW);
        notifier = new RecordingNotifier();
        listener = new RecordingListener();
        guard = new InFlightGuard(Duration.ZERO);
        loop = newLoop(notifier, guard, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        loop.close();
        guard.close();
    }

    private DispatchLoop newLoop(Notifier notifier, InFlightGuard guard, Duration notifyTimeout) {
        DueSelector selector = new DueSelector(repo, GAP, Duration.ZERO, ZoneOffset.UTC);
        return new DispatchLoop(selector, guard, notifier, repo, notifyTimeout, clock, listener);
    }

    private Task save(Task.Builder builder) {
        Task task = builder.recipients("team@example.com").createdAt(NOW.minus(Duration.ofDays(30))).build();
        repo.save(task);
        return task;
    }

    private Task reload(String id) {
        return repo.findById(id).orElseThrow();
    }

    @Test
    @DisplayName("One-shot task: notified on the first tick, never selected again")
    void oneShotScenario() {
        save(Task.builder().id("once").name("once").triggerAt(NOW.minusSeconds(60)));

        TickReport first = loop.tick("fast-tick");

        assertEquals(1, first.selected());
        assertEquals(1, first.notified());
        assertTrue(reload("once").sentOnce());
        assertEquals(NOW, reload("once").lastNotifiedAt());

        clock.advance(Duration.ofDays(3));
        TickReport second = loop.tick("fast-tick");

        assertEquals(0, second.selected());
        assertEquals(1, notifier.count("once"));
    }

    @Test
    @DisplayName("Daily task: renotified only after a full period")
    void dailyScenario() {
        save(Task.builder().id("daily").name("daily").cadence(Cadence.DAILY)
                .triggerAt(NOW.minus(Duration.ofHours(1)))
                .lastNotifiedAt(NOW.minus(Duration.ofHours(25))));

        TickReport first = loop.tick("fast-tick");
        assertEquals(1, first.notified());
        assertEquals(NOW, reload("daily").lastNotifiedAt());
        assertFalse(reload("daily").sentOnce());

        clock.advance(Duration.ofSeconds(5));
        assertEquals(0, loop.tick("fast-tick").selected());

        clock.advance(Duration.ofHours(25));
        TickReport later = loop.tick("slow-tick");
        assertEquals(1, later.notified());
        assertEquals(2, notifier.count("daily"));
        assertEquals(clock.instant(), reload("daily").lastNotifiedAt());
    }

    @Test
    @DisplayName("Overlapping ticks: one acquires the guard, the other skips, one delivery")
    void overlappingTicksScenario() throws Exception {
        save(Task.builder().id("7").name("seven").triggerAt(NOW.minusSeconds(60)));

        InFlightGuard holdingGuard = new InFlightGuard(Duration.ofSeconds(5));
        DispatchLoop blockingLoop = newLoop(notifier, holdingGuard, Duration.ofSeconds(10));
        CountDownLatch gate = notifier.blockDeliveries();
        ExecutorService other = Executors.newSingleThreadExecutor();

        try {
            Future<TickReport> firstTick = other.submit(() -> blockingLoop.tick("fast-tick"));
            assertTrue(notifier.entered().await(5, TimeUnit.SECONDS));

            TickReport secondTick = blockingLoop.tick("slow-tick");
            assertEquals(1, secondTick.selected());
            assertEquals(1, secondTick.skippedInFlight());
            assertEquals(0, secondTick.notified());

            gate.countDown();
            TickReport first = firstTick.get(5, TimeUnit.SECONDS);
            assertEquals(1, first.notified());

            // id still held after the commit; once released, the recorded state keeps it unselected
            assertTrue(holdingGuard.isInFlight("7"));
            holdingGuard.release("7");
            assertEquals(0, blockingLoop.tick("fast-tick").selected());
        } finally {
            gate.countDown();
            other.shutdownNow();
            blockingLoop.close();
            holdingGuard.close();
        }

        assertEquals(1, notifier.count("7"));
        assertTrue(listener.events().contains("skipped:7"));
    }

    @Test
    @DisplayName("Notifier failure leaves the task untouched for the next tick")
    void notifierFailureDoesNotMutateState() {
        save(Task.builder().id("flaky").name("flaky").triggerAt(NOW.minusSeconds(60)));
        save(Task.builder().id("daily").name("daily").cadence(Cadence.DAILY).triggerAt(NOW.minusSeconds(60))
                .lastNotifiedAt(NOW.minus(Duration.ofDays(2))));
        notifier.failFor("flaky");
        notifier.failFor("daily");

        TickReport report = loop.tick("fast-tick");

        assertEquals(2, report.failed());
        assertEquals(0, report.notified());
        Task flaky = reload("flaky");
        assertFalse(flaky.sentOnce());
        assertNull(flaky.lastNotifiedAt());
        assertEquals(NOW.minus(Duration.ofDays(2)), reload("daily").lastNotifiedAt());

        notifier.recover("flaky");
        clock.advance(Duration.ofMinutes(1));
        TickReport retry = loop.tick("fast-tick");

        assertEquals(1, retry.notified());
        assertTrue(reload("flaky").sentOnce());
    }

    @Test
    void recordFailureIsReportedAndLoopContinues() {
        save(Task.builder().id("a").name("a").priority(Priority.HIGH).triggerAt(NOW.minusSeconds(60)));
        save(Task.builder().id("b").name("b").priority(Priority.LOW).triggerAt(NOW.minusSeconds(60)));
        repo.failRecording("a", RepositoryException.transientFailure("connection reset", null));

        TickReport report = loop.tick("fast-tick");

        assertEquals(2, report.selected());
        assertEquals(1, report.recordFailed());
        assertEquals(1, report.notified());
        assertFalse(reload("a").sentOnce());
        assertTrue(reload("b").sentOnce());
        assertEquals(List.of("a", "b"), notifier.delivered());
        assertTrue(listener.events().contains("record-failed:a"));
    }

    @Test
    void unreadableDueListAbortsTick() {
        save(Task.builder().id("a").name("a").triggerAt(NOW.minusSeconds(60)));
        repo.failListing(RepositoryException.transientFailure("pool exhausted", null));

        TickReport report = loop.tick("fast-tick");

        assertTrue(report.isAborted());
        assertEquals("pool exhausted", report.error());
        assertTrue(notifier.delivered().isEmpty());
        assertEquals(List.of("aborted:fast-tick"), listener.events());

        repo.heal();
        assertEquals(1, loop.tick("fast-tick").notified());
    }

    @Test
    void slowNotifierTimesOut() {
        save(Task.builder().id("slow").name("slow").triggerAt(NOW.minusSeconds(60)));
        CountDownLatch gate = notifier.blockDeliveries();
        DispatchLoop impatient = newLoop(notifier, guard, Duration.ofMillis(200));

        try {
            TickReport report = impatient.tick("fast-tick");

            assertEquals(1, report.failed());
            assertFalse(reload("slow").sentOnce());
            assertTrue(listener.events().contains("notify-failed:slow"));
        } finally {
            gate.countDown();
            impatient.close();
        }
    }

    @Test
    void notifierRuntimeErrorCountsAsFailure() {
        save(Task.builder().id("boom").name("boom").triggerAt(NOW.minusSeconds(60)));
        DispatchLoop broken = newLoop(task -> {
            throw new IllegalStateException("template missing");
        }, guard, Duration.ofSeconds(5));

        try {
            TickReport report = broken.tick("fast-tick");

            assertEquals(1, report.failed());
            assertFalse(guard.isInFlight("boom"));
            assertNull(reload("boom").lastNotifiedAt());
        } finally {
            broken.close();
        }
    }

    @Test
    void emptyTick() {
        save(Task.builder().id("later").name("later").triggerAt(NOW.plusSeconds(3600)));

        TickReport report = loop.tick("fast-tick");

        assertEquals(0, report.selected());
        assertFalse(report.isAborted());
        assertTrue(listener.events().isEmpty());
    }

    @Test
    void deliveryOrderFollowsDispatchOrder() {
        save(Task.builder().id("once-high").name("x").priority(Priority.HIGH).triggerAt(NOW.minusSeconds(60)));
        save(Task.builder().id("weekly").name("x").cadence(Cadence.WEEKLY).triggerAt(NOW.minusSeconds(60)));
        save(Task.builder().id("daily").name("x").cadence(Cadence.DAILY).triggerAt(NOW.minusSeconds(60)));

        loop.tick("fast-tick");

        assertEquals(List.of("daily", "weekly", "once-high"), notifier.delivered());
    }

    @Test
    @DisplayName("A corrupt row is skipped, the rest of the tick still dispatches")
    void corruptRowDoesNotAbortTick() throws Exception {
        save(Task.builder().id("good").name("good").triggerAt(NOW.minusSeconds(60)));
        save(Task.builder().id("bad").name("bad").triggerAt(NOW.minusSeconds(60)));
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("UPDATE tasks SET cadence = 'HOURLY' WHERE id = 'bad'");
            conn.commit();
        }

        TickReport report = loop.tick("fast-tick");

        assertFalse(report.isAborted());
        assertEquals(1, report.selected());
        assertEquals(1, report.notified());
        assertEquals(List.of("good"), notifier.delivered());
    }

    @Test
    @DisplayName("A tick holding a due list read before another tick's commit skips the task")
    void staleDueListIsRecheckedAfterClaim() throws Exception {
        save(Task.builder().id("once").name("once").triggerAt(NOW.minusSeconds(60)));

        CountDownLatch listed = new CountDownLatch(1);
        CountDownLatch resume = new CountDownLatch(1);
        repo.afterNextListing(() -> {
            listed.countDown();
            try {
                resume.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        ExecutorService other = Executors.newSingleThreadExecutor();

        try {
            Future<TickReport> lagging = other.submit(() -> loop.tick("slow-tick"));
            assertTrue(listed.await(5, TimeUnit.SECONDS));

            TickReport first = loop.tick("fast-tick");
            assertEquals(1, first.notified());
            assertFalse(guard.isInFlight("once"));

            resume.countDown();
            TickReport late = lagging.get(5, TimeUnit.SECONDS);

            assertEquals(1, late.selected());
            assertEquals(1, late.skippedStale());
            assertEquals(0, late.notified());
        } finally {
            resume.countDown();
            other.shutdownNow();
        }

        assertEquals(1, notifier.count("once"));
        assertTrue(listener.events().contains("stale:once"));
    }

    @Test
    void taskDeletedAfterListingIsSkipped() {
        save(Task.builder().id("gone").name("gone").triggerAt(NOW.minusSeconds(60)));
        repo.afterNextListing(() -> repo.delete("gone"));

        TickReport report = loop.tick("fast-tick");

        assertEquals(1, report.skippedStale());
        assertTrue(notifier.delivered().isEmpty());
    }

    @Test
    void editedTriggerIsHonouredAtDispatch() {
        Task task = save(Task.builder().id("moved").name("moved").triggerAt(NOW.minusSeconds(60)));
        repo.afterNextListing(() -> repo.update(task.toBuilder().triggerAt(NOW.plusSeconds(3600)).build()));

        TickReport report = loop.tick("fast-tick");

        assertEquals(1, report.skippedStale());
        assertEquals(0, notifier.count("moved"));
        assertNull(reload("moved").lastNotifiedAt());
    }
}
