package reminders.dispatcher.service;

import org.junit.jupiter.api.*;
import reminders.dispatcher.config.DispatcherConfig;
import reminders.dispatcher.dispatch.DueSelector;
import reminders.dispatcher.model.Cadence;
import reminders.dispatcher.model.Priority;
import reminders.dispatcher.model.Task;
import reminders.dispatcher.model.TaskDefinition;
import reminders.dispatcher.model.Visibility;
import reminders.dispatcher.store.Database;
import reminders.dispatcher.store.JdbcTaskRepository;
import reminders.dispatcher.support.FaultyTaskRepository;
import reminders.dispatcher.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TaskServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private static Database db;
    private static JdbcTaskRepository repo;

    private FaultyTaskRepository faulty;
    private MutableClock clock;
    private TaskService service;

    @BeforeAll
    static void setup() {
        db = new Database(DispatcherConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-service;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        repo = new JdbcTaskRepository(db);
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
        clock = new MutableClock(NOW);
        faulty = new FaultyTaskRepository(repo);
        service = new TaskService(faulty, clock);
    }

    private static TaskDefinition definition(Cadence cadence, Instant triggerAt) {
        return new TaskDefinition("Standup notes", "post them", Priority.LOW, triggerAt, cadence,
                "dev@example.com");
    }

    @Test
    void createTask() {
        Task created = service.createTask(definition(Cadence.DAILY, NOW.plusSeconds(600)), "alice");

        assertNotNull(created.id());
        assertFalse(created.sentOnce());
        assertNull(created.lastNotifiedAt());
        assertEquals("alice", created.createdBy());
        assertEquals(NOW, created.createdAt());

        Task stored = service.findById(created.id(), null).orElseThrow();
        assertEquals(Cadence.DAILY, stored.cadence());
        assertEquals(Priority.LOW, stored.priority());
        assertEquals(1, service.countTasks());
    }

    @Test
    void createFillsDefaultsAndTrims() {
        Task created = service.createTask(
                new TaskDefinition("  Call mom ", null, null, NOW, null, " mom@example.com "), null);

        assertEquals("Call mom", created.name());
        assertEquals(Priority.MEDIUM, created.priority());
        assertEquals(Cadence.NONE, created.cadence());
        assertEquals("mom@example.com", created.recipients());
    }

    @Test
    void validationRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> service.createTask(null, null));
        assertThrows(IllegalArgumentException.class, () -> service.createTask(
                new TaskDefinition(" ", null, null, NOW, null, "a@b.io"), null));
        assertThrows(IllegalArgumentException.class, () -> service.createTask(
                new TaskDefinition("x", null, null, null, null, "a@b.io"), null));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> service.createTask(
                new TaskDefinition("x", null, null, NOW, null, "a@b.io, not-an-email"), null));
        assertTrue(e.getMessage().contains("recipients"));
        assertEquals(0, service.countTasks());
    }

    @Test
    void emailListValidation() {
        assertTrue(TaskService.isValidEmailList("a@b.io"));
        assertTrue(TaskService.isValidEmailList("a@b.io, c.d@e.co.uk"));
        assertFalse(TaskService.isValidEmailList(null));
        assertFalse(TaskService.isValidEmailList(" , "));
        assertFalse(TaskService.isValidEmailList("a@b"));
        assertFalse(TaskService.isValidEmailList("a b@c.io"));
    }

    @Test
    @DisplayName("Downgrading a fired recurring task to one-shot never re-arms it")
    void cadenceDowngradeRatchet() {
        Task created = service.createTask(definition(Cadence.DAILY, NOW.minusSeconds(3600)), "alice");
        repo.recordNotification(created.id(), NOW.minusSeconds(600));

        Optional<Task> edited = service.updateTask(created.id(), definition(Cadence.NONE, NOW.minusSeconds(3600)),
                "bob");

        assertTrue(edited.isPresent());
        Task stored = service.findById(created.id(), null).orElseThrow();
        assertEquals(Cadence.NONE, stored.cadence());
        assertTrue(stored.sentOnce());
        assertEquals("bob", stored.updatedBy());
        assertEquals(NOW, stored.updatedAt());

        DueSelector selector = new DueSelector(repo, Duration.ZERO, Duration.ZERO, ZoneOffset.UTC);
        assertTrue(selector.selectDue(NOW.plus(Duration.ofDays(30))).isEmpty());
    }

    @Test
    void downgradeOfUnfiredTaskStaysArmed() {
        Task created = service.createTask(definition(Cadence.WEEKLY, NOW.minusSeconds(60)), null);

        Task edited = service.updateTask(created.id(), definition(Cadence.NONE, NOW.minusSeconds(60)), null)
                .orElseThrow();

        assertFalse(edited.sentOnce());
        DueSelector selector = new DueSelector(repo, Duration.ZERO, Duration.ZERO, ZoneOffset.UTC);
        assertEquals(1, selector.selectDue(NOW).size());
    }

    @Test
    void updateMissingTask() {
        assertTrue(service.updateTask("missing", definition(Cadence.NONE, NOW), null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> service.updateTask(" ", definition(Cadence.NONE, NOW), null));
    }

    @Test
    void deleteTask() {
        Task created = service.createTask(definition(Cadence.NONE, NOW), null);

        assertTrue(service.deleteTask(created.id()));
        assertFalse(service.deleteTask(created.id()));
        assertTrue(service.listTasks(null).isEmpty());
    }

    @Test
    @DisplayName("A notification recorded while an edit is in progress survives the edit")
    void editKeepsConcurrentlyRecordedNotification() {
        Task created = service.createTask(definition(Cadence.NONE, NOW.minusSeconds(60)), "alice");
        faulty.afterNextFind(() -> repo.recordNotification(created.id(), NOW));

        Task edited = service.updateTask(created.id(),
                new TaskDefinition("Standup notes v2", "post them", Priority.HIGH, NOW.minusSeconds(60),
                        Cadence.NONE, "dev@example.com"), "bob").orElseThrow();

        assertTrue(edited.sentOnce());
        assertEquals(NOW, edited.lastNotifiedAt());
        assertEquals("Standup notes v2", edited.name());
        Task stored = repo.findById(created.id()).orElseThrow();
        assertTrue(stored.sentOnce());
        assertEquals(NOW, stored.lastNotifiedAt());

        DueSelector selector = new DueSelector(repo, Duration.ZERO, Duration.ZERO, ZoneOffset.UTC);
        assertTrue(selector.selectDue(NOW.plus(Duration.ofDays(30))).isEmpty());
    }

    @Test
    void downgradeRacingFirstNotificationStillRatchets() {
        Task created = service.createTask(definition(Cadence.DAILY, NOW.minusSeconds(60)), "alice");
        // read before the first notification, written after it
        faulty.afterNextFind(() -> repo.recordNotification(created.id(), NOW));

        Task edited = service.updateTask(created.id(), definition(Cadence.NONE, NOW.minusSeconds(60)), "bob")
                .orElseThrow();

        assertEquals(Cadence.NONE, edited.cadence());
        assertTrue(edited.sentOnce());
        assertEquals(NOW, edited.lastNotifiedAt());
    }

    @Test
    @DisplayName("Moving a daily task's trigger does not reopen its cadence window")
    void triggerEditKeepsCadenceWindow() {
        Task created = service.createTask(definition(Cadence.DAILY, NOW.minusSeconds(60)), "alice");
        repo.recordNotification(created.id(), NOW);

        clock.advance(Duration.ofSeconds(30));
        Task edited = service.updateTask(created.id(), definition(Cadence.DAILY, NOW.plusSeconds(10)), "alice")
                .orElseThrow();
        assertEquals(NOW, edited.lastNotifiedAt());

        DueSelector selector = new DueSelector(repo, Duration.ZERO, Duration.ZERO, ZoneOffset.UTC);
        assertTrue(selector.selectDue(NOW.plusSeconds(40)).isEmpty());
        assertEquals(1, selector.selectDue(NOW.plus(Duration.ofDays(1))).size());
    }

    @Test
    void privateTasksAreVisibleToTheirCreatorOnly() {
        Task mine = service.createTask(new TaskDefinition("Dentist", null, null, NOW, null, "a@b.io",
                Visibility.PRIVATE), "alice");
        Task shared = service.createTask(definition(Cadence.NONE, NOW), "bob");

        assertEquals(2, service.listTasks("alice").size());
        assertEquals(List.of(shared.id()), service.listTasks("bob").stream().map(Task::id).toList());
        assertEquals(List.of(shared.id()), service.listTasks(null).stream().map(Task::id).toList());

        assertTrue(service.findById(mine.id(), "alice").isPresent());
        assertTrue(service.findById(mine.id(), "bob").isEmpty());
        assertTrue(service.findById(mine.id(), null).isEmpty());
        assertEquals(Visibility.PRIVATE, repo.findById(mine.id()).orElseThrow().visibility());
    }

    @Test
    void editChangesVisibility() {
        Task created = service.createTask(definition(Cadence.NONE, NOW), "alice");

        service.updateTask(created.id(), new TaskDefinition("Standup notes", null, null, NOW, null,
                "dev@example.com", Visibility.PRIVATE), "alice");

        assertEquals(Visibility.PRIVATE, repo.findById(created.id()).orElseThrow().visibility());
        assertTrue(service.listTasks("carol").isEmpty());
    }
}
