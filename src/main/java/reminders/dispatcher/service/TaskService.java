package reminders.dispatcher.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.model.Cadence;
import reminders.dispatcher.model.Priority;
import reminders.dispatcher.model.Task;
import reminders.dispatcher.model.TaskDefinition;
import reminders.dispatcher.model.Visibility;
import reminders.dispatcher.repository.TaskRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Service layer for reminder authoring.
 * Validates submitted definitions and applies edit rules before persisting.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final TaskRepository taskRepository;
    private final Clock clock;

    public TaskService(TaskRepository taskRepository, Clock clock) {
        this.taskRepository = taskRepository;
        this.clock = clock;
    }

    /**
     * Create a new reminder. It starts unsent and never notified.
     */
    public Task createTask(TaskDefinition definition, String actor) {
        TaskDefinition valid = validate(definition);
        Instant now = clock.instant();

        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .name(valid.name())
                .description(valid.description())
                .priority(valid.priority())
                .triggerAt(valid.triggerAt())
                .cadence(valid.cadence())
                .recipients(valid.recipients())
                .visibility(valid.visibility())
                .createdBy(actor)
                .createdAt(now)
                .build();

        taskRepository.save(task);
        log.info("Task {} created by {} (trigger {}, cadence {})", task.id(), actor, task.triggerAt(),
                task.cadence());
        return task;
    }

    /**
     * Edit an existing reminder.
     *
     * @return the edited task, or empty if not found
     */
    public Optional<Task> updateTask(String taskId, TaskDefinition definition, String actor) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        TaskDefinition valid = validate(definition);

        Optional<Task> existing = taskRepository.findById(taskId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        Task revised = existing.get().revise(valid, actor, clock.instant());
        if (!taskRepository.update(revised)) {
            log.warn("Task {} disappeared while being edited", taskId);
            return Optional.empty();
        }

        // the stored notification state may have moved on since the read above
        Optional<Task> stored = taskRepository.findById(taskId);
        if (stored.isEmpty()) {
            log.warn("Task {} deleted right after being edited", taskId);
            return Optional.empty();
        }

        if (stored.get().sentOnce() && !existing.get().sentOnce()) {
            log.info("Task {} downgraded to one-shot after firing, marked as sent", taskId);
        }
        log.info("Task {} updated by {}", taskId, actor);
        return stored;
    }

    public boolean deleteTask(String taskId) {
        boolean deleted = taskRepository.delete(taskId);
        if (deleted) {
            log.info("Task {} deleted", taskId);
        }
        return deleted;
    }

    /**
     * Find a task as seen by {@code viewer}. A private task of another author is
     * reported as absent.
     */
    public Optional<Task> findById(String taskId, String viewer) {
        return taskRepository.findById(taskId).filter(task -> task.isVisibleTo(viewer));
    }

    /** Tasks visible to {@code viewer}, earliest trigger first. */
    public List<Task> listTasks(String viewer) {
        return taskRepository.findAll().stream()
                .filter(task -> task.isVisibleTo(viewer))
                .toList();
    }

    public int countTasks() {
        return taskRepository.count();
    }

    /**
     * Check required fields and fill defaults for priority and cadence.
     */
    static TaskDefinition validate(TaskDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("task definition is required");
        }
        if (definition.name() == null || definition.name().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (definition.triggerAt() == null) {
            throw new IllegalArgumentException("triggerAt is required");
        }
        if (!isValidEmailList(definition.recipients())) {
            throw new IllegalArgumentException("recipients must be a comma separated list of e-mail addresses");
        }

        return new TaskDefinition(
                definition.name().trim(),
                definition.description(),
                definition.priority() != null ? definition.priority() : Priority.MEDIUM,
                definition.triggerAt(),
                definition.cadence() != null ? definition.cadence() : Cadence.NONE,
                definition.recipients().trim(),
                definition.visibility() != null ? definition.visibility() : Visibility.PUBLIC);
    }

    static boolean isValidEmailList(String raw) {
        if (raw == null || raw.isBlank()) {
            return false;
        }
        List<String> parts = Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return !parts.isEmpty() && parts.stream().allMatch(p -> EMAIL.matcher(p).matches());
    }
}
