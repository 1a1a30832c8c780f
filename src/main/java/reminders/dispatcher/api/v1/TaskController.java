package reminders.dispatcher.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.api.Controller;
import reminders.dispatcher.api.v1.dto.TaskRequest;
import reminders.dispatcher.api.v1.dto.TaskResponse;
import reminders.dispatcher.model.Task;
import reminders.dispatcher.repository.RepositoryException;
import reminders.dispatcher.server.RouterHandler;
import reminders.dispatcher.service.TaskService;

import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for reminder task management.
 *
 * GET /api/v1/tasks - List tasks
 * POST /api/v1/tasks - Create a task
 * GET /api/v1/tasks/{taskId} - Get a task
 * PUT /api/v1/tasks/{taskId} - Edit a task
 * DELETE /api/v1/tasks/{taskId} - Delete a task
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    /** Optional header naming the author of a change, also the viewer of private tasks */
    static final String ACTOR_HEADER = "X-Reminder-User";

    private final TaskService taskService;
    private final ZoneId zone;

    public TaskController(TaskService taskService, ZoneId zone) {
        this.taskService = taskService;
        this.zone = zone;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (TASKS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (TASK_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT)
                    || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HttpMethod method = req.method();

            if (TASKS_PATTERN.matcher(path).matches()) {
                return method.equals(HttpMethod.POST) ? handleCreate(req) : handleList(req);
            }

            Matcher byId = TASK_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                String taskId = byId.group(1);
                if (method.equals(HttpMethod.GET)) {
                    return handleGet(taskId, req);
                }
                if (method.equals(HttpMethod.PUT)) {
                    return handleUpdate(taskId, req);
                }
                return handleDelete(taskId);
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (RepositoryException e) {
            log.error("Task storage error ({})", e.kind(), e);
            return e.isTransient()
                    ? ControllerResponse.unavailable("storage temporarily unavailable")
                    : ControllerResponse.error("storage error");
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        List<TaskResponse> tasks = taskService.listTasks(actor(req)).stream()
                .map(TaskResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(tasks));
    }

    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        TaskRequest request = readRequest(req);
        Task task = taskService.createTask(request.toDefinition(zone), actor(req));
        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
    }

    private ControllerResponse handleGet(String taskId, FullHttpRequest req) throws Exception {
        Optional<Task> task = taskService.findById(taskId, actor(req));
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task.get())));
    }

    private ControllerResponse handleUpdate(String taskId, FullHttpRequest req) throws Exception {
        TaskRequest request = readRequest(req);
        Optional<Task> updated = taskService.updateTask(taskId, request.toDefinition(zone), actor(req));
        if (updated.isEmpty()) {
            return ControllerResponse.notFound("task not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(updated.get())));
    }

    private ControllerResponse handleDelete(String taskId) {
        if (!taskService.deleteTask(taskId)) {
            return ControllerResponse.notFound("task not found");
        }
        return ControllerResponse.noContent();
    }

    private static TaskRequest readRequest(FullHttpRequest req) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        try {
            return RouterHandler.mapper().readValue(body, TaskRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed task JSON: " + e.getOriginalMessage());
        }
    }

    private static String actor(FullHttpRequest req) {
        String actor = req.headers().get(ACTOR_HEADER);
        return actor == null || actor.isBlank() ? null : actor.trim();
    }
}
