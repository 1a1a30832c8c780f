package reminders.dispatcher.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.api.Controller;
import reminders.dispatcher.api.v1.dto.HealthResponse;
import reminders.dispatcher.dispatch.InFlightGuard;
import reminders.dispatcher.scheduler.Scheduler;
import reminders.dispatcher.server.RouterHandler;
import reminders.dispatcher.service.TaskService;
import reminders.dispatcher.store.Database;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final TaskService taskService;
    private final Scheduler scheduler;
    private final InFlightGuard inFlightGuard;

    public HealthController(Database database, TaskService taskService, Scheduler scheduler,
            InFlightGuard inFlightGuard) {
        this.database = database;
        this.taskService = taskService;
        this.scheduler = scheduler;
        this.inFlightGuard = inFlightGuard;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                HealthResponse response = HealthResponse.unhealthy("connection failed");
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(), VERSION, scheduler.isRunning(), taskService.countTasks(), inFlightGuard.size());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.unavailable("health check failed: " + e.getMessage());
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
