package reminders.dispatcher.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.api.Controller;
import reminders.dispatcher.dispatch.DispatchLoop;
import reminders.dispatcher.dispatch.TickReport;
import reminders.dispatcher.server.RouterHandler;

/**
 * Manual dispatch trigger.
 * POST /api/v1/dispatch/tick - run one dispatch pass now and return its report
 */
public class DispatchController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(DispatchController.class);

    static final String MANUAL_TRIGGER = "manual";

    private final DispatchLoop dispatchLoop;

    public DispatchController(DispatchLoop dispatchLoop) {
        this.dispatchLoop = dispatchLoop;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/api/v1/dispatch/tick".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            TickReport report = dispatchLoop.tick(MANUAL_TRIGGER);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(report));
        } catch (Exception e) {
            log.error("Manual dispatch failed", e);
            return ControllerResponse.error("dispatch failed");
        }
    }
}
