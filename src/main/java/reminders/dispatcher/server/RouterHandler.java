package reminders.dispatcher.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.api.Controller;
import reminders.dispatcher.api.Controller.ControllerResponse;
import reminders.dispatcher.config.DispatcherConfig;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Routes reminder API requests to the registered controllers.
 * <p>
 * When an API key is configured every path except the health check requires it in
 * {@value #API_KEY_HEADER}. A request no controller accepts gets 404, a controller
 * that throws {@link IllegalArgumentException} gets 400 and anything else 500.
 * Stateless across channels, hence {@code @Sharable}.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .findAndRegisterModules();

    static final String API_KEY_HEADER = "X-Reminder-Key";
    private static final String HEALTH_PATH = "/api/v1/health";

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();
    private final DispatcherConfig config;

    public RouterHandler(DispatcherConfig config) {
        this.config = config;
    }

    /** JSON mapper shared by the controllers; writes instants as ISO-8601 text. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Route group {} registered", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String path = new QueryStringDecoder(req.uri()).path();
        send(ctx, route(ctx, req, path));
    }

    ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (!authorized(req, path)) {
            log.warn("Rejected {} {}: missing or wrong API key", req.method(), path);
            return ControllerResponse.failure(HttpResponseStatus.FORBIDDEN, "forbidden");
        }

        Controller controller = controllers.stream()
                .filter(c -> c.matches(req.method(), path))
                .findFirst()
                .orElse(null);
        if (controller == null) {
            log.debug("No route for {} {}", req.method(), path);
            return ControllerResponse.notFound("not found");
        }

        try {
            return controller.handle(ctx, req, path);
        } catch (IllegalArgumentException e) {
            log.warn("{} {} rejected: {}", req.method(), path, e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} {} failed in {}", req.method(), path, controller.getClass().getSimpleName(), e);
            return ControllerResponse.error("internal error");
        }
    }

    private boolean authorized(FullHttpRequest req, String path) {
        if (!config.hasApiKey() || HEALTH_PATH.equals(path)) {
            return true;
        }
        return config.apiKey().equals(req.headers().get(API_KEY_HEADER));
    }

    private static void send(ChannelHandlerContext ctx, ControllerResponse response) {
        String body = response.body() != null ? response.body() : "";
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);

        FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                Unpooled.wrappedBuffer(bytes));
        http.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, response.contentType() + "; charset=utf-8")
                .setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(http).addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Closing channel {} after error", ctx.channel().remoteAddress(), cause);
        if (ctx.channel().isActive()) {
            send(ctx, ControllerResponse.error("channel error"));
        }
        ctx.close();
    }
}
