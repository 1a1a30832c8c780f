package reminders.dispatcher.api;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * An HTTP endpoint group of the reminder API.
 * <p>
 * The router offers each request to its controllers in registration order and the
 * first one whose {@link #matches} accepts it produces the response. Controllers turn
 * their own failures into error responses; anything they throw is answered by the
 * router.
 */
public interface Controller {

    /**
     * @param path request path without the query string
     */
    boolean matches(HttpMethod method, String path);

    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Status and JSON body to send back. Error bodies are {@code {"error": "..."}}.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        static final String JSON = "application/json";

        public static ControllerResponse json(String body) {
            return json(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, JSON, body);
        }

        public static ControllerResponse noContent() {
            return new ControllerResponse(HttpResponseStatus.NO_CONTENT, JSON, "");
        }

        public static ControllerResponse failure(HttpResponseStatus status, String message) {
            return json(status, errorBody(message));
        }

        public static ControllerResponse notFound(String message) {
            return failure(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return failure(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return failure(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        public static ControllerResponse unavailable(String message) {
            return failure(HttpResponseStatus.SERVICE_UNAVAILABLE, message);
        }

        /** {@code {"error": message}}, with the message JSON-escaped. */
        public static String errorBody(String message) {
            return JsonNodeFactory.instance.objectNode()
                    .put("error", message != null ? message : "")
                    .toString();
        }
    }
}
