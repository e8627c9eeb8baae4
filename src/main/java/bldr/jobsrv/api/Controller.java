package bldr.jobsrv.api;

import bldr.jobsrv.repository.StoreException;
import bldr.jobsrv.repository.TransitionConflictException;
import bldr.jobsrv.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.concurrent.CompletionException;

/**
 * An HTTP endpoint of the job server.
 *
 * <p>
 * The router asks each registered controller in turn whether it
 * {@link #matches} the request and lets the first match {@link #handle} it.
 * Errors are JSON objects with an {@code error} field; {@link
 * ControllerResponse#failure} is the one place that turns a scheduler or store
 * exception into a status code.
 */
public interface Controller {

    /**
     * @param path request path without query string
     */
    boolean matches(HttpMethod method, String path);

    /**
     * @param path request path without query string
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        private static final String JSON = "application/json";

        public static ControllerResponse json(String body) {
            return json(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, JSON, body);
        }

        public static ControllerResponse error(HttpResponseStatus status, String message) {
            String body = RouterHandler.mapper().createObjectNode()
                    .put("error", message == null ? "" : message)
                    .toString();
            return json(status, body);
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return error(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse forbidden(String message) {
            return error(HttpResponseStatus.FORBIDDEN, message);
        }

        public static ControllerResponse conflict(String message) {
            return error(HttpResponseStatus.CONFLICT, message);
        }

        public static ControllerResponse error(String message) {
            return error(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        /**
         * Map a failure from the scheduler or the store. A conflict that
         * outlived its retries is 409 and the client may resend; a store outage
         * is 503; anything else is 500 without internals in the body.
         */
        public static ControllerResponse failure(Throwable error) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            if (cause instanceof TransitionConflictException) {
                return conflict("concurrent update, retry later");
            }
            if (cause instanceof StoreException) {
                return error(HttpResponseStatus.SERVICE_UNAVAILABLE, "job store unavailable");
            }
            if (cause instanceof IllegalArgumentException) {
                return badRequest(cause.getMessage());
            }
            return error("internal error");
        }
    }
}
