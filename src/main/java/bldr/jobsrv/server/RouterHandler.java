package bldr.jobsrv.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import bldr.jobsrv.api.Controller;
import bldr.jobsrv.api.Controller.ControllerResponse;
import bldr.jobsrv.config.JobServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Routes job server requests to controllers.
 *
 * <p>
 * Two route families exist:
 * <ul>
 * <li>{@code /api/v1/*} for clients submitting and watching groups</li>
 * <li>{@code /internal/v1/*} for workers sending heartbeats and reports; when a
 * worker key is configured these need it in {@value #WORKER_KEY_HEADER}</li>
 * </ul>
 * Anything else is 404 without consulting the controllers. A controller that
 * throws gets its failure mapped by {@link ControllerResponse#failure}.
 *
 * <p>
 * Sharable: the only state is the controller list, fixed before the server
 * starts.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    public static final String WORKER_KEY_HEADER = "X-Bldr-Worker-Key";

    private static final String PUBLIC_PREFIX = "/api/v1/";
    private static final String WORKER_PREFIX = "/internal/v1/";

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();
    private final byte[] workerKey;

    public RouterHandler(JobServerConfig config) {
        this.workerKey = config.hasWorkerKey() ? config.workerKey().getBytes(StandardCharsets.UTF_8) : null;
    }

    /**
     * Add a controller. The first registered controller that matches wins.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public List<String> controllerNames() {
        return controllers.stream().map(c -> c.getClass().getSimpleName()).toList();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        long started = System.nanoTime();
        HttpMethod method = req.method();
        String uri = req.uri();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf('?')) : uri;

        ControllerResponse response = route(ctx, req, method, path);
        write(ctx, response);

        log.debug("{} {} -> {} in {} ms", method, path, response.status().code(),
                (System.nanoTime() - started) / 1_000_000);
    }

    private ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method, String path) {
        boolean workerRoute = path.startsWith(WORKER_PREFIX);
        if (!workerRoute && !path.startsWith(PUBLIC_PREFIX)) {
            return ControllerResponse.notFound("not found");
        }
        if (workerRoute && !workerKeyAccepted(req)) {
            log.warn("Rejected worker request without a valid key: {} {} from {}", method, path,
                    ctx.channel().remoteAddress());
            return ControllerResponse.forbidden("forbidden");
        }

        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    return controller.handle(ctx, req, path);
                }
            }
        } catch (IllegalArgumentException e) {
            log.warn("Bad request {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Handler error: {} {}", method, path, e);
            return ControllerResponse.failure(e);
        }
        return ControllerResponse.notFound("not found");
    }

    private boolean workerKeyAccepted(FullHttpRequest req) {
        if (workerKey == null) {
            return true;
        }
        String provided = req.headers().get(WORKER_KEY_HEADER);
        return provided != null && MessageDigest.isEqual(workerKey, provided.getBytes(StandardCharsets.UTF_8));
    }

    private void write(ChannelHandlerContext ctx, ControllerResponse response) {
        try {
            byte[] bytes = response.body() == null ? new byte[0] : response.body().getBytes(StandardCharsets.UTF_8);
            FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                    Unpooled.wrappedBuffer(bytes));
            http.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
            http.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(http);
        } catch (RuntimeException e) {
            log.error("Failed to write response, closing channel", e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            write(ctx, ControllerResponse.error("channel error"));
        } finally {
            ctx.close();
        }
    }

    /**
     * The ObjectMapper every controller reads and writes JSON with.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
