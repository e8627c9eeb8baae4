package bldr.jobsrv.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import bldr.jobsrv.api.Controller;
import bldr.jobsrv.api.v1.dto.WorkerResponse;
import bldr.jobsrv.server.RouterHandler;
import bldr.jobsrv.service.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Controller for the worker fleet view.
 * GET /api/v1/workers
 */
public class WorkerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private final WorkerRegistry registry;

    public WorkerController(WorkerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/workers".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            List<WorkerResponse> workers = registry.list().stream()
                    .map(WorkerResponse::from)
                    .toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("workers", workers)));
        } catch (Exception e) {
            log.error("Worker controller error", e);
            return ControllerResponse.failure(e);
        }
    }
}
