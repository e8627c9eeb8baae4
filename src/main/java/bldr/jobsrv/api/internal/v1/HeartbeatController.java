package bldr.jobsrv.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import bldr.jobsrv.api.Controller;
import bldr.jobsrv.api.internal.v1.dto.HeartbeatRequest;
import bldr.jobsrv.api.v1.dto.WorkerResponse;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.server.RouterHandler;
import bldr.jobsrv.service.StatusIngestor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletionException;

/**
 * Controller for worker heartbeats (internal API).
 * POST /internal/v1/heartbeat - register or refresh a worker
 */
public class HeartbeatController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatController.class);

    private final StatusIngestor ingestor;

    public HeartbeatController(StatusIngestor ingestor) {
        this.ingestor = ingestor;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/internal/v1/heartbeat".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);
            HeartbeatRequest request = RouterHandler.mapper().readValue(body, HeartbeatRequest.class);

            request.validate();

            Worker worker = ingestor.submit(request.toHeartbeat()).join();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(WorkerResponse.from(worker)));

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (CompletionException e) {
            if (!(e.getCause() instanceof IllegalArgumentException)) {
                log.error("Heartbeat processing failed", e.getCause());
            }
            return ControllerResponse.failure(e);
        } catch (Exception e) {
            log.error("Heartbeat controller error", e);
            return ControllerResponse.failure(e);
        }
    }
}
