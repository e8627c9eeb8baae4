package bldr.jobsrv.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import bldr.jobsrv.api.Controller;
import bldr.jobsrv.api.internal.v1.dto.ReportRequest;
import bldr.jobsrv.api.internal.v1.dto.ReportResponse;
import bldr.jobsrv.model.JobReport;
import bldr.jobsrv.model.ReportOutcome;
import bldr.jobsrv.repository.TransitionConflictException;
import bldr.jobsrv.server.RouterHandler;
import bldr.jobsrv.service.StatusIngestor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job reports from workers (internal API).
 * POST /internal/v1/jobs/{jobId}/report
 * 
 * Answers 200 with the outcome for applied, duplicate and stale reports so
 * workers can stop retrying; 202 for a report held until the job's dispatch is
 * recorded; 404 for unknown jobs.
 */
public class ReportController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ReportController.class);

    private static final Pattern REPORT_PATTERN = Pattern.compile("^/internal/v1/jobs/([^/]+)/report$");

    private final StatusIngestor ingestor;

    public ReportController(StatusIngestor ingestor) {
        this.ingestor = ingestor;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && REPORT_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher matcher = REPORT_PATTERN.matcher(path);
            if (!matcher.matches()) {
                return ControllerResponse.notFound("unknown report endpoint");
            }
            String jobId = matcher.group(1);

            String body = req.content().toString(StandardCharsets.UTF_8);
            ReportRequest request = RouterHandler.mapper().readValue(body, ReportRequest.class);

            request.validate();

            JobReport report = request.toReport(jobId);
            ReportOutcome outcome = ingestor.submit(report).join();
            if (outcome == ReportOutcome.NOT_FOUND) {
                return ControllerResponse.notFound("job not found");
            }

            HttpResponseStatus status = outcome == ReportOutcome.DEFERRED ? HttpResponseStatus.ACCEPTED
                    : HttpResponseStatus.OK;
            return ControllerResponse.json(status,
                    RouterHandler.mapper().writeValueAsString(ReportResponse.of(jobId, outcome)));

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (CompletionException e) {
            if (e.getCause() instanceof TransitionConflictException) {
                log.warn("Report on {} kept conflicting: {}", path, e.getCause().getMessage());
            } else {
                log.error("Report processing failed", e.getCause());
            }
            return ControllerResponse.failure(e);
        } catch (Exception e) {
            log.error("Report controller error", e);
            return ControllerResponse.failure(e);
        }
    }
}
