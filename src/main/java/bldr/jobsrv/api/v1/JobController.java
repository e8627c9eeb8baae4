package bldr.jobsrv.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import bldr.jobsrv.api.Controller;
import bldr.jobsrv.api.v1.dto.JobResponse;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.server.RouterHandler;
import bldr.jobsrv.service.GroupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for single jobs (public API).
 * 
 * GET /api/v1/jobs/{jobId} - Job state, worker and timestamps
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");

    private final GroupService groupService;

    public JobController(GroupService groupService) {
        this.groupService = groupService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && JOB_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (!jobMatcher.matches()) {
                return ControllerResponse.notFound("unknown job endpoint");
            }

            Optional<Job> job = groupService.findJob(jobMatcher.group(1));
            if (job.isEmpty()) {
                return ControllerResponse.notFound("job not found");
            }

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(JobResponse.from(job.get())));

        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.failure(e);
        }
    }
}
