package bldr.jobsrv.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import bldr.jobsrv.api.Controller;
import bldr.jobsrv.api.v1.dto.GroupResponse;
import bldr.jobsrv.api.v1.dto.SubmitGroupRequest;
import bldr.jobsrv.api.v1.dto.ValidationErrorResponse;
import bldr.jobsrv.graph.BuildGraph;
import bldr.jobsrv.graph.GraphValidationException;
import bldr.jobsrv.scheduler.CancelOutcome;
import bldr.jobsrv.server.RouterHandler;
import bldr.jobsrv.service.GroupService;
import bldr.jobsrv.service.GroupStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for build groups (public API).
 * 
 * POST /api/v1/groups - Submit a group
 * GET /api/v1/groups?limit=N - Recent groups
 * GET /api/v1/groups/{groupId} - Group status with jobs
 * POST /api/v1/groups/{groupId}/cancel - Cancel a group
 */
public class GroupController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(GroupController.class);

    private static final Pattern GROUPS_PATTERN = Pattern.compile("^/api/v1/groups$");
    private static final Pattern GROUP_BY_ID_PATTERN = Pattern.compile("^/api/v1/groups/([^/]+)$");
    private static final Pattern GROUP_CANCEL_PATTERN = Pattern.compile("^/api/v1/groups/([^/]+)/cancel$");

    private static final int DEFAULT_LIMIT = 20;
    private static final int MAX_LIMIT = 500;

    private final GroupService groupService;

    public GroupController(GroupService groupService) {
        this.groupService = groupService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return GROUPS_PATTERN.matcher(path).matches() || GROUP_CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return GROUPS_PATTERN.matcher(path).matches() || GROUP_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            boolean post = req.method().equals(HttpMethod.POST);

            if (post && GROUPS_PATTERN.matcher(path).matches()) {
                return handleSubmit(req);
            }

            Matcher cancelMatcher = GROUP_CANCEL_PATTERN.matcher(path);
            if (post && cancelMatcher.matches()) {
                return handleCancel(cancelMatcher.group(1));
            }

            if (!post && GROUPS_PATTERN.matcher(path).matches()) {
                return handleList(req);
            }

            Matcher groupMatcher = GROUP_BY_ID_PATTERN.matcher(path);
            if (!post && groupMatcher.matches()) {
                return handleGetGroup(groupMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown group endpoint");

        } catch (GraphValidationException e) {
            log.warn("Rejected submission ({}): {}", e.kind(), e.getMessage());
            return validationError(e);
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (Exception e) {
            log.error("Group controller error", e);
            return ControllerResponse.failure(e);
        }
    }

    /**
     * POST /api/v1/groups - Submit a group
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        SubmitGroupRequest request = RouterHandler.mapper().readValue(body, SubmitGroupRequest.class);

        request.validate();

        BuildGraph graph = groupService.submit(request.target(), request.toSpecs());

        Map<String, Object> jobs = new LinkedHashMap<>();
        graph.jobs().forEach(job -> jobs.put(job.project().ref(), job.id()));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("groupId", graph.group().id());
        response.put("state", graph.group().state().name());
        response.put("jobs", jobs);

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/groups?limit=N - Recent groups, newest first
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        int limit = DEFAULT_LIMIT;
        List<String> limitParam = new QueryStringDecoder(req.uri()).parameters().get("limit");
        if (limitParam != null && !limitParam.isEmpty()) {
            try {
                limit = Integer.parseInt(limitParam.get(0));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("limit must be a number");
            }
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
            }
        }

        List<GroupResponse> groups = groupService.recentGroups(limit).stream()
                .map(GroupResponse::compact)
                .toList();

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("groups", groups)));
    }

    /**
     * GET /api/v1/groups/{groupId} - Group status
     */
    private ControllerResponse handleGetGroup(String groupId) throws Exception {
        Optional<GroupStatus> status = groupService.groupStatus(groupId);

        if (status.isEmpty()) {
            return ControllerResponse.notFound("group not found");
        }

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(GroupResponse.from(status.get())));
    }

    /**
     * POST /api/v1/groups/{groupId}/cancel - Cancel a group
     */
    private ControllerResponse handleCancel(String groupId) throws Exception {
        CancelOutcome outcome = groupService.cancel(groupId);

        if (!outcome.found()) {
            return ControllerResponse.notFound("group not found");
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("groupId", groupId);
        response.put("state", outcome.state().name());
        response.put("abortedJobs", outcome.aborted().size());

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse validationError(GraphValidationException e) {
        try {
            return ControllerResponse.json(
                    HttpResponseStatus.BAD_REQUEST,
                    RouterHandler.mapper().writeValueAsString(ValidationErrorResponse.from(e)));
        } catch (Exception ex) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }
}
