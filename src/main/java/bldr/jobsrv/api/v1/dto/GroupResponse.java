package bldr.jobsrv.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import bldr.jobsrv.model.JobGroup;
import bldr.jobsrv.model.JobState;
import bldr.jobsrv.service.GroupStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for group details.
 * GET /api/v1/groups/{groupId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroupResponse(
        @JsonProperty("groupId") String groupId,
        @JsonProperty("target") String target,
        @JsonProperty("state") String state,
        @JsonProperty("cancelRequested") boolean cancelRequested,
        @JsonProperty("totalJobs") int totalJobs,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("counts") Map<String, Integer> counts,
        @JsonProperty("rootCauses") List<JobResponse> rootCauses,
        @JsonProperty("jobs") List<JobResponse> jobs) {

    /** Full view with jobs and failures */
    public static GroupResponse from(GroupStatus status) {
        JobGroup group = status.group();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map.Entry<JobState, Integer> e : status.counts().entrySet()) {
            counts.put(e.getKey().name(), e.getValue());
        }
        return new GroupResponse(
                group.id(),
                group.target(),
                group.state().name(),
                group.cancelRequested(),
                status.jobs().size(),
                group.createdAt(),
                group.completedAt(),
                counts,
                status.rootCauses().stream().map(JobResponse::from).toList(),
                status.jobs().stream().map(JobResponse::from).toList());
    }

    /** Compact version for list responses */
    public static GroupResponse compact(JobGroup group) {
        return new GroupResponse(
                group.id(),
                group.target(),
                group.state().name(),
                group.cancelRequested(),
                group.jobIds().size(),
                group.createdAt(),
                group.completedAt(),
                null, null, null);
    }
}
