package bldr.jobsrv.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import bldr.jobsrv.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("groupId") String groupId,
        @JsonProperty("project") String project,
        @JsonProperty("state") String state,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("requiredTags") Set<String> requiredTags,
        @JsonProperty("inputsRef") String inputsRef,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("failureReason") String failureReason,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("dispatchedAt") Instant dispatchedAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt) {
    /** Create response from domain model */
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.groupId(),
                job.project().ref(),
                job.state().name(),
                job.workerId(),
                job.dependencies(),
                job.requiredTags(),
                job.inputsRef(),
                job.retryCount(),
                job.maxRetries(),
                job.failureReason(),
                job.createdAt(),
                job.dispatchedAt(),
                job.startedAt(),
                job.completedAt());
    }
}
