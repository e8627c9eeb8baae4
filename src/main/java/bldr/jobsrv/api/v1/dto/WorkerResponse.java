package bldr.jobsrv.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import bldr.jobsrv.model.Worker;

import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

/**
 * Response DTO for a registered worker.
 * GET /api/v1/workers
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerResponse(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("status") String status,
        @JsonProperty("suspect") boolean suspect,
        @JsonProperty("tags") Set<String> tags,
        @JsonProperty("capacity") int capacity,
        @JsonProperty("activeJobs") int activeJobs,
        @JsonProperty("endpoint") String endpoint,
        @JsonProperty("lastHeartbeat") Instant lastHeartbeat,
        @JsonProperty("idleSince") Instant idleSince,
        @JsonProperty("registeredAt") Instant registeredAt) {

    public static WorkerResponse from(Worker worker) {
        return new WorkerResponse(
                worker.id(),
                worker.status().name(),
                worker.suspect(),
                new TreeSet<>(worker.tags()),
                worker.capacity(),
                worker.activeJobs(),
                worker.endpoint(),
                worker.lastHeartbeat(),
                worker.idleSince(),
                worker.registeredAt());
    }
}
