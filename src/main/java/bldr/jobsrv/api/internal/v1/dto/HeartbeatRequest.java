package bldr.jobsrv.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import bldr.jobsrv.model.Heartbeat;

import java.util.Set;

/**
 * Request DTO for worker heartbeat.
 * POST /internal/v1/heartbeat
 */
public record HeartbeatRequest(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("capacity") int capacity,
        @JsonProperty("tags") Set<String> tags,
        @JsonProperty("endpoint") String endpoint) {
    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint is required");
        }
        if (tags != null && tags.stream().anyMatch(t -> t == null || t.isBlank() || t.contains(","))) {
            throw new IllegalArgumentException("tags must be non-blank and must not contain ','");
        }
    }

    public Heartbeat toHeartbeat() {
        return new Heartbeat(workerId, capacity, tags, endpoint);
    }
}
