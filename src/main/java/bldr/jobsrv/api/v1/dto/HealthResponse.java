package bldr.jobsrv.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("loopsRunning") Boolean loopsRunning,
        @JsonProperty("aliveWorkers") Integer aliveWorkers,
        @JsonProperty("readyJobs") Integer readyJobs) {
    public static HealthResponse healthy(String uptime, String version, boolean loopsRunning, int aliveWorkers,
            int readyJobs) {
        return new HealthResponse("healthy", "ok", uptime, version, loopsRunning, aliveWorkers, readyJobs);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null);
    }
}
