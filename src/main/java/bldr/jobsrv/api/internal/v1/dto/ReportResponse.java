package bldr.jobsrv.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import bldr.jobsrv.model.ReportOutcome;

/**
 * Acknowledgement of a job report.
 */
public record ReportResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("outcome") String outcome) {
    public static ReportResponse of(String jobId, ReportOutcome outcome) {
        return new ReportResponse(jobId, outcome.name());
    }
}
