package bldr.jobsrv.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import bldr.jobsrv.model.JobReport;
import bldr.jobsrv.model.ReportKind;

import java.util.Locale;

/**
 * Request DTO for a job report.
 * POST /internal/v1/jobs/{jobId}/report
 */
public record ReportRequest(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("kind") String kind,
        @JsonProperty("reason") String reason) {
    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind is required");
        }
        parseKind();
    }

    public JobReport toReport(String jobId) {
        return new JobReport(jobId, workerId, parseKind(), reason);
    }

    private ReportKind parseKind() {
        try {
            return ReportKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown report kind: " + kind);
        }
    }
}
