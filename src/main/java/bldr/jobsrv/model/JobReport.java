package bldr.jobsrv.model;

import java.util.Objects;

/**
 * A progress or result report for one job, sent by the worker that runs it.
 */
public record JobReport(String jobId, String workerId, ReportKind kind, String reason) {

    public JobReport {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(workerId, "workerId is required");
        Objects.requireNonNull(kind, "kind is required");
    }

    public static JobReport of(String jobId, String workerId, ReportKind kind) {
        return new JobReport(jobId, workerId, kind, null);
    }

    public static JobReport failed(String jobId, String workerId, String reason) {
        return new JobReport(jobId, workerId, ReportKind.FAILED, reason);
    }
}
