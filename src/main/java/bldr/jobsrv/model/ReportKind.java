package bldr.jobsrv.model;

/**
 * Kind of a job report sent by a worker.
 */
public enum ReportKind {
    STARTED,
    PROGRESS,
    SUCCEEDED,
    /** Build failed; carries a reason */
    FAILED,
    /** Worker gave up on the job without a build result */
    ABORTED
}
