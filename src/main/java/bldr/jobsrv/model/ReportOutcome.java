package bldr.jobsrv.model;

/**
 * Result of ingesting one worker report.
 */
public enum ReportOutcome {
    /** The report caused a state change */
    APPLIED,

    /**
     * The job is already past the state the report would move it to.
     * Acknowledged, nothing changed.
     */
    DUPLICATE,

    /** Report came from a worker that no longer owns the job */
    STALE,

    /**
     * The job's assignment to the reporting worker is still being recorded.
     * The report is held and applied once the dispatch is recorded.
     */
    DEFERRED,

    /** Job not found */
    NOT_FOUND
}
