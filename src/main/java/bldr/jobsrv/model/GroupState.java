package bldr.jobsrv.model;

/**
 * Group state, derived from the states of the member jobs.
 */
public enum GroupState {
    /** At least one job is not terminal yet */
    QUEUED,
    /** All jobs completed successfully */
    COMPLETE,
    /** All jobs terminal and at least one failed or was cascade-failed */
    FAILED,
    /** Cancellation was requested and all jobs are terminal */
    CANCELED;

    public boolean isTerminal() {
        return this != QUEUED;
    }
}
