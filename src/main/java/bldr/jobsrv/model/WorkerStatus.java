package bldr.jobsrv.model;

/**
 * Worker liveness status.
 */
public enum WorkerStatus {
    /** Worker is sending heartbeats */
    ALIVE,
    /** Heartbeat lapsed past the timeout; its jobs were requeued or failed */
    DEAD
}
