package bldr.jobsrv.dispatch;

/**
 * Thrown when a worker cannot be reached or refuses a message.
 */
public class WorkerUnreachableException extends RuntimeException {

    public WorkerUnreachableException(String message) {
        super(message);
    }

    public WorkerUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
