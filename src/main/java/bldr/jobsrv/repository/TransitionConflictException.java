package bldr.jobsrv.repository;

/**
 * A transition batch was rejected because the stored state no longer matches the
 * state it was planned from. The whole batch was rolled back; the caller should
 * re-read and re-plan.
 */
public class TransitionConflictException extends RuntimeException {

    public TransitionConflictException(String message) {
        super(message);
    }

    public TransitionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
