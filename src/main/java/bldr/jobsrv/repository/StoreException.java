package bldr.jobsrv.repository;

/**
 * The durable store failed. Nothing was written by the failing call.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
