package fleetportal.core.error;

/**
 * Store read/write failure. Retryable from the caller's point of view.
 */
public class PersistenceException extends PortalException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
