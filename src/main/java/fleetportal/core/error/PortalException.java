package fleetportal.core.error;

/**
 * Root of the unchecked portal faults.
 */
public class PortalException extends RuntimeException {

    public PortalException(String message) {
        super(message);
    }

    public PortalException(String message, Throwable cause) {
        super(message, cause);
    }
}
