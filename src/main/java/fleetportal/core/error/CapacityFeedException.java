package fleetportal.core.error;

/**
 * The live capacity feed could not be read.
 */
public class CapacityFeedException extends Exception {

    public CapacityFeedException(String message) {
        super(message);
    }

    public CapacityFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
