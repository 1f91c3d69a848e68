package fleetportal.core.error;

/**
 * Expected, caller-explainable outcome of an instance launch that did not succeed.
 */
public abstract class PlacementException extends Exception {

    protected PlacementException(String message) {
        super(message);
    }

    protected PlacementException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Longer explanation for API clients */
    public abstract String detail();
}
