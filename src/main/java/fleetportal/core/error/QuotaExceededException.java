package fleetportal.core.error;

/**
 * The request would push the user past a declared quota limit.
 * Only raised when a hard-cap quota policy is active.
 */
public class QuotaExceededException extends PlacementException {

    private final String reason;

    public QuotaExceededException(String reason) {
        super("Quota exceeded");
        this.reason = reason;
    }

    @Override
    public String detail() {
        return reason;
    }
}
