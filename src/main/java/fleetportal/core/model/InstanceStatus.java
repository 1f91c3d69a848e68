package fleetportal.core.model;

/**
 * Instance lifecycle status.
 */
public enum InstanceStatus {
    /** Accepted, not yet deployed */
    PENDING,
    /** Workload is deployed and running */
    RUNNING,
    /** Workload is stopped, resources still held */
    STOPPED,
    /** Resources released, record kept for history */
    TERMINATED,
    /** Deployment failed, resources already released */
    ERROR;

    public static InstanceStatus parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown instance status: " + value);
        }
    }
}
