package fleetportal.core.model;

/**
 * Role a fleet machine plays in the cluster.
 */
public enum NodeRole {
    MASTER,
    /** Eligible to host workload instances */
    WORKER,
    STORAGE;

    public static NodeRole parse(String value) {
        if (value == null || value.isBlank()) {
            return WORKER;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown node role: " + value);
        }
    }
}
