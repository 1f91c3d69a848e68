package fleetportal.core.model;

/**
 * Health grade of a single node, as decided by one probe.
 */
public enum NodeHealth {
    HEALTHY,
    UNHEALTHY,
    /** The probe itself failed; nothing is known about the node */
    UNKNOWN
}
