package fleetportal.core.model;

/**
 * Cluster-wide health grade derived from node availability.
 */
public enum ClusterGrade {
    HEALTHY,
    DEGRADED,
    CRITICAL,
    OFFLINE
}
