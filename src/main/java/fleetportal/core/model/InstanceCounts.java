package fleetportal.core.model;

/**
 * Per-status instance counts for one owner (terminated excluded).
 */
public record InstanceCounts(int total, int running, int stopped, int pending) {
}
