package fleetportal.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time aggregate view of cluster health.
 * Rebuilt from fresh probes on every request.
 */
public record ClusterSnapshot(
        String clusterName,
        int totalNodes,
        int onlineNodes,
        int offlineNodes,
        int healthyNodes,
        int unhealthyNodes,
        double availabilityPercent,
        ClusterGrade grade,
        String message,
        Instant checkedAt,
        List<NodeWithStatus> nodes) {

    public boolean hasNodeDetail() {
        return nodes != null;
    }
}
