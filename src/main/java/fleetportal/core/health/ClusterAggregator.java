package fleetportal.core.health;

import fleetportal.core.model.ClusterGrade;
import fleetportal.core.model.ClusterSnapshot;
import fleetportal.core.model.NodeHealth;
import fleetportal.core.model.NodeStatus;
import fleetportal.core.model.NodeWithStatus;

import java.time.Instant;
import java.util.List;

/**
 * Reduces per-node probe results to one cluster-wide grade.
 * Pure function of the status counts.
 */
public class ClusterAggregator {

    private final String clusterName;

    public ClusterAggregator(String clusterName) {
        this.clusterName = clusterName;
    }

    public ClusterSnapshot aggregate(List<NodeWithStatus> nodes, boolean includeNodes) {
        List<NodeStatus> statuses = nodes.stream().map(NodeWithStatus::status).toList();
        return build(statuses, includeNodes ? List.copyOf(nodes) : null);
    }

    public ClusterSnapshot aggregateStatuses(List<NodeStatus> statuses) {
        return build(statuses, null);
    }

    private ClusterSnapshot build(List<NodeStatus> statuses, List<NodeWithStatus> detail) {
        int total = statuses.size();
        int online = 0;
        int healthy = 0;
        int unhealthy = 0;
        for (NodeStatus status : statuses) {
            if (status.online()) {
                online++;
            }
            if (status.health() == NodeHealth.HEALTHY) {
                healthy++;
            } else if (status.health() == NodeHealth.UNHEALTHY) {
                unhealthy++;
            }
        }
        int offline = total - online;

        ClusterGrade grade = grade(total, online);

        return new ClusterSnapshot(
                clusterName,
                total,
                online,
                offline,
                healthy,
                unhealthy,
                availability(total, online),
                grade,
                message(grade, unhealthy, offline),
                Instant.now(),
                detail);
    }

    /**
     * online/total*100 rounded to two decimals, 0 for an empty cluster.
     */
    public static double availability(int total, int online) {
        if (total == 0) {
            return 0.0;
        }
        return Math.round(online * 10000.0 / total) / 100.0;
    }

    /**
     * Decided on exact counts so that rounding can never promote a cluster to HEALTHY.
     */
    public static ClusterGrade grade(int total, int online) {
        if (total == 0) {
            return ClusterGrade.OFFLINE;
        }
        if (online == total) {
            return ClusterGrade.HEALTHY;
        }
        if (online * 100L >= 80L * total) {
            return ClusterGrade.DEGRADED;
        }
        if (online > 0) {
            return ClusterGrade.CRITICAL;
        }
        return ClusterGrade.OFFLINE;
    }

    static String message(ClusterGrade grade, int unhealthy, int offline) {
        return switch (grade) {
            case HEALTHY -> "All nodes are operating normally.";
            case DEGRADED -> "Some nodes have problems. (" + unhealthy + " unhealthy)";
            case CRITICAL -> "Many nodes are offline. (" + offline + " offline)";
            case OFFLINE -> "No nodes are connected to the cluster.";
        };
    }
}
