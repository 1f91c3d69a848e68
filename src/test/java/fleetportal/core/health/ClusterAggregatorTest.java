package fleetportal.core.health;

import fleetportal.core.model.ClusterGrade;
import fleetportal.core.model.ClusterSnapshot;
import fleetportal.core.model.Node;
import fleetportal.core.model.NodeStatus;
import fleetportal.core.model.NodeWithStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClusterAggregatorTest {

    private final ClusterAggregator aggregator = new ClusterAggregator("test-cluster");

    @Test
    void allOnlineIsHealthy() {
        ClusterSnapshot s = aggregator.aggregateStatuses(statuses(17, 17));

        assertEquals(ClusterGrade.HEALTHY, s.grade());
        assertEquals(100.0, s.availabilityPercent());
        assertEquals("All nodes are operating normally.", s.message());
        assertEquals(17, s.healthyNodes());
    }

    @Test
    void mostlyOnlineIsDegraded() {
        ClusterSnapshot s = aggregator.aggregateStatuses(statuses(17, 14));

        assertEquals(ClusterGrade.DEGRADED, s.grade());
        assertEquals(82.35, s.availabilityPercent());
        assertEquals(3, s.unhealthyNodes());
        assertEquals("Some nodes have problems. (3 unhealthy)", s.message());
    }

    @Test
    void manyOfflineIsCritical() {
        ClusterSnapshot s = aggregator.aggregateStatuses(statuses(17, 10));

        assertEquals(ClusterGrade.CRITICAL, s.grade());
        assertEquals(58.82, s.availabilityPercent());
        assertEquals(7, s.offlineNodes());
        assertEquals("Many nodes are offline. (7 offline)", s.message());
    }

    @Test
    void noneOnlineIsOffline() {
        ClusterSnapshot s = aggregator.aggregateStatuses(statuses(17, 0));

        assertEquals(ClusterGrade.OFFLINE, s.grade());
        assertEquals(0.0, s.availabilityPercent());
        assertEquals("No nodes are connected to the cluster.", s.message());
    }

    @Test
    void emptyClusterIsOffline() {
        ClusterSnapshot s = aggregator.aggregateStatuses(List.of());

        assertEquals(ClusterGrade.OFFLINE, s.grade());
        assertEquals(0, s.totalNodes());
        assertEquals(0.0, s.availabilityPercent());
    }

    @Test
    void eightyPercentIsStillDegraded() {
        assertEquals(ClusterGrade.DEGRADED, ClusterAggregator.grade(5, 4));
        assertEquals(ClusterGrade.CRITICAL, ClusterAggregator.grade(5, 3));
    }

    @Test
    void roundingNeverPromotesToHealthy() {
        ClusterSnapshot s = aggregator.aggregateStatuses(statuses(20000, 19999));

        assertEquals(100.0, s.availabilityPercent());
        assertEquals(ClusterGrade.DEGRADED, s.grade());
    }

    @Test
    void unknownNodesCountAsOfflineButNotUnhealthy() {
        List<NodeStatus> list = new ArrayList<>(statuses(3, 3));
        list.add(NodeStatus.unknown("n-x", 1.0, "bug"));

        ClusterSnapshot s = aggregator.aggregateStatuses(list);
        assertEquals(4, s.totalNodes());
        assertEquals(1, s.offlineNodes());
        assertEquals(0, s.unhealthyNodes());
        assertEquals(3, s.healthyNodes());
    }

    @Test
    void refusedNodesAreOnline() {
        ClusterSnapshot s = aggregator.aggregateStatuses(List.of(
                NodeStatus.refused("n-1", 2.0),
                NodeStatus.healthy("n-2", 1.0)));

        assertEquals(ClusterGrade.HEALTHY, s.grade());
        assertEquals(2, s.onlineNodes());
    }

    @Test
    void nodeDetailOnlyWhenRequested() {
        Node node = Node.builder().id("n-1").address("10.0.0.1").build();
        List<NodeWithStatus> nodes = List.of(new NodeWithStatus(node, NodeStatus.healthy("n-1", 1.0)));

        assertFalse(aggregator.aggregate(nodes, false).hasNodeDetail());
        ClusterSnapshot detailed = aggregator.aggregate(nodes, true);
        assertTrue(detailed.hasNodeDetail());
        assertEquals("test-cluster", detailed.clusterName());
        assertEquals(1, detailed.nodes().size());
    }

    private static List<NodeStatus> statuses(int total, int online) {
        List<NodeStatus> list = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            list.add(i < online
                    ? NodeStatus.healthy("n-" + i, 1.0)
                    : NodeStatus.timedOut("n-" + i, 5000.0));
        }
        return list;
    }
}
