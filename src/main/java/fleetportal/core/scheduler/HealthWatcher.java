package fleetportal.core.scheduler;

import fleetportal.core.health.ClusterAggregator;
import fleetportal.core.health.HealthProber;
import fleetportal.core.model.ClusterGrade;
import fleetportal.core.model.ClusterSnapshot;
import fleetportal.core.model.NodeWithStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Periodically probes the fleet and logs changes of the cluster grade and of
 * individual node reachability. Never throws; a failed round is logged and
 * the next round runs as usual.
 */
public class HealthWatcher implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HealthWatcher.class);

    private final HealthProber prober;
    private final ClusterAggregator aggregator;

    private volatile ClusterSnapshot lastSnapshot;
    private final Map<String, Boolean> lastOnline = new HashMap<>();

    public HealthWatcher(HealthProber prober, ClusterAggregator aggregator) {
        this.prober = prober;
        this.aggregator = aggregator;
    }

    @Override
    public void run() {
        try {
            check();
        } catch (Exception e) {
            log.error("Health watch round failed", e);
        }
    }

    /**
     * Run one probe round.
     *
     * @return the fresh snapshot
     */
    public synchronized ClusterSnapshot check() {
        List<NodeWithStatus> nodes = prober.probeAll();
        ClusterSnapshot snapshot = aggregator.aggregate(nodes, false);

        for (NodeWithStatus n : nodes) {
            Boolean before = lastOnline.put(n.node().id(), n.status().online());
            if (before != null && before != n.status().online()) {
                if (n.status().online()) {
                    log.info("Node {} ({}) is back online", n.node().id(), n.node().address());
                } else {
                    log.warn("Node {} ({}) went offline: {}", n.node().id(), n.node().address(),
                            n.status().errorMessage());
                }
            }
        }
        lastOnline.keySet().retainAll(nodes.stream().map(n -> n.node().id()).toList());

        ClusterGrade previous = lastSnapshot != null ? lastSnapshot.grade() : null;
        if (previous != snapshot.grade()) {
            if (snapshot.grade() == ClusterGrade.HEALTHY) {
                log.info("Cluster {} is {}: {} ({}/{} online)", snapshot.clusterName(), snapshot.grade(),
                        snapshot.message(), snapshot.onlineNodes(), snapshot.totalNodes());
            } else {
                log.warn("Cluster {} is {}: {} ({}/{} online)", snapshot.clusterName(), snapshot.grade(),
                        snapshot.message(), snapshot.onlineNodes(), snapshot.totalNodes());
            }
        } else {
            log.debug("Cluster {} still {} ({}% available)", snapshot.clusterName(), snapshot.grade(),
                    snapshot.availabilityPercent());
        }

        lastSnapshot = snapshot;
        return snapshot;
    }

    /**
     * Snapshot of the last completed round, null before the first one.
     */
    public ClusterSnapshot lastSnapshot() {
        return lastSnapshot;
    }
}
