package fleetportal.core.placement;

import fleetportal.core.error.CapacityFeedException;
import fleetportal.core.model.NodeCapacity;

import java.util.List;

/**
 * Source of live per-node headroom.
 */
@FunctionalInterface
public interface CapacityFeed {

    List<NodeCapacity> listAvailable() throws CapacityFeedException;

    /**
     * A feed that always fails, for deployments without a capacity source.
     * The scheduler then places at random.
     */
    static CapacityFeed unavailable() {
        return () -> {
            throw new CapacityFeedException("no capacity feed configured");
        };
    }
}
