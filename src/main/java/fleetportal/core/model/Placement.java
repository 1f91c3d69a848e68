package fleetportal.core.model;

import java.util.Objects;

/**
 * Outcome of node selection.
 */
public record Placement(String nodeId, String address, PlacementMode mode) {

    public Placement {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(mode, "mode");
    }

    public boolean isDegraded() {
        return mode == PlacementMode.RANDOM_FALLBACK;
    }
}
