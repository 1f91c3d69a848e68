package fleetportal.core.model;

import java.util.Map;

/**
 * Port allocation picture of one node.
 */
public record PortUsage(
        String nodeId,
        int allocatedCount,
        int availableCount,
        int highWaterMark,
        Map<String, Integer> allocations) {
}
