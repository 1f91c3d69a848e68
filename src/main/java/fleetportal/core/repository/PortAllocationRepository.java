package fleetportal.core.repository;

import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for per-node port assignments.
 * Callers serialize mutations per node.
 */
public interface PortAllocationRepository {

    /**
     * Current assignments of a node, instance ID to port.
     */
    Map<String, Integer> findByNode(String nodeId);

    /**
     * One past the highest port ever handed out on the node, or the given default if none.
     */
    int highWaterMark(String nodeId, int defaultValue);

    /**
     * Record an assignment and move the node's high-water mark, atomically.
     */
    void assign(String nodeId, String instanceId, int port, int highWaterMark);

    /**
     * Remove an assignment.
     *
     * @return the freed port, empty if the instance held none
     */
    Optional<Integer> remove(String nodeId, String instanceId);
}
