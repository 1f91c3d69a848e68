package fleetportal.core.ledger;

import fleetportal.core.error.PortExhaustedException;
import fleetportal.core.model.PortUsage;
import fleetportal.core.repository.PortAllocationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-node host port bookkeeping.
 * No two live instances on one node share a port; freed ports are handed out
 * again, lowest first, before the node's high-water mark grows.
 */
public class PortLedger {

    private static final Logger log = LoggerFactory.getLogger(PortLedger.class);

    public static final int PORT_START = 8000;
    public static final int PORT_END = 9999;
    public static final int RANGE_SIZE = PORT_END - PORT_START + 1;

    private final PortAllocationRepository repository;
    private final KeyedLocks locks = new KeyedLocks();

    public PortLedger(PortAllocationRepository repository) {
        this.repository = repository;
    }

    /**
     * Assign a port to the instance on the node.
     * Calling again for the same instance returns the port it already holds.
     *
     * @throws PortExhaustedException if every port in range is live on the node
     */
    public int allocate(String nodeId, String instanceId) {
        return locks.withLock(nodeId, () -> {
            Map<String, Integer> current = repository.findByNode(nodeId);
            Integer held = current.get(instanceId);
            if (held != null) {
                return held;
            }

            Set<Integer> used = new HashSet<>(current.values());
            int port = firstFree(nodeId, used);
            int mark = Math.max(repository.highWaterMark(nodeId, PORT_START), port + 1);

            repository.assign(nodeId, instanceId, port, mark);
            log.debug("Port {} allocated on node {} for {}", port, nodeId, instanceId);
            return port;
        });
    }

    /**
     * Free the instance's port on the node. Safe to call more than once.
     *
     * @return the freed port, empty if the instance held none
     */
    public Optional<Integer> release(String nodeId, String instanceId) {
        return locks.withLock(nodeId, () -> {
            Optional<Integer> freed = repository.remove(nodeId, instanceId);
            freed.ifPresent(port -> log.debug("Port {} released on node {} by {}", port, nodeId, instanceId));
            return freed;
        });
    }

    public Optional<Integer> allocatedPort(String nodeId, String instanceId) {
        return Optional.ofNullable(repository.findByNode(nodeId).get(instanceId));
    }

    public PortUsage usage(String nodeId) {
        Map<String, Integer> allocations = repository.findByNode(nodeId);
        return new PortUsage(
                nodeId,
                allocations.size(),
                RANGE_SIZE - allocations.size(),
                repository.highWaterMark(nodeId, PORT_START),
                allocations);
    }

    private static int firstFree(String nodeId, Set<Integer> used) {
        for (int port = PORT_START; port <= PORT_END; port++) {
            if (!used.contains(port)) {
                return port;
            }
        }
        throw new PortExhaustedException(nodeId, PORT_START, PORT_END);
    }
}
