package fleetportal.core.placement;

import fleetportal.core.error.CapacityFeedException;
import fleetportal.core.error.InsufficientCapacityException;
import fleetportal.core.model.Node;
import fleetportal.core.model.NodeCapacity;
import fleetportal.core.model.NodeRole;
import fleetportal.core.model.Placement;
import fleetportal.core.model.PlacementMode;
import fleetportal.core.service.NodeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Picks the worker node an instance is placed on.
 *
 * Among workers whose live headroom fits the request, the one with the most
 * available cpu wins; equal cpu goes to the lowest node id. When the capacity
 * feed cannot be read, a worker is picked at random and the placement is
 * flagged as unvalidated.
 */
public class CapacityScheduler {

    private static final Logger log = LoggerFactory.getLogger(CapacityScheduler.class);

    private static final Comparator<Candidate> BEST_FIRST = Comparator
            .comparingDouble((Candidate c) -> c.capacity().availableCpu()).reversed()
            .thenComparing(c -> c.node().id());

    private final NodeRegistry registry;
    private final CapacityFeed feed;
    private final Random random;

    public CapacityScheduler(NodeRegistry registry, CapacityFeed feed) {
        this(registry, feed, new Random());
    }

    public CapacityScheduler(NodeRegistry registry, CapacityFeed feed, Random random) {
        this.registry = registry;
        this.feed = feed;
        this.random = random;
    }

    public Placement selectNode(int cpu, int memoryGb) throws InsufficientCapacityException {
        List<Node> workers = registry.list(NodeRole.WORKER);
        if (workers.isEmpty()) {
            log.info("No worker nodes registered, cannot place {} vCPU / {} GB", cpu, memoryGb);
            throw new InsufficientCapacityException(cpu, memoryGb, 0, 0);
        }

        List<NodeCapacity> entries;
        try {
            entries = feed.listAvailable();
        } catch (CapacityFeedException | RuntimeException e) {
            Node pick = workers.get(random.nextInt(workers.size()));
            log.warn("Capacity feed unavailable ({}), placing on random worker {}", e.getMessage(), pick.id());
            return new Placement(pick.id(), pick.address(), PlacementMode.RANDOM_FALLBACK);
        }

        List<Candidate> mapped = mapToWorkers(workers, entries);

        Candidate best = mapped.stream()
                .filter(c -> c.capacity().fits(cpu, memoryGb))
                .min(BEST_FIRST)
                .orElse(null);

        if (best == null) {
            double maxCpu = mapped.stream().mapToDouble(c -> c.capacity().availableCpu()).max().orElse(0);
            double maxMemory = mapped.stream().mapToDouble(c -> c.capacity().availableMemory()).max().orElse(0);
            log.info("No worker fits {} vCPU / {} GB (max available {} vCPU / {} GB)",
                    cpu, memoryGb, maxCpu, maxMemory);
            throw new InsufficientCapacityException(cpu, memoryGb, maxCpu, maxMemory);
        }

        log.debug("Selected node {} ({} vCPU / {} GB free) for {} vCPU / {} GB",
                best.node().id(), best.capacity().availableCpu(), best.capacity().availableMemory(), cpu, memoryGb);
        return new Placement(best.node().id(), best.node().address(), PlacementMode.CAPACITY_VALIDATED);
    }

    /**
     * Upper bound for a single launch request right now.
     */
    public CapacityHeadroom maxAvailableCapacity() {
        List<Node> workers = registry.list(NodeRole.WORKER);
        try {
            List<Candidate> mapped = mapToWorkers(workers, feed.listAvailable());
            return new CapacityHeadroom(
                    mapped.stream().mapToDouble(c -> c.capacity().availableCpu()).max().orElse(0),
                    mapped.stream().mapToDouble(c -> c.capacity().availableMemory()).max().orElse(0),
                    workers.size(),
                    true);
        } catch (CapacityFeedException | RuntimeException e) {
            log.warn("Capacity feed unavailable: {}", e.getMessage());
            return new CapacityHeadroom(0, 0, workers.size(), false);
        }
    }

    /** Feed entries whose address is not a registered worker are ignored. */
    private static List<Candidate> mapToWorkers(List<Node> workers, List<NodeCapacity> entries) {
        Map<String, NodeCapacity> byAddress = new HashMap<>();
        for (NodeCapacity entry : entries) {
            if (entry != null && entry.address() != null) {
                byAddress.put(entry.address(), entry);
            }
        }
        return workers.stream()
                .filter(w -> byAddress.containsKey(w.address()))
                .map(w -> new Candidate(w, byAddress.get(w.address())))
                .toList();
    }

    private record Candidate(Node node, NodeCapacity capacity) {
    }
}
