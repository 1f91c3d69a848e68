package fleetportal.core.service;

import fleetportal.core.error.NotFoundException;
import fleetportal.core.model.Node;
import fleetportal.core.model.NodeRole;
import fleetportal.core.repository.NodeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Service layer for the set of fleet machines the portal knows about.
 */
public class NodeRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    private final NodeRepository repository;

    public NodeRegistry(NodeRepository repository) {
        this.repository = repository;
    }

    /**
     * All nodes ordered by id, optionally restricted to one role.
     */
    public List<Node> list(NodeRole role) {
        return role == null ? repository.findAll() : repository.findByRole(role);
    }

    public Node get(String nodeId) {
        return repository.findById(nodeId).orElseThrow(() -> NotFoundException.node(nodeId));
    }

    /**
     * Register a new node.
     *
     * @throws IllegalArgumentException if the id is taken or the node is incomplete
     */
    public Node add(Node node) {
        validate(node);
        if (repository.findById(node.id()).isPresent()) {
            throw new IllegalArgumentException("node already exists: " + node.id());
        }
        Node stored = node.createdAt() != null ? node : node.toBuilder().createdAt(Instant.now()).build();
        repository.save(stored);
        log.info("Registered node {} ({}, {})", stored.id(), stored.address(), stored.role());
        return stored;
    }

    /**
     * Replace the descriptive fields of an existing node. Id and creation time are kept.
     */
    public Node update(String nodeId, Node changes) {
        Node existing = get(nodeId);
        Node updated = changes.toBuilder()
                .id(existing.id())
                .createdAt(existing.createdAt())
                .build();
        validate(updated);
        repository.save(updated);
        log.info("Updated node {} ({}, {})", updated.id(), updated.address(), updated.role());
        return updated;
    }

    public void delete(String nodeId) {
        if (!repository.delete(nodeId)) {
            throw NotFoundException.node(nodeId);
        }
        log.info("Removed node {}", nodeId);
    }

    private static void validate(Node node) {
        if (node.id().isBlank()) {
            throw new IllegalArgumentException("node id is required");
        }
        if (node.address().isBlank()) {
            throw new IllegalArgumentException("node address is required");
        }
        if (node.cpuCores() != null && node.cpuCores() < 0) {
            throw new IllegalArgumentException("cpuCores must not be negative");
        }
        if (node.memoryGb() != null && node.memoryGb() < 0) {
            throw new IllegalArgumentException("memoryGb must not be negative");
        }
    }
}
