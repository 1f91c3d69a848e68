package fleetportal.core.repository;

import fleetportal.core.model.Node;
import fleetportal.core.model.NodeRole;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for registered fleet nodes.
 */
public interface NodeRepository {

    /**
     * Insert a node or replace an existing one with the same ID.
     *
     * @param node the node to save
     */
    void save(Node node);

    /**
     * Find a node by ID.
     *
     * @param nodeId the node ID
     * @return the node if found
     */
    Optional<Node> findById(String nodeId);

    /**
     * Get all nodes, ordered by ID.
     *
     * @return list of all nodes
     */
    List<Node> findAll();

    /**
     * Get all nodes with the given role, ordered by ID.
     *
     * @param role the role filter
     * @return list of nodes
     */
    List<Node> findByRole(NodeRole role);

    /**
     * Delete a node.
     *
     * @param nodeId the node ID
     * @return true if deleted
     */
    boolean delete(String nodeId);
}
