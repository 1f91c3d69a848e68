package fleetportal.core.model;

/**
 * A registered node paired with its latest probe result.
 */
public record NodeWithStatus(Node node, NodeStatus status) {
}
