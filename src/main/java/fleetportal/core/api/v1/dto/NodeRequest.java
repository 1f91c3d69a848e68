package fleetportal.core.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fleetportal.core.model.Node;
import fleetportal.core.model.NodeRole;

/**
 * Request DTO for registering or updating a node.
 * POST /api/v1/nodes, PUT /api/v1/nodes/{id}
 */
public record NodeRequest(
        @JsonProperty("id") String id,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("address") String address,
        @JsonProperty("role") String role,
        @JsonProperty("cpuCores") Integer cpuCores,
        @JsonProperty("memoryGb") Double memoryGb,
        @JsonProperty("description") String description) {

    /**
     * @param pathId id from the URL for updates; null on create
     */
    public Node toNode(String pathId) {
        String nodeId = pathId != null ? pathId : id;
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address is required");
        }
        return Node.builder()
                .id(nodeId.trim())
                .hostname(hostname)
                .address(address.trim())
                .role(NodeRole.parse(role))
                .cpuCores(cpuCores)
                .memoryGb(memoryGb)
                .description(description)
                .build();
    }
}
