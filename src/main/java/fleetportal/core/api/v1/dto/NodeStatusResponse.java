package fleetportal.core.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fleetportal.core.model.NodeWithStatus;

import java.time.Instant;

/**
 * Response DTO pairing a node with its latest probe result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeStatusResponse(
        @JsonProperty("id") String id,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("address") String address,
        @JsonProperty("role") String role,
        @JsonProperty("health") String health,
        @JsonProperty("online") boolean online,
        @JsonProperty("responseTimeMs") double responseTimeMs,
        @JsonProperty("checkedAt") Instant checkedAt,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("cpuCores") Integer cpuCores,
        @JsonProperty("memoryGb") Double memoryGb) {

    public static NodeStatusResponse from(NodeWithStatus n) {
        return new NodeStatusResponse(
                n.node().id(),
                n.node().hostname(),
                n.node().address(),
                n.node().role().name().toLowerCase(),
                n.status().health().name().toLowerCase(),
                n.status().online(),
                n.status().responseTimeMs(),
                n.status().checkedAt(),
                n.status().errorMessage(),
                n.node().cpuCores(),
                n.node().memoryGb());
    }
}
