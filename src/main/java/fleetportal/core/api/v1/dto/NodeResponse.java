package fleetportal.core.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fleetportal.core.model.Node;
import fleetportal.core.model.PortUsage;

import java.time.Instant;

/**
 * Response DTO for a registered node.
 * Port usage is only filled in on single-node lookups.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeResponse(
        @JsonProperty("id") String id,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("address") String address,
        @JsonProperty("role") String role,
        @JsonProperty("cpuCores") Integer cpuCores,
        @JsonProperty("memoryGb") Double memoryGb,
        @JsonProperty("description") String description,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("ports") PortUsageResponse ports) {

    public static NodeResponse from(Node node) {
        return from(node, null);
    }

    public static NodeResponse from(Node node, PortUsage usage) {
        return new NodeResponse(
                node.id(),
                node.hostname(),
                node.address(),
                node.role().name().toLowerCase(),
                node.cpuCores(),
                node.memoryGb(),
                node.description(),
                node.createdAt(),
                usage != null ? PortUsageResponse.from(usage) : null);
    }

    public record PortUsageResponse(
            @JsonProperty("allocated") int allocated,
            @JsonProperty("available") int available,
            @JsonProperty("highWaterMark") int highWaterMark) {

        static PortUsageResponse from(PortUsage usage) {
            return new PortUsageResponse(usage.allocatedCount(), usage.availableCount(), usage.highWaterMark());
        }
    }
}
