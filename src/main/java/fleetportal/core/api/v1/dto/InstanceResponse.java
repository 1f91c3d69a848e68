package fleetportal.core.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fleetportal.core.model.Instance;

import java.time.Instant;

/**
 * Response DTO for instance information.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InstanceResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("image") String image,
        @JsonProperty("status") String status,
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("port") Integer port,
        @JsonProperty("accessUrl") String accessUrl,
        @JsonProperty("cpu") int cpu,
        @JsonProperty("memoryGb") int memoryGb,
        @JsonProperty("uptimeSeconds") Long uptimeSeconds,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("stoppedAt") Instant stoppedAt) {

    /** Create response from domain model */
    public static InstanceResponse from(Instance instance) {
        return new InstanceResponse(
                instance.id(),
                instance.name(),
                instance.image(),
                instance.status().name().toLowerCase(),
                instance.nodeId(),
                instance.port(),
                instance.accessUrl(),
                instance.cpu(),
                instance.memoryGb(),
                instance.uptimeSeconds(Instant.now()),
                instance.errorMessage(),
                instance.createdAt(),
                instance.startedAt(),
                instance.stoppedAt());
    }
}
