package fleetportal.core.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fleetportal.core.model.ClusterSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for cluster health.
 * GET /api/v1/cluster/status
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClusterStatusResponse(
        @JsonProperty("clusterName") String clusterName,
        @JsonProperty("health") String health,
        @JsonProperty("summary") Summary summary,
        @JsonProperty("message") String message,
        @JsonProperty("checkedAt") Instant checkedAt,
        @JsonProperty("nodes") List<NodeStatusResponse> nodes) {

    public record Summary(
            @JsonProperty("totalNodes") int totalNodes,
            @JsonProperty("onlineNodes") int onlineNodes,
            @JsonProperty("offlineNodes") int offlineNodes,
            @JsonProperty("healthyNodes") int healthyNodes,
            @JsonProperty("unhealthyNodes") int unhealthyNodes,
            @JsonProperty("availabilityPercent") double availabilityPercent) {
    }

    public static ClusterStatusResponse from(ClusterSnapshot snapshot) {
        return new ClusterStatusResponse(
                snapshot.clusterName(),
                snapshot.grade().name().toLowerCase(),
                new Summary(
                        snapshot.totalNodes(),
                        snapshot.onlineNodes(),
                        snapshot.offlineNodes(),
                        snapshot.healthyNodes(),
                        snapshot.unhealthyNodes(),
                        snapshot.availabilityPercent()),
                snapshot.message(),
                snapshot.checkedAt(),
                snapshot.hasNodeDetail()
                        ? snapshot.nodes().stream().map(NodeStatusResponse::from).toList()
                        : null);
    }
}
