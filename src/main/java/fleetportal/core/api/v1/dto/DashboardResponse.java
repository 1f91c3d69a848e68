package fleetportal.core.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fleetportal.core.model.InstanceCounts;

import java.time.Instant;

/**
 * Response DTO for the dashboard landing view.
 * GET /api/v1/dashboard/summary
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DashboardResponse(
        @JsonProperty("instances") InstanceCounts instances,
        @JsonProperty("quota") QuotaResponse quota,
        @JsonProperty("nodes") NodeCounts nodes,
        @JsonProperty("timestamp") Instant timestamp) {

    public record NodeCounts(
            @JsonProperty("total") int total,
            @JsonProperty("workers") int workers) {
    }
}
