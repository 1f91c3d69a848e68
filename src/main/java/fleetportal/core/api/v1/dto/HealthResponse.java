package fleetportal.core.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("registeredNodes") Integer registeredNodes,
        @JsonProperty("capacityFeed") String capacityFeed,
        @JsonProperty("deployer") String deployer) {

    public static HealthResponse healthy(String uptime, String version, int registeredNodes,
            String capacityFeed, String deployer) {
        return new HealthResponse("healthy", "ok", uptime, version, registeredNodes, capacityFeed, deployer);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null);
    }
}
