package fleetportal.core.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fleetportal.core.placement.CapacityHeadroom;

/**
 * Largest request a single worker can take right now.
 * GET /api/v1/cluster/capacity
 */
public record CapacityResponse(
        @JsonProperty("maxCpu") int maxCpu,
        @JsonProperty("maxMemoryGb") int maxMemoryGb,
        @JsonProperty("workers") int workers,
        @JsonProperty("live") boolean live) {

    public static CapacityResponse from(CapacityHeadroom headroom) {
        return new CapacityResponse(
                (int) headroom.maxCpu(),
                (int) headroom.maxMemory(),
                headroom.workerCount(),
                headroom.live());
    }
}
