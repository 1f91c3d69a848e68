package fleetportal.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Live headroom of one node as reported by the capacity feed.
 */
public record NodeCapacity(
        @JsonProperty("address") String address,
        @JsonProperty("availableCpu") double availableCpu,
        @JsonProperty("availableMemory") double availableMemory) {

    public boolean fits(int cpu, int memoryGb) {
        return availableCpu >= cpu && availableMemory >= memoryGb;
    }
}
