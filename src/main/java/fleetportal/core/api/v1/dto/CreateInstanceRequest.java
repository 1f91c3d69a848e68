package fleetportal.core.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import fleetportal.core.model.InstanceSpec;

import java.util.Map;

/**
 * Request DTO for launching an instance.
 * POST /api/v1/instances
 */
public record CreateInstanceRequest(
        @JsonProperty("name") String name,
        @JsonProperty("image") String image,
        @JsonProperty("cpu") Integer cpu,
        @JsonProperty("memoryGb") @JsonAlias("memory") Integer memoryGb,
        @JsonProperty("env") Map<String, String> env) {

    private static final int DEFAULT_CPU = 1;
    private static final int DEFAULT_MEMORY_GB = 2;

    /** Missing cpu/memory fall back to 1 vCPU / 2 GB */
    public InstanceSpec toSpec() {
        return new InstanceSpec(
                name,
                image,
                cpu != null ? cpu : DEFAULT_CPU,
                memoryGb != null ? memoryGb : DEFAULT_MEMORY_GB,
                env);
    }
}
