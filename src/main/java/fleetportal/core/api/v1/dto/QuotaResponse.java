package fleetportal.core.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fleetportal.core.model.UserQuota;

/**
 * Response DTO for a user's quota.
 * GET /api/v1/quota
 */
public record QuotaResponse(
        @JsonProperty("userId") String userId,
        @JsonProperty("username") String username,
        @JsonProperty("instances") Usage instances,
        @JsonProperty("cpu") Usage cpu,
        @JsonProperty("memoryGb") Usage memoryGb) {

    public record Usage(
            @JsonProperty("used") int used,
            @JsonProperty("max") int max,
            @JsonProperty("available") int available,
            @JsonProperty("percent") double percent) {
    }

    public static QuotaResponse from(UserQuota q) {
        double instancePercent = q.maxInstances() == 0
                ? 0.0
                : Math.round(q.usedInstances() * 1000.0 / q.maxInstances()) / 10.0;
        return new QuotaResponse(
                q.userId(),
                q.username(),
                new Usage(q.usedInstances(), q.maxInstances(), q.availableInstances(), instancePercent),
                new Usage(q.usedCpu(), q.maxCpu(), q.availableCpu(), q.cpuUsagePercent()),
                new Usage(q.usedMemory(), q.maxMemory(), q.availableMemory(), q.memoryUsagePercent()));
    }
}
