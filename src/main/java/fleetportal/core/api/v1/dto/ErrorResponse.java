package fleetportal.core.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of every non-2xx response.
 * The capacity figures are only present on insufficient-capacity errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        @JsonProperty("error") String error,
        @JsonProperty("detail") String detail,
        @JsonProperty("requestedCpu") Integer requestedCpu,
        @JsonProperty("requestedMemoryGb") Integer requestedMemoryGb,
        @JsonProperty("maxAvailableCpu") Integer maxAvailableCpu,
        @JsonProperty("maxAvailableMemoryGb") Integer maxAvailableMemoryGb) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null, null, null, null, null);
    }

    public static ErrorResponse of(String error, String detail) {
        return new ErrorResponse(error, detail, null, null, null, null);
    }
}
