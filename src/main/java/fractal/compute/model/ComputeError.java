package fractal.compute.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error description attached to a failed computation.
 */
public record ComputeError(
        @JsonProperty("error_type") String errorType,
        @JsonProperty("error_message") String errorMessage) {

    /** Error type used for failures synthesized by the server itself */
    public static final String INTERNAL_ERROR = "internal_fractal_error";

    public static ComputeError internal(String message) {
        return new ComputeError(INTERNAL_ERROR, message);
    }
}
