package fractal.compute.exception;

/**
 * Thrown by a service driver when a step cannot proceed, e.g. a sub-record failed.
 * The service record goes to error with this message as its error output.
 */
public class ServiceIterationException extends FractalException {

    public static final String ERROR_CODE = "SERVICE_ITERATION_ERROR";

    public ServiceIterationException(String message) {
        super(ERROR_CODE, message);
    }

    public ServiceIterationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
