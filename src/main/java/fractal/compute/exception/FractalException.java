package fractal.compute.exception;

/**
 * Base exception for all errors raised by the compute engine.
 */
public class FractalException extends RuntimeException {

    private final String errorCode;

    public FractalException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public FractalException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
