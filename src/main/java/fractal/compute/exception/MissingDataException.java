package fractal.compute.exception;

/**
 * Thrown when a referenced record or other entity does not exist.
 */
public class MissingDataException extends FractalException {

    public static final String ERROR_CODE = "MISSING_DATA";

    public MissingDataException(String entityType, Object entityId) {
        super(ERROR_CODE, String.format("%s not found: %s", entityType, entityId));
    }
}
