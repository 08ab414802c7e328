package fractal.compute.exception;

/**
 * Thrown when a compute manager is unknown or may not interact with the queue.
 * The whole request is refused without any partial effect.
 */
public class ComputeManagerException extends FractalException {

    public static final String ERROR_CODE = "COMPUTE_MANAGER_ERROR";

    public ComputeManagerException(String message) {
        super(ERROR_CODE, message);
    }

    public static ComputeManagerException doesNotExist(String managerName) {
        return new ComputeManagerException("Manager does not exist: " + managerName);
    }

    public static ComputeManagerException notActive(String managerName) {
        return new ComputeManagerException("Manager is not active: " + managerName);
    }
}
