package fractal.compute.exception;

import fractal.compute.model.RecordStatus;

/**
 * Thrown when a record status change is not allowed by the record state machine.
 */
public class InvalidStateTransitionException extends FractalException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(long recordId, RecordStatus currentState, RecordStatus targetState) {
        super(ERROR_CODE, String.format(
                "Cannot transition record %d from %s to %s",
                recordId, currentState, targetState));
    }
}
