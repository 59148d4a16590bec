package com.cycleforecast.core.exception;

/**
 * Thrown when a prediction is requested for an empty log list.
 *
 * <p>
 * This is a programming error in the caller, not a user-recoverable
 * condition.
 * </p>
 *
 * @since 1.0.0
 */
public class EmptyLogsException extends CyclePredictionException {

    private static final long serialVersionUID = 1L;

    public EmptyLogsException() {
        super("No event logs available for prediction");
    }
}
