package com.cycleforecast.core.exception;

/**
 * Root of every failure the prediction engine surfaces to its caller.
 *
 * <p>
 * The engine never retries; callers decide on retry and backoff, typically
 * by consulting {@link ExternalEstimationException#isRetryable()}.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class CyclePredictionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected CyclePredictionException(String message) {
        super(message);
    }

    protected CyclePredictionException(String message, Throwable cause) {
        super(message, cause);
    }
}
