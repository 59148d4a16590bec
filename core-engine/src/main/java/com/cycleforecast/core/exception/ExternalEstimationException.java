package com.cycleforecast.core.exception;

import java.util.Objects;

/**
 * The external estimation provider failed, timed out, was cancelled or
 * answered with nothing.
 *
 * <p>
 * Distinct from {@link ResponseParseException}, which means the provider did
 * answer but the answer could not be understood.
 * </p>
 *
 * @since 1.0.0
 */
public class ExternalEstimationException extends CyclePredictionException {

    private static final long serialVersionUID = 1L;

    /** Why the external call produced no usable text. */
    public enum Reason {
        /** Transport or provider-side error. */
        PROVIDER_FAILURE,
        /** The provider answered with blank or missing text. */
        EMPTY_RESPONSE,
        /** No answer within the configured bound. */
        TIMEOUT,
        /** The call was cancelled or the waiting thread interrupted. */
        CANCELLED,
        /** The provider client has no credentials. */
        NOT_CONFIGURED
    }

    private final Reason reason;

    public ExternalEstimationException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public ExternalEstimationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return {@code true} for transient reasons a caller may retry
     */
    public boolean isRetryable() {
        return switch (reason) {
            case PROVIDER_FAILURE, TIMEOUT, CANCELLED -> true;
            case EMPTY_RESPONSE, NOT_CONFIGURED -> false;
        };
    }
}
