package com.cycleforecast.core.model;

/**
 * Estimation path that produced a {@link PredictionRecord}.
 *
 * @since 1.0.0
 */
public enum PredictionStrategy {

    /** Local statistical model over the logged intervals. */
    LOCAL,

    /** Not enough usable intervals; a default cycle length was assumed. */
    LOCAL_DEFAULT,

    /** Structured answer from the external generative-AI provider. */
    EXTERNAL
}
