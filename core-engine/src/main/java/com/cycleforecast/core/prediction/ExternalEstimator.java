package com.cycleforecast.core.prediction;

import java.util.concurrent.CompletableFuture;

/**
 * Capability for the external generative-AI estimation provider.
 *
 * <p>
 * Accepts a textual prompt and completes with the provider's raw answer, or
 * exceptionally on failure. Implementations should complete exceptionally
 * with an {@link com.cycleforecast.core.exception.ExternalEstimationException}
 * when they can name the reason; any other exception is reported as a provider
 * failure.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExternalEstimator {

    /**
     * @param prompt the full prompt text
     * @return future completing with the provider's free-form answer
     */
    CompletableFuture<String> generate(String prompt);
}
