/**
 * The cycle prediction engine.
 *
 * <p>
 * {@link com.cycleforecast.core.prediction.PredictionOrchestrator} is the
 * entry point. It delegates either to
 * {@link com.cycleforecast.core.prediction.LocalEstimator} (built on
 * {@link com.cycleforecast.core.prediction.CycleStatistics} and
 * {@link com.cycleforecast.core.prediction.ConfidenceModel}) or to an
 * {@link com.cycleforecast.core.prediction.ExternalEstimator} whose answer is
 * read by {@link com.cycleforecast.core.prediction.AIResponseInterpreter}.
 * {@link com.cycleforecast.core.prediction.RecalculationPolicy} tells callers
 * when a stored prediction has to be replaced.
 * </p>
 *
 * <p>
 * Every component is free of shared mutable state.
 * </p>
 *
 * @since 1.0.0
 */
package com.cycleforecast.core.prediction;
