/**
 * Value types shared by the prediction engine and its callers.
 *
 * <ul>
 * <li>{@link com.cycleforecast.core.model.EventLog} - one logged cycle
 * start</li>
 * <li>{@link com.cycleforecast.core.model.IntervalStatistics} - derived
 * interval statistics</li>
 * <li>{@link com.cycleforecast.core.model.PredictionRecord} - a normalized
 * prediction</li>
 * <li>{@link com.cycleforecast.core.model.EstimationConfig} - per-call
 * estimation settings</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.cycleforecast.core.model;
