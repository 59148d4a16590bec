package com.cycleforecast.core.prediction;

import com.cycleforecast.core.model.EstimationConfig;
import com.cycleforecast.core.model.EventLog;
import com.cycleforecast.core.model.IntervalStatistics;
import com.cycleforecast.core.model.PredictionRecord;
import com.cycleforecast.core.model.PredictionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Local statistical estimator.
 *
 * <p>
 * Predicts the next start as the last logged start plus the average interval,
 * with a confidence taken from {@link ConfidenceModel}. When no statistics can
 * be computed (a single log, or every interval filtered as an outlier) it
 * falls back to a default cycle length at the insufficient-data confidence.
 * </p>
 *
 * @since 1.0.0
 */
public class LocalEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(LocalEstimator.class);

    /** Cycle length assumed when the logs do not support statistics. */
    public static final int DEFAULT_CYCLE_LENGTH_DAYS = 28;

    static final String INSUFFICIENT_DATA_REASONING =
            "Insufficient data, using default cycle of %d days. Log more cycles for better accuracy.";

    private final Clock clock;
    private final int defaultCycleLengthDays;

    public LocalEstimator(Clock clock) {
        this(clock, DEFAULT_CYCLE_LENGTH_DAYS);
    }

    /**
     * @param clock                  source of {@code calculatedAt}
     * @param defaultCycleLengthDays fallback cycle length; must be {@code > 0}
     */
    public LocalEstimator(Clock clock, int defaultCycleLengthDays) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (defaultCycleLengthDays <= 0) {
            throw new IllegalArgumentException(
                    "defaultCycleLengthDays must be > 0, got: " + defaultCycleLengthDays);
        }
        this.defaultCycleLengthDays = defaultCycleLengthDays;
    }

    /**
     * Produce a prediction from the logs alone.
     *
     * @param logs   event logs in any order; must not be empty
     * @param config supplies the cycle-length bounds
     * @return a new prediction stamped with the current instant
     * @throws IllegalArgumentException if {@code logs} is empty
     */
    public PredictionRecord estimate(List<EventLog> logs, EstimationConfig config) {
        Objects.requireNonNull(logs, "logs must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (logs.isEmpty()) {
            throw new IllegalArgumentException("LocalEstimator requires at least one event log");
        }

        LocalDate lastStart = Collections.max(logs, EventLog.BY_START_DATE).getStartDate();
        Optional<IntervalStatistics> stats = CycleStatistics.computeStatistics(
                logs, config.getMinCycleLengthDays(), config.getMaxCycleLengthDays());

        if (stats.isEmpty()) {
            LOG.debug("No usable intervals in {} log(s); assuming {}-day cycle",
                    logs.size(), defaultCycleLengthDays);
            return PredictionRecord.builder()
                    .predictedDate(lastStart.plusDays(defaultCycleLengthDays))
                    .averageCycleLengthDays(defaultCycleLengthDays)
                    .confidence(ConfidenceModel.confidenceFor(null))
                    .calculatedAt(clock.instant())
                    .reasoning(String.format(INSUFFICIENT_DATA_REASONING, defaultCycleLengthDays))
                    .ownerKey(config.getOwnerIdentity())
                    .strategy(PredictionStrategy.LOCAL_DEFAULT)
                    .build();
        }

        IntervalStatistics s = stats.get();
        LocalDate predicted = lastStart.plusDays(s.getAverageLengthDays());
        double confidence = ConfidenceModel.confidenceFor(s.getRegularityClass());
        LOG.debug("Local prediction {} from {} sample(s), average={} regularity={} confidence={}",
                predicted, s.getSampleCount(), s.getAverageLengthDays(), s.getRegularityClass(), confidence);

        return PredictionRecord.builder()
                .predictedDate(predicted)
                .averageCycleLengthDays(s.getAverageLengthDays())
                .confidence(confidence)
                .calculatedAt(clock.instant())
                .minCycleLengthDays(s.getMinLengthDays())
                .maxCycleLengthDays(s.getMaxLengthDays())
                .reasoning(reasoningFor(s))
                .ownerKey(config.getOwnerIdentity())
                .strategy(PredictionStrategy.LOCAL)
                .build();
    }

    static String reasoningFor(IntervalStatistics stats) {
        return String.format("Based on %d cycle(s) averaging %d days. Your cycle is %s.",
                stats.getSampleCount(), stats.getAverageLengthDays(), stats.getRegularityClass().getLabel());
    }
}
