package com.cycleforecast.core.prediction;

import com.cycleforecast.core.exception.EmptyLogsException;
import com.cycleforecast.core.exception.ExternalEstimationException;
import com.cycleforecast.core.exception.ExternalEstimationException.Reason;
import com.cycleforecast.core.exception.ResponseParseException;
import com.cycleforecast.core.model.EstimationConfig;
import com.cycleforecast.core.model.EventLog;
import com.cycleforecast.core.model.IntervalStatistics;
import com.cycleforecast.core.model.PredictionRecord;
import com.cycleforecast.core.model.PredictionStrategy;
import com.cycleforecast.core.model.StructuredPrediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of the prediction engine.
 *
 * <h3>Strategy</h3>
 * <p>
 * When {@link EstimationConfig#useExternalEstimator()} holds, the sorted logs
 * are rendered into a prompt, sent to the supplied {@link ExternalEstimator}
 * and the answer is interpreted by {@link AIResponseInterpreter}. Otherwise
 * {@link LocalEstimator} produces the prediction and the estimator is never
 * touched.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * An opted-in caller gets an externally derived answer or an exception, never
 * a silent downgrade to the local model:
 * </p>
 * <ul>
 * <li>{@link EmptyLogsException} - no logs were given</li>
 * <li>{@link ExternalEstimationException} - the provider failed, timed out,
 * was cancelled or answered with nothing</li>
 * <li>{@link ResponseParseException} - the answer could not be parsed</li>
 * </ul>
 * <p>
 * Nothing is retried here; the caller owns the latency budget.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Holds only immutable collaborators, so one instance can be shared by
 * concurrent callers predicting for different owners.
 * </p>
 *
 * @since 1.0.0
 */
public class PredictionOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(PredictionOrchestrator.class);

    /** Upper bound on waiting for the external estimator by default. */
    public static final Duration DEFAULT_EXTERNAL_TIMEOUT = Duration.ofSeconds(30);

    /** Appended to the reasoning of an external answer outside the expected interval range. */
    static final String OUT_OF_RANGE_NOTE =
            " (Predicted %d day(s) after the last start, outside the expected %d-%d day range.)";

    private final Clock clock;
    private final Duration externalTimeout;
    private final LocalEstimator localEstimator;
    private final AIResponseInterpreter interpreter = new AIResponseInterpreter();

    public PredictionOrchestrator(Clock clock) {
        this(clock, DEFAULT_EXTERNAL_TIMEOUT, LocalEstimator.DEFAULT_CYCLE_LENGTH_DAYS);
    }

    /**
     * @param clock                  source of {@code calculatedAt}
     * @param externalTimeout        how long to wait for the external
     *                               estimator; must be positive
     * @param defaultCycleLengthDays fallback cycle length for the local model
     */
    public PredictionOrchestrator(Clock clock, Duration externalTimeout, int defaultCycleLengthDays) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.externalTimeout = Objects.requireNonNull(externalTimeout, "externalTimeout must not be null");
        if (externalTimeout.isZero() || externalTimeout.isNegative()) {
            throw new IllegalArgumentException("externalTimeout must be positive, got: " + externalTimeout);
        }
        this.localEstimator = new LocalEstimator(clock, defaultCycleLengthDays);
    }

    /**
     * Predict the next cycle start.
     *
     * @param logs              event logs in any order
     * @param config            per-call estimation settings
     * @param externalEstimator provider capability; may be {@code null} when
     *                          the config does not select external estimation
     * @return a normalized prediction stamped with the owner and current
     *         instant
     * @throws EmptyLogsException           if {@code logs} is empty
     * @throws ExternalEstimationException  if the external call fails
     * @throws ResponseParseException       if the external answer is unusable
     */
    public PredictionRecord predictNext(List<EventLog> logs, EstimationConfig config,
            ExternalEstimator externalEstimator) {
        Objects.requireNonNull(logs, "logs must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (logs.isEmpty()) {
            throw new EmptyLogsException();
        }

        List<EventLog> sorted = new ArrayList<>(logs);
        sorted.sort(EventLog.BY_START_DATE);

        PredictionRecord result;
        if (config.useExternalEstimator()) {
            Objects.requireNonNull(externalEstimator,
                    "externalEstimator must not be null when external estimation is selected");
            LOG.debug("Predicting externally for owner={} from {} log(s)", config.getOwnerIdentity(), sorted.size());
            result = predictExternally(sorted, config, externalEstimator);
        } else {
            LOG.debug("Predicting locally for owner={} from {} log(s)", config.getOwnerIdentity(), sorted.size());
            result = localEstimator.estimate(sorted, config);
        }

        PredictionRecord stamped = result.toBuilder()
                .ownerKey(config.getOwnerIdentity())
                .calculatedAt(clock.instant())
                .build();
        LOG.info("Prediction for owner={}: {} (strategy={}, confidence={})", stamped.getOwnerKey(),
                stamped.getPredictedDate(), stamped.getStrategy(), stamped.getConfidence());
        return stamped;
    }

    // ---------------------------------------------------------------
    // External path
    // ---------------------------------------------------------------

    private PredictionRecord predictExternally(List<EventLog> sorted, EstimationConfig config,
            ExternalEstimator estimator) {
        String answer = awaitAnswer(estimator, PromptBuilder.build(sorted));

        LocalDate lastStart = sorted.get(sorted.size() - 1).getStartDate();
        StructuredPrediction parsed = interpreter.interpret(answer, lastStart,
                config.getMinCycleLengthDays(), config.getMaxCycleLengthDays());

        Optional<IntervalStatistics> stats = CycleStatistics.computeStatistics(
                sorted, config.getMinCycleLengthDays(), config.getMaxCycleLengthDays());

        return PredictionRecord.builder()
                .predictedDate(parsed.getPredictedDate())
                .averageCycleLengthDays(parsed.getAverageCycleLengthDays())
                .confidence(parsed.getConfidence())
                .calculatedAt(clock.instant())
                .minCycleLengthDays(stats.map(IntervalStatistics::getMinLengthDays).orElse(null))
                .maxCycleLengthDays(stats.map(IntervalStatistics::getMaxLengthDays).orElse(null))
                .reasoning(reasoningFor(parsed, lastStart, config))
                .strategy(PredictionStrategy.EXTERNAL)
                .build();
    }

    private static String reasoningFor(StructuredPrediction parsed, LocalDate lastStart, EstimationConfig config) {
        if (parsed.isWithinExpectedRange()) {
            return parsed.getReasoning();
        }
        long days = ChronoUnit.DAYS.between(lastStart, parsed.getPredictedDate());
        return parsed.getReasoning() + String.format(OUT_OF_RANGE_NOTE, days, config.getMinCycleLengthDays(),
                config.getMaxCycleLengthDays() + CycleStatistics.OUTLIER_SLACK_DAYS);
    }

    private String awaitAnswer(ExternalEstimator estimator, String prompt) {
        CompletableFuture<String> future;
        try {
            future = estimator.generate(prompt);
        } catch (ExternalEstimationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExternalEstimationException(Reason.PROVIDER_FAILURE,
                    "External estimator failed to start: " + e.getMessage(), e);
        }
        if (future == null) {
            throw new ExternalEstimationException(Reason.PROVIDER_FAILURE, "External estimator returned no result");
        }

        String answer;
        try {
            answer = future.get(externalTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExternalEstimationException(Reason.TIMEOUT,
                    "External estimator did not answer within " + externalTimeout, e);
        } catch (CancellationException e) {
            throw new ExternalEstimationException(Reason.CANCELLED, "External estimation was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ExternalEstimationException(Reason.CANCELLED,
                    "Interrupted while waiting for the external estimator", e);
        } catch (ExecutionException e) {
            throw translate(e.getCause());
        }

        if (answer == null || answer.isBlank()) {
            throw new ExternalEstimationException(Reason.EMPTY_RESPONSE, "External estimator returned an empty answer");
        }
        return answer;
    }

    private static ExternalEstimationException translate(Throwable cause) {
        if (cause instanceof ExternalEstimationException ee) {
            return new ExternalEstimationException(ee.getReason(), ee.getMessage(), ee);
        }
        if (cause instanceof CancellationException) {
            return new ExternalEstimationException(Reason.CANCELLED, "External estimation was cancelled", cause);
        }
        String detail = cause == null ? "unknown error" : cause.getMessage();
        return new ExternalEstimationException(Reason.PROVIDER_FAILURE, "External estimator failed: " + detail, cause);
    }
}
