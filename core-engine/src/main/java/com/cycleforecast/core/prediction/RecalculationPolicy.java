package com.cycleforecast.core.prediction;

import com.cycleforecast.core.model.EventLog;
import com.cycleforecast.core.model.PredictionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether a stored prediction is still usable.
 *
 * <p>
 * A prediction must be recomputed when any of the following holds:
 * </p>
 * <ol>
 * <li>there is none;</li>
 * <li>more than {@code staleAfterDays} whole days passed since it was
 * calculated;</li>
 * <li>a log was created or updated after it was calculated;</li>
 * <li>its predicted date is already in the past.</li>
 * </ol>
 *
 * <p>
 * Consumed by the caller before invoking {@link PredictionOrchestrator}; the
 * orchestrator never calls it.
 * </p>
 *
 * @since 1.0.0
 */
public class RecalculationPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(RecalculationPolicy.class);

    public static final int DEFAULT_STALE_AFTER_DAYS = 30;

    private final Clock clock;
    private final int staleAfterDays;

    public RecalculationPolicy(Clock clock) {
        this(clock, DEFAULT_STALE_AFTER_DAYS);
    }

    public RecalculationPolicy(Clock clock, int staleAfterDays) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (staleAfterDays < 0) {
            throw new IllegalArgumentException("staleAfterDays must be >= 0, got: " + staleAfterDays);
        }
        this.staleAfterDays = staleAfterDays;
    }

    /**
     * @param current the stored prediction, may be {@code null}
     * @param logs    the owner's current logs; must not be {@code null}
     * @return {@code true} if the prediction must be replaced
     */
    public boolean needsRecalculation(PredictionRecord current, List<EventLog> logs) {
        Objects.requireNonNull(logs, "logs must not be null");
        if (current == null) {
            LOG.debug("Recalculation needed: no stored prediction");
            return true;
        }

        Instant now = clock.instant();
        Instant calculatedAt = current.getCalculatedAt();
        long ageDays = Duration.between(calculatedAt, now).toDays();
        if (ageDays > staleAfterDays) {
            LOG.debug("Recalculation needed: prediction is {} day(s) old", ageDays);
            return true;
        }

        for (EventLog log : logs) {
            if (log.lastModified().isAfter(calculatedAt)) {
                LOG.debug("Recalculation needed: log {} changed after {}", log.getId(), calculatedAt);
                return true;
            }
        }

        LocalDate today = LocalDate.now(clock);
        if (current.getPredictedDate().isBefore(today)) {
            LOG.debug("Recalculation needed: predicted date {} has passed", current.getPredictedDate());
            return true;
        }

        return false;
    }

    public int getStaleAfterDays() {
        return staleAfterDays;
    }
}
