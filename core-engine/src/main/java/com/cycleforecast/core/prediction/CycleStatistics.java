package com.cycleforecast.core.prediction;

import com.cycleforecast.core.model.EventLog;
import com.cycleforecast.core.model.IntervalStatistics;
import com.cycleforecast.core.model.RegularityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Interval statistics over a list of cycle start dates.
 *
 * <p>
 * Consecutive start dates (after sorting ascending) yield whole-day intervals.
 * Intervals outside {@code [minBound, maxBound + }{@value #OUTLIER_SLACK_DAYS}{@code ]}
 * are treated as data-entry outliers and discarded; the slack keeps long but
 * legitimate cycles in the sample. The surviving intervals give a rounded
 * mean, the extrema and the population standard deviation around that mean.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * Sums are accumulated in ascending start-date order so identical input
 * always produces bit-identical output.
 * </p>
 *
 * @since 1.0.0
 */
public final class CycleStatistics {

    private static final Logger LOG = LoggerFactory.getLogger(CycleStatistics.class);

    /** Days tolerated above the configured maximum before an interval is an outlier. */
    public static final int OUTLIER_SLACK_DAYS = 10;

    private CycleStatistics() {
        // utility class - not instantiable
    }

    /**
     * Compute statistics for the given logs.
     *
     * @param logs     event logs in any order; must not be {@code null}
     * @param minBound smallest plausible cycle length in days
     * @param maxBound largest expected cycle length in days (the slack is
     *                 added internally)
     * @return the statistics, or empty when fewer than two logs are given or
     *         every interval was filtered out
     * @throws NullPointerException if {@code logs} is {@code null}
     */
    public static Optional<IntervalStatistics> computeStatistics(List<EventLog> logs, int minBound, int maxBound) {
        Objects.requireNonNull(logs, "logs must not be null");
        if (logs.size() < 2) {
            return Optional.empty();
        }

        int upperBound = maxBound + OUTLIER_SLACK_DAYS;
        List<Integer> samples = new ArrayList<>();
        for (int interval : intervalsOf(logs)) {
            if (interval >= minBound && interval <= upperBound) {
                samples.add(interval);
            } else {
                LOG.debug("Discarding outlier interval of {} day(s), accepted range [{}, {}]",
                        interval, minBound, upperBound);
            }
        }

        if (samples.isEmpty()) {
            LOG.debug("All {} interval(s) filtered as outliers", logs.size() - 1);
            return Optional.empty();
        }

        long sum = 0;
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int s : samples) {
            sum += s;
            min = Math.min(min, s);
            max = Math.max(max, s);
        }
        int average = (int) Math.round((double) sum / samples.size());

        double sumSquaredDiff = 0;
        for (int s : samples) {
            double diff = s - average;
            sumSquaredDiff += diff * diff;
        }
        double stdDev = Math.sqrt(sumSquaredDiff / samples.size());

        return Optional.of(new IntervalStatistics(average, min, max, stdDev,
                RegularityClass.fromStandardDeviation(stdDev), samples.size()));
    }

    /**
     * Whole-day differences between chronologically consecutive start dates,
     * unfiltered.
     *
     * @param logs event logs in any order; must not be {@code null}
     * @return {@code n - 1} intervals in ascending start-date order (empty for
     *         fewer than two logs)
     */
    public static List<Integer> intervalsOf(List<EventLog> logs) {
        Objects.requireNonNull(logs, "logs must not be null");
        List<EventLog> sorted = new ArrayList<>(logs);
        sorted.sort(EventLog.BY_START_DATE);

        List<Integer> intervals = new ArrayList<>(Math.max(0, sorted.size() - 1));
        for (int i = 1; i < sorted.size(); i++) {
            intervals.add((int) ChronoUnit.DAYS.between(
                    sorted.get(i - 1).getStartDate(), sorted.get(i).getStartDate()));
        }
        return intervals;
    }
}
