package com.cycleforecast.core.prediction;

import com.cycleforecast.core.model.EventLog;
import com.cycleforecast.core.model.IntervalStatistics;
import com.cycleforecast.core.model.RegularityClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.cycleforecast.core.support.TestLogs.logs;
import static com.cycleforecast.core.support.TestLogs.withIntervals;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CycleStatistics}.
 */
class CycleStatisticsTest {

    @Test
    @DisplayName("Should return empty for fewer than two logs")
    void shouldReturnEmptyForSingleLog() {
        assertThat(CycleStatistics.computeStatistics(logs("2025-01-01"), 21, 35)).isEmpty();
        assertThat(CycleStatistics.computeStatistics(List.of(), 21, 35)).isEmpty();
    }

    @Test
    @DisplayName("Should use every interval when all lie within the bounds")
    void shouldCountAllInRangeIntervals() {
        List<EventLog> logs = withIntervals("2024-06-01", 27, 29, 31, 26, 30);

        IntervalStatistics stats = CycleStatistics.computeStatistics(logs, 21, 35).orElseThrow();

        assertThat(stats.getSampleCount()).isEqualTo(logs.size() - 1);
        assertThat(stats.getStandardDeviation()).isGreaterThanOrEqualTo(0);
        assertThat(stats.getMinLengthDays()).isEqualTo(26);
        assertThat(stats.getMaxLengthDays()).isEqualTo(31);
        assertThat(stats.getAverageLengthDays()).isEqualTo(29);
    }

    @Test
    @DisplayName("Should report zero deviation and VERY_REGULAR for constant 28-day cycles")
    void shouldClassifyConstantCyclesAsVeryRegular() {
        IntervalStatistics stats = CycleStatistics
                .computeStatistics(logs("2025-01-01", "2025-01-29", "2025-02-26"), 21, 35)
                .orElseThrow();

        assertThat(stats.getAverageLengthDays()).isEqualTo(28);
        assertThat(stats.getStandardDeviation()).isZero();
        assertThat(stats.getRegularityClass()).isEqualTo(RegularityClass.VERY_REGULAR);
        assertThat(stats.getSampleCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should sort unordered input before measuring intervals")
    void shouldSortInput() {
        List<EventLog> ordered = withIntervals("2024-01-10", 30, 25, 33);
        List<EventLog> shuffled = new ArrayList<>(ordered);
        Collections.reverse(shuffled);

        assertThat(CycleStatistics.computeStatistics(shuffled, 21, 35))
                .isEqualTo(CycleStatistics.computeStatistics(ordered, 21, 35));
    }

    @Test
    @DisplayName("Should discard intervals outside [min, max + 10]")
    void shouldDiscardOutliers() {
        // 12 is below the minimum, 46 is above 35 + 10, 45 sits exactly on the edge
        List<EventLog> logs = withIntervals("2024-01-01", 28, 12, 46, 45);

        IntervalStatistics stats = CycleStatistics.computeStatistics(logs, 21, 35).orElseThrow();

        assertThat(stats.getSampleCount()).isEqualTo(2);
        assertThat(stats.getMinLengthDays()).isEqualTo(28);
        assertThat(stats.getMaxLengthDays()).isEqualTo(45);
    }

    @Test
    @DisplayName("Should return empty when every interval is an outlier")
    void shouldReturnEmptyWhenAllFiltered() {
        Optional<IntervalStatistics> stats = CycleStatistics
                .computeStatistics(withIntervals("2024-01-01", 5, 90), 21, 35);

        assertThat(stats).isEmpty();
    }

    @Test
    @DisplayName("Should compute the population deviation around the rounded mean")
    void shouldComputePopulationDeviation() {
        // mean of 24 and 33 is 28.5, rounded to 29; deviations -5 and 4
        IntervalStatistics stats = CycleStatistics
                .computeStatistics(withIntervals("2024-01-01", 24, 33), 21, 35)
                .orElseThrow();

        assertThat(stats.getAverageLengthDays()).isEqualTo(29);
        assertThat(stats.getStandardDeviation()).isCloseTo(Math.sqrt((25 + 16) / 2.0), within(1e-9));
        assertThat(stats.getRegularityClass()).isEqualTo(RegularityClass.SOMEWHAT_IRREGULAR);
    }

    @ParameterizedTest(name = "intervals {0},{1},{2} -> {3}")
    @CsvSource({
            "28, 29, 27, VERY_REGULAR",
            "24, 28, 32, REGULAR",
            "22, 28, 36, SOMEWHAT_IRREGULAR",
            "21, 44, 23, IRREGULAR"
    })
    @DisplayName("Should bucket regularity by standard deviation")
    void shouldBucketRegularity(int a, int b, int c, RegularityClass expected) {
        IntervalStatistics stats = CycleStatistics
                .computeStatistics(withIntervals("2024-01-01", a, b, c), 21, 35)
                .orElseThrow();

        assertThat(stats.getRegularityClass()).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should list raw intervals in chronological order")
    void shouldListRawIntervals() {
        assertThat(CycleStatistics.intervalsOf(withIntervals("2024-01-01", 30, 3, 60)))
                .containsExactly(30, 3, 60);
        assertThat(CycleStatistics.intervalsOf(logs("2024-01-01"))).isEmpty();
    }
}
