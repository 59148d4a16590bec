package com.cycleforecast.core.prediction;

import com.cycleforecast.core.model.EventLog;
import com.cycleforecast.core.model.PredictionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static com.cycleforecast.core.support.TestLogs.NOW;
import static com.cycleforecast.core.support.TestLogs.fixedClock;
import static com.cycleforecast.core.support.TestLogs.log;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RecalculationPolicy}.
 */
class RecalculationPolicyTest {

    private RecalculationPolicy policy;
    private List<EventLog> logs;

    @BeforeEach
    void setUp() {
        policy = new RecalculationPolicy(fixedClock());
        logs = List.of(
                log("a", "2025-01-05", NOW.minus(Duration.ofDays(60))),
                log("b", "2025-02-02", NOW.minus(Duration.ofDays(27))));
    }

    private static PredictionRecord prediction(Instant calculatedAt, LocalDate predictedDate) {
        return PredictionRecord.builder()
                .predictedDate(predictedDate)
                .averageCycleLengthDays(28)
                .confidence(0.7)
                .calculatedAt(calculatedAt)
                .build();
    }

    @Test
    @DisplayName("Should recalculate when nothing is stored")
    void shouldRecalculateWithoutPrediction() {
        assertThat(policy.needsRecalculation(null, logs)).isTrue();
    }

    @Test
    @DisplayName("Should keep a fresh prediction with unchanged logs and a future date")
    void shouldKeepFreshPrediction() {
        PredictionRecord current = prediction(NOW.minus(Duration.ofDays(5)), LocalDate.of(2025, 3, 2));

        assertThat(policy.needsRecalculation(current, logs)).isFalse();
    }

    @Test
    @DisplayName("Should keep a prediction whose date is today")
    void shouldKeepPredictionDueToday() {
        PredictionRecord current = prediction(NOW.minus(Duration.ofDays(5)), LocalDate.of(2025, 3, 1));

        assertThat(policy.needsRecalculation(current, logs)).isFalse();
    }

    @Test
    @DisplayName("Should recalculate once older than 30 whole days")
    void shouldRecalculateWhenStale() {
        LocalDate future = LocalDate.of(2025, 3, 20);

        assertThat(policy.needsRecalculation(prediction(NOW.minus(Duration.ofDays(31)), future), List.of()))
                .isTrue();
        assertThat(policy.needsRecalculation(prediction(NOW.minus(Duration.ofDays(30)), future), List.of()))
                .isFalse();
    }

    @Test
    @DisplayName("Should recalculate when a log was created after the prediction")
    void shouldRecalculateOnNewLog() {
        PredictionRecord current = prediction(NOW.minus(Duration.ofDays(10)), LocalDate.of(2025, 3, 2));
        List<EventLog> withNew = List.of(logs.get(0), log("c", "2025-02-28", NOW.minus(Duration.ofDays(1))));

        assertThat(policy.needsRecalculation(current, withNew)).isTrue();
    }

    @Test
    @DisplayName("Should recalculate when an older log was edited after the prediction")
    void shouldRecalculateOnEditedLog() {
        PredictionRecord current = prediction(NOW.minus(Duration.ofDays(10)), LocalDate.of(2025, 3, 2));
        EventLog edited = logs.get(0).touch(NOW.minus(Duration.ofHours(2)));

        assertThat(policy.needsRecalculation(current, List.of(edited, logs.get(1)))).isTrue();
    }

    @Test
    @DisplayName("Should recalculate once the predicted date has passed")
    void shouldRecalculateWhenDatePassed() {
        PredictionRecord current = prediction(NOW.minus(Duration.ofDays(3)), LocalDate.of(2025, 2, 28));

        assertThat(policy.needsRecalculation(current, logs)).isTrue();
    }

    @Test
    @DisplayName("Should honour a custom staleness threshold")
    void shouldHonourCustomThreshold() {
        RecalculationPolicy strict = new RecalculationPolicy(fixedClock(), 7);
        PredictionRecord current = prediction(NOW.minus(Duration.ofDays(8)), LocalDate.of(2025, 3, 20));

        assertThat(strict.getStaleAfterDays()).isEqualTo(7);
        assertThat(strict.needsRecalculation(current, List.of())).isTrue();
        assertThat(policy.needsRecalculation(current, List.of())).isFalse();
    }
}
