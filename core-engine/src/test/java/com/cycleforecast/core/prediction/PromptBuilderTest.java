package com.cycleforecast.core.prediction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cycleforecast.core.support.TestLogs.logs;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PromptBuilder}.
 */
class PromptBuilderTest {

    @Test
    @DisplayName("Should list history chronologically with intervals")
    void shouldListHistory() {
        String prompt = PromptBuilder.build(logs("2025-01-29", "2025-01-01", "2025-02-27"));

        assertThat(prompt)
                .contains("Cycle 1: 2025-01-01\n")
                .contains("Cycle 2: 2025-01-29 (28 days from previous)")
                .contains("Cycle 3: 2025-02-27 (29 days from previous)")
                .contains("Total cycles logged: 3")
                .contains("Cycle lengths observed: 28, 29 days")
                .contains("Average cycle length (preliminary): 28.5 days")
                .contains("Last start date: 2025-02-27");
        assertThat(prompt.indexOf("2025-01-01")).isLessThan(prompt.indexOf("2025-01-29"));
    }

    @Test
    @DisplayName("Should describe the expected JSON fields")
    void shouldDescribeAnswerFormat() {
        String prompt = PromptBuilder.build(logs("2025-01-01", "2025-01-29"));

        assertThat(prompt).contains(
                "\"predicted_date\"",
                "\"average_cycle_length\"",
                "\"confidence\"",
                "\"reasoning\"");
    }

    @Test
    @DisplayName("Should handle a single log without intervals")
    void shouldHandleSingleLog() {
        String prompt = PromptBuilder.build(logs("2025-02-10"));

        assertThat(prompt)
                .contains("Cycle 1: 2025-02-10")
                .contains("Cycle lengths observed: N/A")
                .contains("Average cycle length (preliminary): 28.0 days");
    }

    @Test
    @DisplayName("Should reject empty logs")
    void shouldRejectEmptyLogs() {
        assertThatThrownBy(() -> PromptBuilder.build(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
