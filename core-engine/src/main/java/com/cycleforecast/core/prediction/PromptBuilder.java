package com.cycleforecast.core.prediction;

import com.cycleforecast.core.model.EventLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the prompt sent to the external estimation provider.
 *
 * <p>
 * The prompt lists every start date in chronological order with its distance
 * from the previous one, summarises the observed intervals and fixes the
 * JSON answer format that {@link AIResponseInterpreter} expects.
 * </p>
 *
 * @since 1.0.0
 */
public final class PromptBuilder {

    private PromptBuilder() {
        // utility class - not instantiable
    }

    /**
     * @param logs event logs in any order; must not be empty
     * @return the prompt text
     * @throws IllegalArgumentException if {@code logs} is empty
     */
    public static String build(List<EventLog> logs) {
        Objects.requireNonNull(logs, "logs must not be null");
        if (logs.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a prompt without event logs");
        }
        List<EventLog> sorted = new ArrayList<>(logs);
        sorted.sort(EventLog.BY_START_DATE);
        List<Integer> intervals = CycleStatistics.intervalsOf(sorted);

        StringBuilder history = new StringBuilder();
        for (int i = 0; i < sorted.size(); i++) {
            history.append("Cycle ").append(i + 1).append(": ").append(sorted.get(i).getStartDate());
            if (i > 0) {
                history.append(" (").append(intervals.get(i - 1)).append(" days from previous)");
            }
            history.append('\n');
        }

        double preliminaryAverage = intervals.isEmpty()
                ? LocalEstimator.DEFAULT_CYCLE_LENGTH_DAYS
                : intervals.stream().mapToInt(Integer::intValue).average().orElse(0);
        String observed = intervals.isEmpty()
                ? "N/A"
                : intervals.stream().map(String::valueOf).collect(Collectors.joining(", ")) + " days";

        return "You are a cycle prediction specialist analysing logged cycle start dates.\n"
                + "\n"
                + "HISTORICAL DATA:\n"
                + history
                + "\n"
                + "ANALYSIS CONTEXT:\n"
                + "- Total cycles logged: " + sorted.size() + '\n'
                + "- Cycle lengths observed: " + observed + '\n'
                + "- Average cycle length (preliminary): "
                + String.format(Locale.ROOT, "%.1f", preliminaryAverage) + " days\n"
                + "- Last start date: " + sorted.get(sorted.size() - 1).getStartDate() + '\n'
                + "\n"
                + "TASK:\n"
                + "Predict the NEXT start date. Consider overall regularity, trends in cycle length,\n"
                + "outliers, and how confident the data allows you to be.\n"
                + "\n"
                + "RESPONSE FORMAT (valid JSON only):\n"
                + "{\n"
                + "  \"" + AIResponseInterpreter.FIELD_PREDICTED_DATE + "\": \"YYYY-MM-DD\",\n"
                + "  \"" + AIResponseInterpreter.FIELD_AVERAGE_CYCLE_LENGTH + "\": <integer>,\n"
                + "  \"" + AIResponseInterpreter.FIELD_CONFIDENCE + "\": <number between 0.0 and 1.0>,\n"
                + "  \"" + AIResponseInterpreter.FIELD_REASONING + "\": \"<short explanation>\"\n"
                + "}\n"
                + "\n"
                + "REQUIREMENTS:\n"
                + "- Return ONLY the JSON object, without markdown or code fences\n"
                + "- Use ISO 8601 dates (YYYY-MM-DD)\n"
                + "- predicted_date should be about average_cycle_length days after the last start date\n"
                + "- Regular cycles deserve higher confidence, irregular ones lower\n";
    }
}
