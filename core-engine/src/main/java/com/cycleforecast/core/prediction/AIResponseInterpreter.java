package com.cycleforecast.core.prediction;

import com.cycleforecast.core.exception.ResponseParseException;
import com.cycleforecast.core.model.StructuredPrediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a {@link StructuredPrediction} from a provider's free-form answer.
 *
 * <h3>Parsing</h3>
 * <ol>
 * <li>Trim the text and strip every triple-backtick fence marker, with or
 * without a language tag.</li>
 * <li>Take the span from the first {@code '{'} to the last {@code '}'}, so
 * commentary before or after the payload is ignored.</li>
 * <li>Pull each field out with a pattern anchored on its key instead of a
 * strict JSON parse, so a payload with minor syntax damage (trailing commas,
 * stray quotes elsewhere) still yields every recoverable field.</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * A predicted date outside {@code [minBound, maxBound + }{@value CycleStatistics#OUTLIER_SLACK_DAYS}{@code ]}
 * days after the last start is logged and flagged, but returned: the
 * provider's judgment wins over the local heuristic bound. Confidence is
 * clamped to {@code [0, 1]}.
 * </p>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class AIResponseInterpreter {

    private static final Logger LOG = LoggerFactory.getLogger(AIResponseInterpreter.class);

    public static final String FIELD_PREDICTED_DATE = "predicted_date";
    public static final String FIELD_AVERAGE_CYCLE_LENGTH = "average_cycle_length";
    public static final String FIELD_CONFIDENCE = "confidence";
    public static final String FIELD_REASONING = "reasoning";

    /** Used when the provider omits {@code reasoning}. */
    public static final String DEFAULT_REASONING = "AI-generated prediction";

    private static final Pattern CODE_FENCE = Pattern.compile("```[A-Za-z0-9_+-]*");

    private static final Pattern PREDICTED_DATE = Pattern.compile(
            "\"" + FIELD_PREDICTED_DATE + "\"\\s*:\\s*\"\\s*(\\d{4}-\\d{2}-\\d{2})[^\"]*\"");
    private static final Pattern AVERAGE_CYCLE_LENGTH = Pattern.compile(
            "\"" + FIELD_AVERAGE_CYCLE_LENGTH + "\"\\s*:\\s*\"?\\s*(\\d+)(?:\\.0+)?\\s*\"?\\s*[,}\\s]");
    private static final Pattern CONFIDENCE = Pattern.compile(
            "\"" + FIELD_CONFIDENCE + "\"\\s*:\\s*\"?\\s*(-?(?:\\d+(?:\\.\\d*)?|\\.\\d+))");
    private static final Pattern REASONING = Pattern.compile(
            "\"" + FIELD_REASONING + "\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)\"", Pattern.DOTALL);

    /**
     * Parse and validate a provider answer.
     *
     * @param rawText       the provider's raw answer
     * @param lastEventDate most recent logged start date
     * @param minBound      smallest plausible cycle length in days
     * @param maxBound      largest expected cycle length in days
     * @return the structured prediction
     * @throws ResponseParseException if no JSON span exists or a required field
     *                                cannot be recovered
     */
    public StructuredPrediction interpret(String rawText, LocalDate lastEventDate, int minBound, int maxBound) {
        Objects.requireNonNull(lastEventDate, "lastEventDate must not be null");
        String json = extractJsonSpan(rawText == null ? "" : rawText);
        LOG.debug("Extracted JSON span: {}", json);

        LocalDate predictedDate = parseDate(json);
        int averageCycleLength = parseAverageCycleLength(json);
        double confidence = parseConfidence(json);
        String reasoning = parseReasoning(json);

        long daysSinceLast = ChronoUnit.DAYS.between(lastEventDate, predictedDate);
        int upperBound = maxBound + CycleStatistics.OUTLIER_SLACK_DAYS;
        boolean withinRange = daysSinceLast >= minBound && daysSinceLast <= upperBound;
        if (!withinRange) {
            LOG.warn("Provider predicted {} ({} day(s) after last start {}), outside [{}, {}]; keeping provider answer",
                    predictedDate, daysSinceLast, lastEventDate, minBound, upperBound);
        }

        double clamped = Math.max(0.0, Math.min(1.0, confidence));
        if (clamped != confidence) {
            LOG.debug("Clamped provider confidence {} to {}", confidence, clamped);
        }

        return new StructuredPrediction(predictedDate, averageCycleLength, clamped, reasoning, withinRange);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static String extractJsonSpan(String rawText) {
        String cleaned = CODE_FENCE.matcher(rawText.trim()).replaceAll("").trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end < start) {
            LOG.warn("No JSON object found in provider response ({} chars)", rawText.length());
            throw ResponseParseException.noJsonFound();
        }
        return cleaned.substring(start, end + 1);
    }

    private static LocalDate parseDate(String json) {
        Matcher m = PREDICTED_DATE.matcher(json);
        if (!m.find()) {
            throw missing(FIELD_PREDICTED_DATE);
        }
        try {
            return LocalDate.parse(m.group(1));
        } catch (DateTimeException e) {
            LOG.warn("Unparseable {} '{}': {}", FIELD_PREDICTED_DATE, m.group(1), e.getMessage());
            throw missing(FIELD_PREDICTED_DATE);
        }
    }

    private static int parseAverageCycleLength(String json) {
        Matcher m = AVERAGE_CYCLE_LENGTH.matcher(json);
        if (!m.find()) {
            throw missing(FIELD_AVERAGE_CYCLE_LENGTH);
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            throw missing(FIELD_AVERAGE_CYCLE_LENGTH);
        }
    }

    private static double parseConfidence(String json) {
        Matcher m = CONFIDENCE.matcher(json);
        if (!m.find()) {
            throw missing(FIELD_CONFIDENCE);
        }
        try {
            double value = Double.parseDouble(m.group(1));
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw missing(FIELD_CONFIDENCE);
            }
            return value;
        } catch (NumberFormatException e) {
            throw missing(FIELD_CONFIDENCE);
        }
    }

    private static String parseReasoning(String json) {
        Matcher m = REASONING.matcher(json);
        if (!m.find()) {
            return DEFAULT_REASONING;
        }
        String value = unescape(m.group(1)).trim();
        return value.isEmpty() ? DEFAULT_REASONING : value;
    }

    private static String unescape(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\' || i + 1 >= s.length()) {
                out.append(c);
                continue;
            }
            char next = s.charAt(++i);
            switch (next) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                default -> out.append(next);
            }
        }
        return out.toString();
    }

    private static ResponseParseException missing(String field) {
        LOG.warn("Provider response lacks a usable '{}' field", field);
        return ResponseParseException.missingField(field);
    }
}
