package com.cycleforecast.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Bounds-checked prediction recovered from an external provider's free-form
 * answer.
 *
 * <p>
 * {@code withinExpectedRange} is {@code false} when the predicted date lies
 * outside the configured sane cycle-length window after the last logged start.
 * Such answers are kept, not rejected.
 * </p>
 *
 * @since 1.0.0
 */
public final class StructuredPrediction {

    private final LocalDate predictedDate;
    private final int averageCycleLengthDays;
    private final double confidence;
    private final String reasoning;
    private final boolean withinExpectedRange;

    public StructuredPrediction(LocalDate predictedDate, int averageCycleLengthDays, double confidence,
            String reasoning, boolean withinExpectedRange) {
        this.predictedDate = Objects.requireNonNull(predictedDate, "predictedDate must not be null");
        this.averageCycleLengthDays = averageCycleLengthDays;
        this.confidence = confidence;
        this.reasoning = Objects.requireNonNull(reasoning, "reasoning must not be null");
        this.withinExpectedRange = withinExpectedRange;
    }

    public LocalDate getPredictedDate() {
        return predictedDate;
    }

    public int getAverageCycleLengthDays() {
        return averageCycleLengthDays;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getReasoning() {
        return reasoning;
    }

    public boolean isWithinExpectedRange() {
        return withinExpectedRange;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StructuredPrediction that))
            return false;
        return averageCycleLengthDays == that.averageCycleLengthDays
                && Double.compare(confidence, that.confidence) == 0
                && withinExpectedRange == that.withinExpectedRange
                && Objects.equals(predictedDate, that.predictedDate)
                && Objects.equals(reasoning, that.reasoning);
    }

    @Override
    public int hashCode() {
        return Objects.hash(predictedDate, averageCycleLengthDays, confidence, reasoning, withinExpectedRange);
    }

    @Override
    public String toString() {
        return "StructuredPrediction{" +
                "predictedDate=" + predictedDate +
                ", averageCycleLengthDays=" + averageCycleLengthDays +
                ", confidence=" + confidence +
                ", withinExpectedRange=" + withinExpectedRange +
                ", reasoning='" + reasoning + '\'' +
                '}';
    }
}
