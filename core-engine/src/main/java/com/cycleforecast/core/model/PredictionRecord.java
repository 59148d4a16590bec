package com.cycleforecast.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Best-estimate next cycle start produced by one prediction run.
 *
 * <p>
 * At most one record is "current" per owner; the persistence layer enforces
 * that by replacing. A record is invalidated logically, when
 * {@code RecalculationPolicy} reports it stale, and is never mutated: use
 * {@link #toBuilder()} to derive a modified copy.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * {@code predictedDate} and {@code calculatedAt} are required and
 * {@code confidence} must lie in {@code [0, 1]}; {@link Builder#build()}
 * rejects anything else.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = PredictionRecord.Builder.class)
public final class PredictionRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Half-width, in days, of the window shown around the predicted date. */
    public static final int WINDOW_DAYS = 2;

    private final LocalDate predictedDate;
    private final int averageCycleLengthDays;
    private final double confidence;
    private final Instant calculatedAt;
    private final Integer minCycleLengthDays;
    private final Integer maxCycleLengthDays;
    private final String reasoning;
    private final String ownerKey;
    private final PredictionStrategy strategy;

    private PredictionRecord(Builder builder) {
        this.predictedDate = Objects.requireNonNull(builder.predictedDate, "predictedDate must not be null");
        this.calculatedAt = Objects.requireNonNull(builder.calculatedAt, "calculatedAt must not be null");
        if (Double.isNaN(builder.confidence) || builder.confidence < 0.0 || builder.confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + builder.confidence);
        }
        this.averageCycleLengthDays = builder.averageCycleLengthDays;
        this.confidence = builder.confidence;
        this.minCycleLengthDays = builder.minCycleLengthDays;
        this.maxCycleLengthDays = builder.maxCycleLengthDays;
        this.reasoning = builder.reasoning;
        this.ownerKey = builder.ownerKey;
        this.strategy = builder.strategy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .predictedDate(predictedDate)
                .averageCycleLengthDays(averageCycleLengthDays)
                .confidence(confidence)
                .calculatedAt(calculatedAt)
                .minCycleLengthDays(minCycleLengthDays)
                .maxCycleLengthDays(maxCycleLengthDays)
                .reasoning(reasoning)
                .ownerKey(ownerKey)
                .strategy(strategy);
    }

    // ---------------------------------------------------------------
    // Derived views
    // ---------------------------------------------------------------

    /**
     * @return first day of the prediction window
     */
    public LocalDate earliestDate() {
        return predictedDate.minusDays(WINDOW_DAYS);
    }

    /**
     * @return last day of the prediction window
     */
    public LocalDate latestDate() {
        return predictedDate.plusDays(WINDOW_DAYS);
    }

    /**
     * @param date calendar day to test
     * @return {@code true} if {@code date} lies within
     *         {@value #WINDOW_DAYS} days of the predicted date
     */
    public boolean covers(LocalDate date) {
        return Math.abs(ChronoUnit.DAYS.between(predictedDate, date)) <= WINDOW_DAYS;
    }

    public ConfidenceLevel confidenceLevel() {
        return ConfidenceLevel.of(confidence);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public LocalDate getPredictedDate() {
        return predictedDate;
    }

    public int getAverageCycleLengthDays() {
        return averageCycleLengthDays;
    }

    public double getConfidence() {
        return confidence;
    }

    public Instant getCalculatedAt() {
        return calculatedAt;
    }

    public Integer getMinCycleLengthDays() {
        return minCycleLengthDays;
    }

    public Integer getMaxCycleLengthDays() {
        return maxCycleLengthDays;
    }

    public String getReasoning() {
        return reasoning;
    }

    public String getOwnerKey() {
        return ownerKey;
    }

    public PredictionStrategy getStrategy() {
        return strategy;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private LocalDate predictedDate;
        private int averageCycleLengthDays;
        private double confidence;
        private Instant calculatedAt;
        private Integer minCycleLengthDays;
        private Integer maxCycleLengthDays;
        private String reasoning;
        private String ownerKey;
        private PredictionStrategy strategy;

        public Builder predictedDate(LocalDate predictedDate) {
            this.predictedDate = predictedDate;
            return this;
        }

        public Builder averageCycleLengthDays(int averageCycleLengthDays) {
            this.averageCycleLengthDays = averageCycleLengthDays;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder calculatedAt(Instant calculatedAt) {
            this.calculatedAt = calculatedAt;
            return this;
        }

        public Builder minCycleLengthDays(Integer minCycleLengthDays) {
            this.minCycleLengthDays = minCycleLengthDays;
            return this;
        }

        public Builder maxCycleLengthDays(Integer maxCycleLengthDays) {
            this.maxCycleLengthDays = maxCycleLengthDays;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder ownerKey(String ownerKey) {
            this.ownerKey = ownerKey;
            return this;
        }

        public Builder strategy(PredictionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        /**
         * @return a new {@link PredictionRecord}
         * @throws NullPointerException     if {@code predictedDate} or
         *                                  {@code calculatedAt} is missing
         * @throws IllegalArgumentException if {@code confidence} is outside
         *                                  {@code [0, 1]}
         */
        public PredictionRecord build() {
            return new PredictionRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PredictionRecord that))
            return false;
        return averageCycleLengthDays == that.averageCycleLengthDays
                && Double.compare(confidence, that.confidence) == 0
                && Objects.equals(predictedDate, that.predictedDate)
                && Objects.equals(calculatedAt, that.calculatedAt)
                && Objects.equals(minCycleLengthDays, that.minCycleLengthDays)
                && Objects.equals(maxCycleLengthDays, that.maxCycleLengthDays)
                && Objects.equals(reasoning, that.reasoning)
                && Objects.equals(ownerKey, that.ownerKey)
                && strategy == that.strategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(predictedDate, averageCycleLengthDays, confidence, calculatedAt,
                minCycleLengthDays, maxCycleLengthDays, reasoning, ownerKey, strategy);
    }

    @Override
    public String toString() {
        return "PredictionRecord{" +
                "predictedDate=" + predictedDate +
                ", averageCycleLengthDays=" + averageCycleLengthDays +
                ", confidence=" + Math.round(confidence * 100) + '%' +
                ", strategy=" + strategy +
                ", ownerKey='" + ownerKey + '\'' +
                ", calculatedAt=" + calculatedAt +
                '}';
    }
}
