package com.cycleforecast.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Descriptive statistics over the inter-event intervals that survived outlier
 * filtering.
 *
 * <p>
 * Derived and ephemeral: recomputed from the full log list every time it is
 * requested and never persisted on its own.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IntervalStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int averageLengthDays;
    private final int minLengthDays;
    private final int maxLengthDays;
    private final double standardDeviation;
    private final RegularityClass regularityClass;
    private final int sampleCount;

    /**
     * @throws IllegalArgumentException if {@code sampleCount < 1}, the extrema
     *                                  are inverted or the deviation is negative
     */
    @JsonCreator
    public IntervalStatistics(@JsonProperty("averageLengthDays") int averageLengthDays,
            @JsonProperty("minLengthDays") int minLengthDays,
            @JsonProperty("maxLengthDays") int maxLengthDays,
            @JsonProperty("standardDeviation") double standardDeviation,
            @JsonProperty("regularityClass") RegularityClass regularityClass,
            @JsonProperty("sampleCount") int sampleCount) {
        if (sampleCount < 1) {
            throw new IllegalArgumentException("sampleCount must be >= 1, got: " + sampleCount);
        }
        if (minLengthDays > maxLengthDays) {
            throw new IllegalArgumentException(
                    "minLengthDays (" + minLengthDays + ") must be <= maxLengthDays (" + maxLengthDays + ")");
        }
        if (standardDeviation < 0) {
            throw new IllegalArgumentException("standardDeviation must be >= 0, got: " + standardDeviation);
        }
        this.averageLengthDays = averageLengthDays;
        this.minLengthDays = minLengthDays;
        this.maxLengthDays = maxLengthDays;
        this.standardDeviation = standardDeviation;
        this.regularityClass = Objects.requireNonNull(regularityClass, "regularityClass must not be null");
        this.sampleCount = sampleCount;
    }

    public int getAverageLengthDays() {
        return averageLengthDays;
    }

    public int getMinLengthDays() {
        return minLengthDays;
    }

    public int getMaxLengthDays() {
        return maxLengthDays;
    }

    public double getStandardDeviation() {
        return standardDeviation;
    }

    public RegularityClass getRegularityClass() {
        return regularityClass;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IntervalStatistics that))
            return false;
        return averageLengthDays == that.averageLengthDays
                && minLengthDays == that.minLengthDays
                && maxLengthDays == that.maxLengthDays
                && Double.compare(standardDeviation, that.standardDeviation) == 0
                && regularityClass == that.regularityClass
                && sampleCount == that.sampleCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(averageLengthDays, minLengthDays, maxLengthDays,
                standardDeviation, regularityClass, sampleCount);
    }

    @Override
    public String toString() {
        return String.format("IntervalStatistics{average=%d, min=%d, max=%d, stdDev=%.2f, regularity=%s, samples=%d}",
                averageLengthDays, minLengthDays, maxLengthDays, standardDeviation, regularityClass, sampleCount);
    }
}
