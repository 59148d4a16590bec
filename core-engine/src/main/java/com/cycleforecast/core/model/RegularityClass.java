package com.cycleforecast.core.model;

/**
 * Qualitative bucket derived from the standard deviation of cycle intervals.
 *
 * <p>
 * Thresholds are inclusive upper bounds on the population standard deviation
 * (in days): {@code <= 2}, {@code <= 4}, {@code <= 7}, anything larger.
 * </p>
 *
 * @since 1.0.0
 */
public enum RegularityClass {

    VERY_REGULAR("Very Regular", 2.0),
    REGULAR("Regular", 4.0),
    SOMEWHAT_IRREGULAR("Somewhat Irregular", 7.0),
    IRREGULAR("Irregular", Double.POSITIVE_INFINITY);

    private final String label;
    private final double maxStandardDeviation;

    RegularityClass(String label, double maxStandardDeviation) {
        this.label = label;
        this.maxStandardDeviation = maxStandardDeviation;
    }

    /**
     * Classify a standard deviation.
     *
     * @param standardDeviation population standard deviation in days; must be
     *                          {@code >= 0}
     * @return the first class whose upper bound is not exceeded
     * @throws IllegalArgumentException if the value is negative or NaN
     */
    public static RegularityClass fromStandardDeviation(double standardDeviation) {
        if (Double.isNaN(standardDeviation) || standardDeviation < 0) {
            throw new IllegalArgumentException(
                    "standardDeviation must be >= 0, got: " + standardDeviation);
        }
        for (RegularityClass candidate : values()) {
            if (standardDeviation <= candidate.maxStandardDeviation) {
                return candidate;
            }
        }
        return IRREGULAR;
    }

    /**
     * @return human-readable label, e.g. {@code "Very Regular"}
     */
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
