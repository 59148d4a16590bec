package com.cycleforecast.core.model;

/**
 * Coarse presentation bucket for a numeric confidence score.
 *
 * @since 1.0.0
 */
public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * @param confidence score in {@code [0, 1]}
     * @return {@code HIGH} from 0.8, {@code MEDIUM} from 0.5, else {@code LOW}
     */
    public static ConfidenceLevel of(double confidence) {
        if (confidence >= 0.8) {
            return HIGH;
        }
        if (confidence >= 0.5) {
            return MEDIUM;
        }
        return LOW;
    }
}
