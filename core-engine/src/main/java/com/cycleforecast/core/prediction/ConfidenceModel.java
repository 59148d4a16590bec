package com.cycleforecast.core.prediction;

import com.cycleforecast.core.model.RegularityClass;

/**
 * Fixed mapping from regularity to confidence.
 *
 * <p>
 * Total and exception-free; {@code null} stands for "no statistics available"
 * and maps to {@value #INSUFFICIENT_DATA_CONFIDENCE}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfidenceModel {

    /** Confidence when no usable statistics exist. */
    public static final double INSUFFICIENT_DATA_CONFIDENCE = 0.30;

    private ConfidenceModel() {
        // utility class - not instantiable
    }

    /**
     * @param regularityClass classification, may be {@code null}
     * @return confidence in {@code [0, 1]}, non-increasing as regularity worsens
     */
    public static double confidenceFor(RegularityClass regularityClass) {
        if (regularityClass == null) {
            return INSUFFICIENT_DATA_CONFIDENCE;
        }
        return switch (regularityClass) {
            case VERY_REGULAR -> 0.85;
            case REGULAR -> 0.70;
            case SOMEWHAT_IRREGULAR -> 0.55;
            case IRREGULAR -> 0.40;
        };
    }
}
