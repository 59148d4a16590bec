package com.cycleforecast.core.model;

import java.io.Serializable;

/**
 * Per-invocation estimation settings supplied by the caller.
 *
 * <p>
 * Immutable for the duration of one prediction run. Whether an identity may
 * use the external estimator at all (the allow-list) is caller policy and
 * arrives here already resolved as {@code aiEligible}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #defaults()} or the {@link Builder}; {@link Builder#build()}
 * validates the cycle-length bounds.
 * </p>
 *
 * @since 1.0.0
 */
public final class EstimationConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_MIN_CYCLE_LENGTH_DAYS = 21;
    public static final int DEFAULT_MAX_CYCLE_LENGTH_DAYS = 35;

    private final boolean aiEligible;
    private final boolean aiEnabled;
    private final int minCycleLengthDays;
    private final int maxCycleLengthDays;
    private final String ownerIdentity;

    private EstimationConfig(Builder b) {
        this.aiEligible = b.aiEligible;
        this.aiEnabled = b.aiEnabled;
        this.minCycleLengthDays = b.minCycleLengthDays;
        this.maxCycleLengthDays = b.maxCycleLengthDays;
        this.ownerIdentity = b.ownerIdentity;
    }

    /**
     * @return local-only configuration with the default 21..35 day bounds
     */
    public static EstimationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code true} when the external estimator must be used
     */
    public boolean useExternalEstimator() {
        return aiEligible && aiEnabled;
    }

    public boolean isAiEligible() {
        return aiEligible;
    }

    public boolean isAiEnabled() {
        return aiEnabled;
    }

    public int getMinCycleLengthDays() {
        return minCycleLengthDays;
    }

    public int getMaxCycleLengthDays() {
        return maxCycleLengthDays;
    }

    public String getOwnerIdentity() {
        return ownerIdentity;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private boolean aiEligible;
        private boolean aiEnabled;
        private int minCycleLengthDays = DEFAULT_MIN_CYCLE_LENGTH_DAYS;
        private int maxCycleLengthDays = DEFAULT_MAX_CYCLE_LENGTH_DAYS;
        private String ownerIdentity;

        public Builder aiEligible(boolean v) {
            this.aiEligible = v;
            return this;
        }

        public Builder aiEnabled(boolean v) {
            this.aiEnabled = v;
            return this;
        }

        public Builder minCycleLengthDays(int v) {
            this.minCycleLengthDays = v;
            return this;
        }

        public Builder maxCycleLengthDays(int v) {
            this.maxCycleLengthDays = v;
            return this;
        }

        public Builder ownerIdentity(String v) {
            this.ownerIdentity = v;
            return this;
        }

        /**
         * @return a validated {@link EstimationConfig}
         * @throws IllegalArgumentException if {@code minCycleLengthDays < 1} or
         *                                  {@code maxCycleLengthDays < minCycleLengthDays}
         */
        public EstimationConfig build() {
            if (minCycleLengthDays < 1) {
                throw new IllegalArgumentException(
                        "minCycleLengthDays must be >= 1, got: " + minCycleLengthDays);
            }
            if (maxCycleLengthDays < minCycleLengthDays) {
                throw new IllegalArgumentException("maxCycleLengthDays (" + maxCycleLengthDays
                        + ") must be >= minCycleLengthDays (" + minCycleLengthDays + ")");
            }
            return new EstimationConfig(this);
        }
    }

    @Override
    public String toString() {
        return "EstimationConfig{" +
                "aiEligible=" + aiEligible +
                ", aiEnabled=" + aiEnabled +
                ", minCycleLengthDays=" + minCycleLengthDays +
                ", maxCycleLengthDays=" + maxCycleLengthDays +
                ", ownerIdentity='" + ownerIdentity + '\'' +
                '}';
    }
}
