package com.cycleforecast.core.config;

import com.cycleforecast.core.model.EstimationConfig;
import com.cycleforecast.core.prediction.LocalEstimator;
import com.cycleforecast.core.prediction.RecalculationPolicy;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Engine tunables loaded from YAML.
 *
 * <p>
 * Expected YAML structure (every key optional):
 * </p>
 *
 * <pre>
 * minCycleLengthDays: 21
 * maxCycleLengthDays: 35
 * defaultCycleLengthDays: 28
 * staleAfterDays: 30
 * aiEnabledByDefault: true
 * aiAllowList:
 *   - someone@example.com
 * </pre>
 *
 * <p>
 * {@code aiAllowList} is the eligibility policy for the external estimator.
 * The engine itself only sees the resolved {@code aiEligible} flag produced
 * by {@link #toEstimationConfig(String, Boolean)}.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int minCycleLengthDays = EstimationConfig.DEFAULT_MIN_CYCLE_LENGTH_DAYS;
    private int maxCycleLengthDays = EstimationConfig.DEFAULT_MAX_CYCLE_LENGTH_DAYS;
    private int defaultCycleLengthDays = LocalEstimator.DEFAULT_CYCLE_LENGTH_DAYS;
    private int staleAfterDays = RecalculationPolicy.DEFAULT_STALE_AFTER_DAYS;
    private boolean aiEnabledByDefault = true;
    private List<String> aiAllowList = new ArrayList<>();

    // ---------------------------------------------------------------
    // Policy
    // ---------------------------------------------------------------

    /**
     * @param identity owner identity, may be {@code null}
     * @return {@code true} if the identity is on the allow-list (compared
     *         case-insensitively)
     */
    public boolean isAiEligible(String identity) {
        if (identity == null || identity.isBlank()) {
            return false;
        }
        String normalized = identity.trim().toLowerCase(Locale.ROOT);
        return aiAllowList.stream()
                .anyMatch(entry -> entry != null && entry.trim().toLowerCase(Locale.ROOT).equals(normalized));
    }

    /**
     * Resolve the per-call configuration for one owner.
     *
     * @param identity  owner identity, may be {@code null}
     * @param aiEnabled the owner's opt-in, or {@code null} to use
     *                  {@code aiEnabledByDefault}
     * @return a validated {@link EstimationConfig}
     */
    public EstimationConfig toEstimationConfig(String identity, Boolean aiEnabled) {
        return EstimationConfig.builder()
                .aiEligible(isAiEligible(identity))
                .aiEnabled(aiEnabled != null ? aiEnabled : aiEnabledByDefault)
                .minCycleLengthDays(minCycleLengthDays)
                .maxCycleLengthDays(maxCycleLengthDays)
                .ownerIdentity(identity)
                .build();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting, collecting all problems into one exception.
     *
     * @throws IllegalStateException if any setting is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (minCycleLengthDays < 1) {
            errors.add("'minCycleLengthDays' must be >= 1, got: " + minCycleLengthDays);
        }
        if (maxCycleLengthDays < minCycleLengthDays) {
            errors.add("'maxCycleLengthDays' (" + maxCycleLengthDays
                    + ") must be >= 'minCycleLengthDays' (" + minCycleLengthDays + ")");
        }
        if (defaultCycleLengthDays < 1) {
            errors.add("'defaultCycleLengthDays' must be >= 1, got: " + defaultCycleLengthDays);
        }
        if (staleAfterDays < 0) {
            errors.add("'staleAfterDays' must be >= 0, got: " + staleAfterDays);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Forecast settings validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML)
    // ---------------------------------------------------------------

    public int getMinCycleLengthDays() {
        return minCycleLengthDays;
    }

    public void setMinCycleLengthDays(int minCycleLengthDays) {
        this.minCycleLengthDays = minCycleLengthDays;
    }

    public int getMaxCycleLengthDays() {
        return maxCycleLengthDays;
    }

    public void setMaxCycleLengthDays(int maxCycleLengthDays) {
        this.maxCycleLengthDays = maxCycleLengthDays;
    }

    public int getDefaultCycleLengthDays() {
        return defaultCycleLengthDays;
    }

    public void setDefaultCycleLengthDays(int defaultCycleLengthDays) {
        this.defaultCycleLengthDays = defaultCycleLengthDays;
    }

    public int getStaleAfterDays() {
        return staleAfterDays;
    }

    public void setStaleAfterDays(int staleAfterDays) {
        this.staleAfterDays = staleAfterDays;
    }

    public boolean isAiEnabledByDefault() {
        return aiEnabledByDefault;
    }

    public void setAiEnabledByDefault(boolean aiEnabledByDefault) {
        this.aiEnabledByDefault = aiEnabledByDefault;
    }

    /**
     * @return unmodifiable allow-list
     */
    public List<String> getAiAllowList() {
        return Collections.unmodifiableList(aiAllowList);
    }

    public void setAiAllowList(List<String> aiAllowList) {
        this.aiAllowList = aiAllowList != null ? new ArrayList<>(aiAllowList) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "ForecastSettings{" +
                "minCycleLengthDays=" + minCycleLengthDays +
                ", maxCycleLengthDays=" + maxCycleLengthDays +
                ", defaultCycleLengthDays=" + defaultCycleLengthDays +
                ", staleAfterDays=" + staleAfterDays +
                ", aiEnabledByDefault=" + aiEnabledByDefault +
                ", aiAllowList=" + aiAllowList.size() + " entr" + (aiAllowList.size() == 1 ? "y" : "ies") +
                '}';
    }
}
