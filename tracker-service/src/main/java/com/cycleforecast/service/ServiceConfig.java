package com.cycleforecast.service;

import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable runtime configuration for the tracker service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable from a container spec, Docker {@code -e} flags
 * or a shell environment. Engine tunables live in {@code forecast.yml}
 * instead; {@link #getForecastConfigPath()} only points at that file.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    public static final String DEFAULT_GEMINI_MODEL = "gemini-2.5-flash";
    public static final String DEFAULT_GEMINI_API_URL = "https://generativelanguage.googleapis.com/v1beta";

    // ---------------------------------------------------------------
    // External estimation provider
    // ---------------------------------------------------------------
    private final String geminiApiKey;
    private final String geminiModel;
    private final String geminiApiUrl;
    private final long estimationTimeoutMs;

    // ---------------------------------------------------------------
    // Engine settings file
    // ---------------------------------------------------------------
    private final String forecastConfigPath;

    // ---------------------------------------------------------------
    // HTTP
    // ---------------------------------------------------------------
    private final int httpPort;

    private ServiceConfig(Builder b) {
        this.geminiApiKey = b.geminiApiKey;
        this.geminiModel = b.geminiModel;
        this.geminiApiUrl = b.geminiApiUrl;
        this.estimationTimeoutMs = b.estimationTimeoutMs;
        this.forecastConfigPath = b.forecastConfigPath;
        this.httpPort = b.httpPort;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .geminiApiKey(env("GEMINI_API_KEY", ""))
                    .geminiModel(env("GEMINI_MODEL", DEFAULT_GEMINI_MODEL))
                    .geminiApiUrl(env("GEMINI_API_URL", DEFAULT_GEMINI_API_URL))
                    .estimationTimeoutMs(parseLongEnv("ESTIMATION_TIMEOUT_MS", "30000"))
                    .forecastConfigPath(env("FORECAST_CONFIG_PATH", ""))
                    .httpPort(parseIntEnv("HTTP_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return {@code true} if an API key is present
     */
    public boolean isGeminiConfigured() {
        return !geminiApiKey.isBlank();
    }

    public Duration getEstimationTimeout() {
        return Duration.ofMillis(estimationTimeoutMs);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getGeminiApiKey() {
        return geminiApiKey;
    }

    public String getGeminiModel() {
        return geminiModel;
    }

    public String getGeminiApiUrl() {
        return geminiApiUrl;
    }

    public long getEstimationTimeoutMs() {
        return estimationTimeoutMs;
    }

    public String getForecastConfigPath() {
        return forecastConfigPath;
    }

    public int getHttpPort() {
        return httpPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (timeout &gt; 0, port in [0, 65535] where 0 binds an ephemeral
     * port, non-blank model and URL).
     * </p>
     */
    public static class Builder {
        private String geminiApiKey = "";
        private String geminiModel = DEFAULT_GEMINI_MODEL;
        private String geminiApiUrl = DEFAULT_GEMINI_API_URL;
        private long estimationTimeoutMs = 30_000;
        private String forecastConfigPath = "";
        private int httpPort = 8080;

        public Builder geminiApiKey(String v) {
            this.geminiApiKey = v;
            return this;
        }

        public Builder geminiModel(String v) {
            this.geminiModel = v;
            return this;
        }

        public Builder geminiApiUrl(String v) {
            this.geminiApiUrl = v;
            return this;
        }

        public Builder estimationTimeoutMs(long v) {
            this.estimationTimeoutMs = v;
            return this;
        }

        public Builder forecastConfigPath(String v) {
            this.forecastConfigPath = v;
            return this;
        }

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(geminiApiKey, "geminiApiKey required (use an empty string when unset)");
            Objects.requireNonNull(forecastConfigPath, "forecastConfigPath required (use an empty string when unset)");
            requireNonBlank(geminiModel, "geminiModel");
            requireNonBlank(geminiApiUrl, "geminiApiUrl");

            if (estimationTimeoutMs < 1) {
                throw new IllegalArgumentException(
                        "estimationTimeoutMs must be >= 1, got: " + estimationTimeoutMs);
            }
            if (httpPort < 0 || httpPort > 65_535) {
                throw new IllegalArgumentException(
                        "httpPort must be in [0, 65535], got: " + httpPort);
            }
            if (geminiApiUrl.endsWith("/")) {
                geminiApiUrl = geminiApiUrl.substring(0, geminiApiUrl.length() - 1);
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "geminiApiKey=" + (isGeminiConfigured() ? "'***'" : "<unset>") +
                ", geminiModel='" + geminiModel + '\'' +
                ", geminiApiUrl='" + geminiApiUrl + '\'' +
                ", estimationTimeoutMs=" + estimationTimeoutMs +
                ", forecastConfigPath='" + forecastConfigPath + '\'' +
                ", httpPort=" + httpPort +
                '}';
    }
}
