package com.cycleforecast.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should apply defaults when nothing is set")
    void shouldApplyDefaults() {
        ServiceConfig config = new ServiceConfig.Builder().build();

        assertThat(config.getGeminiModel()).isEqualTo("gemini-2.5-flash");
        assertThat(config.getGeminiApiUrl()).isEqualTo(ServiceConfig.DEFAULT_GEMINI_API_URL);
        assertThat(config.getEstimationTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getHttpPort()).isEqualTo(8080);
        assertThat(config.getForecastConfigPath()).isEmpty();
        assertThat(config.isGeminiConfigured()).isFalse();
    }

    @Test
    @DisplayName("Should strip a trailing slash from the API URL")
    void shouldNormalizeApiUrl() {
        ServiceConfig config = new ServiceConfig.Builder().geminiApiUrl("http://localhost:9000/v1/").build();

        assertThat(config.getGeminiApiUrl()).isEqualTo("http://localhost:9000/v1");
    }

    @Test
    @DisplayName("Should never print the API key")
    void shouldMaskApiKey() {
        ServiceConfig config = new ServiceConfig.Builder().geminiApiKey("secret-key").build();

        assertThat(config.isGeminiConfigured()).isTrue();
        assertThat(config.toString()).doesNotContain("secret-key").contains("***");
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().httpPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("httpPort");
        assertThatThrownBy(() -> new ServiceConfig.Builder().estimationTimeoutMs(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("estimationTimeoutMs");
        assertThatThrownBy(() -> new ServiceConfig.Builder().geminiModel(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("geminiModel");
    }

    @Test
    @DisplayName("Should resolve from the environment with defaults for unset variables")
    void shouldResolveFromEnvironment() {
        ServiceConfig config = ServiceConfig.fromEnvironment();

        assertThat(config.getGeminiModel()).isNotBlank();
        assertThat(config.getEstimationTimeoutMs()).isPositive();
    }
}
