package com.cycleforecast.service;

import com.cycleforecast.core.exception.ExternalEstimationException;
import com.cycleforecast.core.exception.ExternalEstimationException.Reason;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GeminiEstimator} against a local stand-in for the
 * {@code generateContent} endpoint.
 */
class GeminiEstimatorTest {

    private static final String MODEL = "test-model";

    private HttpServer fakeGemini;
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> requestKey = new AtomicReference<>();
    private final AtomicReference<String> requestPath = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = "";

    @BeforeEach
    void startFakeGemini() throws IOException {
        fakeGemini = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        fakeGemini.createContext("/v1beta/models", exchange -> {
            requestPath.set(exchange.getRequestURI().getPath());
            requestKey.set(exchange.getRequestHeaders().getFirst("x-goog-api-key"));
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        fakeGemini.start();
    }

    @AfterEach
    void stopFakeGemini() {
        fakeGemini.stop(0);
    }

    private GeminiEstimator estimator(String apiKey) {
        String url = "http://127.0.0.1:" + fakeGemini.getAddress().getPort() + "/v1beta";
        return new GeminiEstimator(HttpClient.newHttpClient(), new ObjectMapper(), url, MODEL, apiKey,
                Duration.ofSeconds(5));
    }

    private static String candidate(String... parts) {
        StringBuilder json = new StringBuilder("{\"candidates\":[{\"content\":{\"parts\":[");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"text\":\"").append(parts[i]).append("\"}");
        }
        return json.append("]}}]}").toString();
    }

    @Test
    @DisplayName("Should post the prompt and join the candidate text parts")
    void shouldGenerate() throws Exception {
        responseBody = candidate("{\\\"predicted_date\\\": ", "\\\"2025-03-26\\\"}");

        String answer = estimator("key-123").generate("predict please").get(5, TimeUnit.SECONDS);

        assertThat(answer).isEqualTo("{\"predicted_date\": \"2025-03-26\"}");
        assertThat(requestPath.get()).isEqualTo("/v1beta/models/" + MODEL + ":generateContent");
        assertThat(requestKey.get()).isEqualTo("key-123");
        assertThat(new ObjectMapper().readTree(requestBody.get())
                .path("contents").path(0).path("parts").path(0).path("text").asText())
                .isEqualTo("predict please");
    }

    @Test
    @DisplayName("Should fail with PROVIDER_FAILURE on an error status")
    void shouldFailOnErrorStatus() {
        status = 500;
        responseBody = "{\"error\":{\"message\":\"internal\"}}";

        assertThatThrownBy(() -> estimator("key").generate("prompt").get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOfSatisfying(ExternalEstimationException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.PROVIDER_FAILURE));
    }

    @Test
    @DisplayName("Should return empty text when no candidate is present")
    void shouldReturnEmptyTextWithoutCandidates() throws Exception {
        responseBody = "{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}";

        assertThat(estimator("key").generate("prompt").get(5, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    @DisplayName("Should fail with NOT_CONFIGURED and send nothing without a key")
    void shouldFailWithoutKey() {
        GeminiEstimator unconfigured = estimator(" ");

        assertThat(unconfigured.isConfigured()).isFalse();
        assertThatThrownBy(() -> unconfigured.generate("prompt").get(5, TimeUnit.SECONDS))
                .cause()
                .isInstanceOfSatisfying(ExternalEstimationException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.NOT_CONFIGURED));
        assertThat(requestBody.get()).isNull();
    }

    @Test
    @DisplayName("Should report a working connection when the probe answers SUCCESS")
    void shouldTestConnection() {
        responseBody = candidate("success");

        assertThat(estimator("key").testConnection(Duration.ofSeconds(5))).isTrue();
        assertThat(requestBody.get()).contains(GeminiEstimator.PROBE_PROMPT);
    }

    @Test
    @DisplayName("Should report a broken connection on failure")
    void shouldReportBrokenConnection() {
        status = 403;
        responseBody = "{}";

        assertThat(estimator("key").testConnection(Duration.ofSeconds(5))).isFalse();
        assertThat(estimator("").testConnection(Duration.ofSeconds(5))).isFalse();
    }

    @Test
    @DisplayName("Should reject an unreadable body")
    void shouldRejectUnreadableBody() {
        assertThatThrownBy(() -> estimator("key").extractText("<html>"))
                .isInstanceOfSatisfying(ExternalEstimationException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.PROVIDER_FAILURE));
    }
}
