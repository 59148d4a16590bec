package com.cycleforecast.service;

import com.cycleforecast.core.exception.ExternalEstimationException;
import com.cycleforecast.core.exception.ExternalEstimationException.Reason;
import com.cycleforecast.core.prediction.ExternalEstimator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ExternalEstimator} backed by the Gemini {@code generateContent} REST
 * endpoint.
 *
 * <p>
 * Requests go out with the JDK {@link HttpClient} asynchronously; the answer
 * is the concatenated text of {@code candidates[0].content.parts[*].text}.
 * A non-2xx status or an unreadable body fails the returned future with
 * {@link Reason#PROVIDER_FAILURE}. Without an API key every call fails with
 * {@link Reason#NOT_CONFIGURED} and no request is sent.
 * </p>
 *
 * @since 1.0.0
 */
public class GeminiEstimator implements ExternalEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(GeminiEstimator.class);

    static final String PROBE_PROMPT = "Respond with ONLY the word: SUCCESS";

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final URI endpoint;
    private final String apiKey;
    private final Duration requestTimeout;

    public GeminiEstimator(ServiceConfig config) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), new ObjectMapper(),
                config.getGeminiApiUrl(), config.getGeminiModel(), config.getGeminiApiKey(),
                config.getEstimationTimeout());
    }

    GeminiEstimator(HttpClient client, ObjectMapper mapper, String apiUrl, String model, String apiKey,
            Duration requestTimeout) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.endpoint = URI.create(Objects.requireNonNull(apiUrl, "apiUrl must not be null")
                + "/models/" + Objects.requireNonNull(model, "model must not be null") + ":generateContent");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    public boolean isConfigured() {
        return !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<String> generate(String prompt) {
        Objects.requireNonNull(prompt, "prompt must not be null");
        if (!isConfigured()) {
            return CompletableFuture.failedFuture(
                    new ExternalEstimationException(Reason.NOT_CONFIGURED, "GEMINI_API_KEY is not set"));
        }

        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("x-goog-api-key", apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(prompt)))
                .build();

        LOG.debug("Sending {}-char prompt to {}", prompt.length(), endpoint);
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(this::handleResponse);
    }

    /**
     * Send a probe prompt and check that the provider answers.
     *
     * @param timeout how long to wait for the answer
     * @return {@code true} if the answer contains {@code SUCCESS}
     */
    public boolean testConnection(Duration timeout) {
        try {
            String answer = generate(PROBE_PROMPT).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            boolean connected = answer != null && answer.toUpperCase(Locale.ROOT).contains("SUCCESS");
            LOG.info("Gemini connection test result: {}", connected);
            return connected;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Gemini connection test interrupted");
            return false;
        } catch (ExecutionException | TimeoutException e) {
            Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
            LOG.warn("Gemini connection test failed: {}", cause == null ? e.getMessage() : cause.getMessage());
            return false;
        }
    }

    // ---------------------------------------------------------------
    // Wire format
    // ---------------------------------------------------------------

    String requestBody(String prompt) {
        ObjectNode body = mapper.createObjectNode();
        body.putArray("contents")
                .addObject()
                .putArray("parts")
                .addObject()
                .put("text", prompt);
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode Gemini request", e);
        }
    }

    private String handleResponse(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            LOG.warn("Gemini returned HTTP {}", status);
            throw new ExternalEstimationException(Reason.PROVIDER_FAILURE, "Gemini returned HTTP " + status);
        }
        return extractText(response.body());
    }

    /**
     * @param body raw {@code generateContent} response
     * @return concatenated candidate text; empty when the response carries none
     * @throws ExternalEstimationException if the body is not JSON
     */
    String extractText(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new ExternalEstimationException(Reason.PROVIDER_FAILURE,
                    "Unreadable Gemini response: " + e.getOriginalMessage(), e);
        }
        if (root == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        if (text.length() == 0) {
            LOG.debug("Gemini response carried no candidate text");
        }
        return text.toString();
    }
}
