package com.cycleforecast.service;

import com.cycleforecast.core.codec.ForecastCodec;
import com.cycleforecast.core.config.ForecastSettings;
import com.cycleforecast.core.exception.ExternalEstimationException;
import com.cycleforecast.core.exception.ExternalEstimationException.Reason;
import com.cycleforecast.core.prediction.ExternalEstimator;
import com.cycleforecast.core.prediction.PredictionOrchestrator;
import com.cycleforecast.core.prediction.RecalculationPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link ForecastHttpServer} over a real socket.
 */
class ForecastHttpServerTest {

    private static final String OWNER = "owner@example.com";
    private static final String FAILING_OWNER = "ai@example.com";

    private final HttpClient client = HttpClient.newHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    private CycleTracker tracker;
    private ForecastHttpServer server;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2025-03-01T09:00:00Z"));
        ForecastSettings settings = new ForecastSettings();
        settings.setAiAllowList(List.of(FAILING_OWNER));
        ExternalEstimator failing = prompt -> CompletableFuture.failedFuture(
                new ExternalEstimationException(Reason.TIMEOUT, "slow provider"));
        tracker = new CycleTracker(new InMemoryCycleRepository(),
                new PredictionOrchestrator(clock, Duration.ofSeconds(1), 28),
                new RecalculationPolicy(clock), settings, failing, new ForecastCodec(), clock);
        server = new ForecastHttpServer(tracker, new ForecastCodec());
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> send(String method, String pathAndQuery) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + pathAndQuery))
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Should answer health and readiness probes")
    void shouldAnswerProbes() throws Exception {
        assertThat(server.isRunning()).isTrue();
        assertThat(send("GET", "/health").body()).isEqualTo("{\"status\":\"UP\"}");
        assertThat(send("GET", "/readiness").statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should log dates and serve the resulting prediction")
    void shouldLogAndPredict() throws Exception {
        assertThat(send("POST", "/api/logs?owner=owner%40example.com&date=2025-01-01").statusCode()).isEqualTo(201);
        assertThat(send("POST", "/api/logs?owner=owner%40example.com&date=2025-01-29").statusCode()).isEqualTo(201);
        assertThat(send("POST", "/api/logs?owner=owner%40example.com&date=2025-02-26").statusCode()).isEqualTo(201);

        HttpResponse<String> response = send("GET", "/api/prediction?owner=owner%40example.com");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.path("predictedDate").asText()).isEqualTo("2025-03-26");
        assertThat(body.path("averageCycleLengthDays").asInt()).isEqualTo(28);
        assertThat(body.path("confidence").asDouble()).isEqualTo(0.85);
        assertThat(tracker.logsFor(OWNER)).hasSize(3);
    }

    @Test
    @DisplayName("Should serve summary and statistics")
    void shouldServeStatistics() throws Exception {
        tracker.logEvent(OWNER, LocalDate.of(2025, 1, 1));
        tracker.logEvent(OWNER, LocalDate.of(2025, 1, 29));

        JsonNode body = mapper.readTree(send("GET", "/api/statistics?owner=" + OWNER).body());

        assertThat(body.path("summary").path("totalLogs").asInt()).isEqualTo(2);
        assertThat(body.path("summary").path("lastLogDate").asText()).isEqualTo("2025-01-29");
        assertThat(body.path("statistics").path("regularityClass").asText()).isEqualTo("VERY_REGULAR");
    }

    @Test
    @DisplayName("Should map client mistakes to 4xx")
    void shouldRejectBadRequests() throws Exception {
        tracker.logEvent(OWNER, LocalDate.of(2025, 1, 1));

        assertThat(send("POST", "/api/logs?owner=" + OWNER + "&date=2025-01-01").statusCode()).isEqualTo(409);
        assertThat(send("POST", "/api/logs?owner=" + OWNER + "&date=01/02/2025").statusCode()).isEqualTo(400);
        assertThat(send("GET", "/api/prediction").statusCode()).isEqualTo(400);
        assertThat(send("GET", "/api/prediction?owner=nobody").statusCode()).isEqualTo(404);
        assertThat(send("POST", "/api/prediction?owner=" + OWNER).statusCode()).isEqualTo(405);
        assertThat(send("DELETE", "/api/logs?owner=" + OWNER + "&id=missing").statusCode()).isEqualTo(404);
    }

    @Test
    @DisplayName("Should list and delete logs")
    void shouldListAndDeleteLogs() throws Exception {
        String id = tracker.logEvent(OWNER, LocalDate.of(2025, 1, 1)).getId();

        JsonNode logs = mapper.readTree(send("GET", "/api/logs?owner=" + OWNER).body());
        assertThat(logs.size()).isEqualTo(1);
        assertThat(logs.get(0).path("id").asText()).isEqualTo(id);

        assertThat(send("DELETE", "/api/logs?owner=" + OWNER + "&id=" + id).statusCode()).isEqualTo(204);
        assertThat(tracker.logsFor(OWNER)).isEmpty();
    }

    @Test
    @DisplayName("Should hide prediction failures behind a generic 503")
    void shouldMapPredictionFailureTo503() throws Exception {
        tracker.setAiEnabled(FAILING_OWNER, true);
        tracker.logEvent(FAILING_OWNER, LocalDate.of(2025, 2, 26));

        HttpResponse<String> response = send("GET", "/api/prediction?owner=" + FAILING_OWNER);

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(mapper.readTree(response.body()).path("error").asText())
                .isEqualTo(ForecastHttpServer.PREDICTION_UNAVAILABLE);
        assertThat(response.body()).doesNotContain("slow provider");
    }

    @Test
    @DisplayName("Should decode query parameters")
    void shouldParseQuery() {
        assertThat(ForecastHttpServer.parseQuery("owner=a%40b.com&date=2025-01-01&flag"))
                .containsEntry("owner", "a@b.com")
                .containsEntry("date", "2025-01-01")
                .containsEntry("flag", "");
        assertThat(ForecastHttpServer.parseQuery(null)).isEmpty();
    }

    @Test
    @DisplayName("Should refuse an out-of-range port")
    void shouldRejectBadPort() {
        ForecastHttpServer other = new ForecastHttpServer(tracker, new ForecastCodec());

        assertThatThrownBy(() -> other.start(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(other::getPort).isInstanceOf(IllegalStateException.class);
    }
}
