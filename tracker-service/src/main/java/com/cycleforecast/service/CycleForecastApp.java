package com.cycleforecast.service;

import com.cycleforecast.core.codec.ForecastCodec;
import com.cycleforecast.core.config.ForecastSettings;
import com.cycleforecast.core.config.ForecastSettingsLoader;
import com.cycleforecast.core.prediction.PredictionOrchestrator;
import com.cycleforecast.core.prediction.RecalculationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Main entry point for the tracker service.
 *
 * <h3>Startup</h3>
 *
 * <pre>
 *   ServiceConfig (env vars)
 *     → ForecastSettings (forecast.yml)
 *     → PredictionOrchestrator + RecalculationPolicy + GeminiEstimator
 *     → CycleTracker over InMemoryCycleRepository
 *     → ForecastHttpServer
 * </pre>
 *
 * <p>
 * The server runs on non-daemon threads, so the JVM stays up until it is
 * signalled; a shutdown hook stops the server.
 * </p>
 *
 * @since 1.0.0
 */
public final class CycleForecastApp {

    private static final Logger LOG = LoggerFactory.getLogger(CycleForecastApp.class);

    private CycleForecastApp() {
        // entry-point class - not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Cycle Forecast with config: {}", config);

        // 2. Load engine settings
        ForecastSettings settings = ForecastSettingsLoader.resolve(config.getForecastConfigPath());

        // 3. Wire the engine and the tracker
        ForecastHttpServer server = new ForecastHttpServer(buildTracker(config, settings, Clock.systemDefaultZone()),
                new ForecastCodec());

        // 4. Start serving with shutdown hook
        server.start(config.getHttpPort());
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "http-shutdown"));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static CycleTracker buildTracker(ServiceConfig config, ForecastSettings settings, Clock clock) {
        PredictionOrchestrator orchestrator = new PredictionOrchestrator(clock, config.getEstimationTimeout(),
                settings.getDefaultCycleLengthDays());
        RecalculationPolicy policy = new RecalculationPolicy(clock, settings.getStaleAfterDays());

        GeminiEstimator estimator = new GeminiEstimator(config);
        if (!estimator.isConfigured()) {
            LOG.warn("GEMINI_API_KEY is not set; owners opted into external estimation will get errors");
        } else if (settings.getAiAllowList().isEmpty()) {
            LOG.info("Gemini configured but the allow-list is empty; all predictions will be local");
        }

        return new CycleTracker(new InMemoryCycleRepository(), orchestrator, policy, settings, estimator,
                new ForecastCodec(), clock);
    }
}
