package com.cycleforecast.service;

import com.cycleforecast.core.model.EventLog;
import com.cycleforecast.core.model.PredictionRecord;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Export document for one owner: every log plus the stored prediction.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class OwnerSnapshot {

    private final String ownerKey;
    private final Instant exportedAt;
    private final List<EventLog> logs;
    private final PredictionRecord prediction;

    @JsonCreator
    public OwnerSnapshot(@JsonProperty("ownerKey") String ownerKey,
            @JsonProperty("exportedAt") Instant exportedAt,
            @JsonProperty("logs") List<EventLog> logs,
            @JsonProperty("prediction") PredictionRecord prediction) {
        this.ownerKey = ownerKey;
        this.exportedAt = exportedAt;
        this.logs = logs == null ? List.of() : List.copyOf(logs);
        this.prediction = prediction;
    }

    public String getOwnerKey() {
        return ownerKey;
    }

    public Instant getExportedAt() {
        return exportedAt;
    }

    public List<EventLog> getLogs() {
        return logs;
    }

    public PredictionRecord getPrediction() {
        return prediction;
    }
}
