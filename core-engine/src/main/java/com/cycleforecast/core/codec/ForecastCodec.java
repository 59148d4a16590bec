package com.cycleforecast.core.codec;

import com.cycleforecast.core.model.EventLog;
import com.cycleforecast.core.model.IntervalStatistics;
import com.cycleforecast.core.model.PredictionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts the caller-facing value types to and from JSON and plain maps of
 * primitive fields for storage or transport.
 *
 * <p>
 * Dates are written as ISO-8601 strings ({@code 2025-03-26},
 * {@code 2025-03-01T10:15:30Z}); unknown properties are ignored on read.
 * Thread-safe once constructed.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<EventLog>> LOG_LIST_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public ForecastCodec() {
        this(newObjectMapper());
    }

    public ForecastCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * @return an {@link ObjectMapper} configured the way this codec expects
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    // ---------------------------------------------------------------
    // JSON
    // ---------------------------------------------------------------

    /**
     * @param value any of the model types
     * @return JSON text
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public PredictionRecord predictionFromJson(String json) {
        return read(json, PredictionRecord.class);
    }

    public IntervalStatistics statisticsFromJson(String json) {
        return read(json, IntervalStatistics.class);
    }

    public List<EventLog> logsFromJson(String json) {
        try {
            return mapper.readValue(json, LOG_LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed event log list: " + e.getOriginalMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Plain maps
    // ---------------------------------------------------------------

    /**
     * @param value any of the model types
     * @return map of primitive fields (dates as ISO strings)
     */
    public Map<String, Object> toMap(Object value) {
        return mapper.convertValue(value, MAP_TYPE);
    }

    public PredictionRecord predictionFromMap(Map<String, ?> map) {
        return convert(map, PredictionRecord.class);
    }

    public IntervalStatistics statisticsFromMap(Map<String, ?> map) {
        return convert(map, IntervalStatistics.class);
    }

    public EventLog logFromMap(Map<String, ?> map) {
        return convert(map, EventLog.class);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private <T> T read(String json, Class<T> type) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Malformed " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private <T> T convert(Map<String, ?> map, Class<T> type) {
        Objects.requireNonNull(map, "map must not be null");
        return mapper.convertValue(map, type);
    }
}
