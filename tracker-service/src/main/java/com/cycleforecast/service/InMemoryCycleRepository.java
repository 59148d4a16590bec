package com.cycleforecast.service;

import com.cycleforecast.core.model.EventLog;
import com.cycleforecast.core.model.PredictionRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link CycleRepository} backed by concurrent maps. Contents are lost on
 * restart.
 *
 * @since 1.0.0
 */
public class InMemoryCycleRepository implements CycleRepository {

    private final Map<String, Map<String, EventLog>> logsByOwner = new ConcurrentHashMap<>();
    private final Map<String, PredictionRecord> predictions = new ConcurrentHashMap<>();

    @Override
    public List<EventLog> listLogsForOwner(String ownerKey) {
        Map<String, EventLog> logs = logsByOwner.get(requireOwner(ownerKey));
        return logs == null ? List.of() : new ArrayList<>(logs.values());
    }

    @Override
    public Optional<EventLog> findLogByDate(String ownerKey, LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return listLogsForOwner(ownerKey).stream()
                .filter(log -> log.getStartDate().equals(date))
                .findFirst();
    }

    @Override
    public Optional<EventLog> findLogById(String ownerKey, String id) {
        Objects.requireNonNull(id, "id must not be null");
        Map<String, EventLog> logs = logsByOwner.get(requireOwner(ownerKey));
        return logs == null ? Optional.empty() : Optional.ofNullable(logs.get(id));
    }

    @Override
    public void saveLog(EventLog log) {
        Objects.requireNonNull(log, "log must not be null");
        if (log.getOwnerKey() == null || log.getOwnerKey().isBlank()) {
            throw new IllegalArgumentException("log " + log.getId() + " has no owner key");
        }
        logsByOwner.computeIfAbsent(log.getOwnerKey(), k -> new ConcurrentHashMap<>()).put(log.getId(), log);
    }

    @Override
    public boolean deleteLog(String ownerKey, String id) {
        Objects.requireNonNull(id, "id must not be null");
        Map<String, EventLog> logs = logsByOwner.get(requireOwner(ownerKey));
        return logs != null && logs.remove(id) != null;
    }

    @Override
    public Optional<PredictionRecord> getCurrentPrediction(String ownerKey) {
        return Optional.ofNullable(predictions.get(requireOwner(ownerKey)));
    }

    @Override
    public void savePrediction(String ownerKey, PredictionRecord record) {
        predictions.put(requireOwner(ownerKey), Objects.requireNonNull(record, "record must not be null"));
    }

    @Override
    public boolean deletePrediction(String ownerKey) {
        return predictions.remove(requireOwner(ownerKey)) != null;
    }

    @Override
    public void clearOwner(String ownerKey) {
        requireOwner(ownerKey);
        logsByOwner.remove(ownerKey);
        predictions.remove(ownerKey);
    }

    private static String requireOwner(String ownerKey) {
        return Objects.requireNonNull(ownerKey, "ownerKey must not be null");
    }
}
