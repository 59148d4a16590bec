package com.cycleforecast.service;

import com.cycleforecast.core.model.EventLog;
import com.cycleforecast.core.model.PredictionRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for event logs and the current prediction of each owner.
 *
 * <p>
 * Implementations must be safe for concurrent use. Logs are keyed by
 * {@link EventLog#getOwnerKey()} and {@link EventLog#getId()}; an owner holds
 * at most one stored prediction.
 * </p>
 *
 * @since 1.0.0
 */
public interface CycleRepository {

    /**
     * @return the owner's logs in unspecified order; empty if none
     */
    List<EventLog> listLogsForOwner(String ownerKey);

    Optional<EventLog> findLogByDate(String ownerKey, LocalDate date);

    Optional<EventLog> findLogById(String ownerKey, String id);

    /**
     * Insert or replace a log.
     *
     * @param log log with a non-null owner key
     * @throws IllegalArgumentException if the log has no owner key
     */
    void saveLog(EventLog log);

    /**
     * @return {@code true} if a log was removed
     */
    boolean deleteLog(String ownerKey, String id);

    Optional<PredictionRecord> getCurrentPrediction(String ownerKey);

    void savePrediction(String ownerKey, PredictionRecord record);

    /**
     * Remove the stored prediction, keeping the owner's logs.
     *
     * @return {@code true} if a prediction was removed
     */
    boolean deletePrediction(String ownerKey);

    /**
     * Remove every log and the stored prediction of one owner.
     */
    void clearOwner(String ownerKey);
}
