package com.cycleforecast.service;

import com.cycleforecast.core.codec.ForecastCodec;
import com.cycleforecast.core.config.ForecastSettings;
import com.cycleforecast.core.exception.CyclePredictionException;
import com.cycleforecast.core.model.EstimationConfig;
import com.cycleforecast.core.model.EventLog;
import com.cycleforecast.core.model.IntervalStatistics;
import com.cycleforecast.core.model.PredictionRecord;
import com.cycleforecast.core.prediction.CycleStatistics;
import com.cycleforecast.core.prediction.ExternalEstimator;
import com.cycleforecast.core.prediction.PredictionOrchestrator;
import com.cycleforecast.core.prediction.RecalculationPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-owner facade over the repository and the prediction engine.
 *
 * <h3>Recalculation</h3>
 * <p>
 * Adding, moving or deleting a log recalculates the owner's prediction
 * straight away. If that recalculation fails the mutation still stands, the
 * failure is logged and the stored prediction is dropped, so
 * {@link #currentPrediction(String)} retries on the next read. Reads
 * recompute only when {@link RecalculationPolicy} says so.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Mutations and recalculations for the same owner are serialized on a
 * per-owner lock; different owners proceed in parallel.
 * </p>
 *
 * @since 1.0.0
 */
public class CycleTracker {

    private static final Logger LOG = LoggerFactory.getLogger(CycleTracker.class);

    private final CycleRepository repository;
    private final PredictionOrchestrator orchestrator;
    private final RecalculationPolicy policy;
    private final ForecastSettings settings;
    private final ExternalEstimator externalEstimator;
    private final ForecastCodec codec;
    private final Clock clock;

    private final Map<String, Object> ownerLocks = new ConcurrentHashMap<>();
    private final Map<String, Boolean> aiPreferences = new ConcurrentHashMap<>();

    /**
     * @param externalEstimator provider used for opted-in owners; may be
     *                          {@code null} when no owner can be eligible
     */
    public CycleTracker(CycleRepository repository, PredictionOrchestrator orchestrator,
            RecalculationPolicy policy, ForecastSettings settings, ExternalEstimator externalEstimator,
            ForecastCodec codec, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.externalEstimator = externalEstimator;
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Logs
    // ---------------------------------------------------------------

    /**
     * Record a new start date and recalculate.
     *
     * @return the stored log
     * @throws DuplicateLogException if the owner already logged this date
     */
    public EventLog logEvent(String owner, LocalDate date) {
        requireOwner(owner);
        Objects.requireNonNull(date, "date must not be null");
        synchronized (lockFor(owner)) {
            if (repository.findLogByDate(owner, date).isPresent()) {
                LOG.debug("Rejected duplicate log for owner={} on {}", owner, date);
                throw new DuplicateLogException(owner, date);
            }
            EventLog log = EventLog.builder()
                    .id(UUID.randomUUID().toString())
                    .startDate(date)
                    .createdAt(clock.instant())
                    .ownerKey(owner)
                    .build();
            repository.saveLog(log);
            LOG.info("Logged {} for owner={}", date, owner);
            recalculateAfterChange(owner);
            return log;
        }
    }

    /**
     * Move an existing log to a new start date and recalculate.
     *
     * @return the updated log, or empty if no log has that id
     * @throws DuplicateLogException if another log already uses {@code newDate}
     */
    public Optional<EventLog> updateLog(String owner, String id, LocalDate newDate) {
        requireOwner(owner);
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(newDate, "newDate must not be null");
        synchronized (lockFor(owner)) {
            Optional<EventLog> existing = repository.findLogById(owner, id);
            if (existing.isEmpty()) {
                LOG.debug("No log {} for owner={}", id, owner);
                return Optional.empty();
            }
            Optional<EventLog> clash = repository.findLogByDate(owner, newDate);
            if (clash.isPresent() && !clash.get().getId().equals(id)) {
                throw new DuplicateLogException(owner, newDate);
            }
            EventLog updated = existing.get().toBuilder()
                    .startDate(newDate)
                    .build()
                    .touch(clock.instant());
            repository.saveLog(updated);
            LOG.info("Moved log {} for owner={} from {} to {}", id, owner, existing.get().getStartDate(), newDate);
            recalculateAfterChange(owner);
            return Optional.of(updated);
        }
    }

    /**
     * @return {@code true} if the log existed and was removed
     */
    public boolean deleteLog(String owner, String id) {
        requireOwner(owner);
        Objects.requireNonNull(id, "id must not be null");
        synchronized (lockFor(owner)) {
            if (!repository.deleteLog(owner, id)) {
                return false;
            }
            LOG.info("Deleted log {} for owner={}", id, owner);
            recalculateAfterChange(owner);
            return true;
        }
    }

    /**
     * @return the owner's logs, oldest first
     */
    public List<EventLog> logsFor(String owner) {
        List<EventLog> logs = new ArrayList<>(repository.listLogsForOwner(requireOwner(owner)));
        logs.sort(EventLog.BY_START_DATE);
        return logs;
    }

    // ---------------------------------------------------------------
    // Predictions
    // ---------------------------------------------------------------

    /**
     * Return the stored prediction, recomputing it first if it is missing or
     * out of date.
     *
     * @return the current prediction, or empty if the owner has no logs
     * @throws CyclePredictionException if a needed recalculation fails
     */
    public Optional<PredictionRecord> currentPrediction(String owner) {
        requireOwner(owner);
        synchronized (lockFor(owner)) {
            List<EventLog> logs = logsFor(owner);
            if (logs.isEmpty()) {
                return Optional.empty();
            }
            Optional<PredictionRecord> stored = repository.getCurrentPrediction(owner);
            if (!policy.needsRecalculation(stored.orElse(null), logs)) {
                LOG.debug("Stored prediction for owner={} is current", owner);
                return stored;
            }
            return Optional.of(predictAndStore(owner, logs));
        }
    }

    /**
     * Recompute and store the prediction regardless of its age.
     *
     * @return the new prediction, or empty if the owner has no logs
     * @throws CyclePredictionException if prediction fails
     */
    public Optional<PredictionRecord> recalculate(String owner) {
        requireOwner(owner);
        synchronized (lockFor(owner)) {
            List<EventLog> logs = logsFor(owner);
            if (logs.isEmpty()) {
                LOG.debug("Recalculation skipped for owner={}: no logs", owner);
                return Optional.empty();
            }
            return Optional.of(predictAndStore(owner, logs));
        }
    }

    public Optional<IntervalStatistics> statistics(String owner) {
        return CycleStatistics.computeStatistics(logsFor(owner),
                settings.getMinCycleLengthDays(), settings.getMaxCycleLengthDays());
    }

    public TrackerSummary summary(String owner) {
        List<EventLog> logs = logsFor(owner);
        if (logs.isEmpty()) {
            return new TrackerSummary(0, null, null, null);
        }
        Integer average = CycleStatistics.computeStatistics(logs,
                        settings.getMinCycleLengthDays(), settings.getMaxCycleLengthDays())
                .map(IntervalStatistics::getAverageLengthDays)
                .orElse(null);
        return new TrackerSummary(logs.size(), logs.get(0).getStartDate(),
                logs.get(logs.size() - 1).getStartDate(), average);
    }

    /**
     * Days from today to the stored predicted date; negative once it has
     * passed. Does not trigger a recalculation.
     *
     * @return the day count, or empty without a stored prediction
     */
    public OptionalLong daysUntilNextEvent(String owner) {
        Optional<PredictionRecord> stored = repository.getCurrentPrediction(requireOwner(owner));
        if (stored.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(ChronoUnit.DAYS.between(LocalDate.now(clock), stored.get().getPredictedDate()));
    }

    /**
     * @return {@code true} if {@code date} falls within the window of the
     *         stored prediction
     */
    public boolean isPredictedDate(String owner, LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return repository.getCurrentPrediction(requireOwner(owner))
                .map(p -> p.covers(date))
                .orElse(false);
    }

    // ---------------------------------------------------------------
    // Preferences
    // ---------------------------------------------------------------

    /**
     * Record the owner's opt-in for external estimation; {@code null} reverts
     * to the configured default. Takes effect on the next recalculation.
     */
    public void setAiEnabled(String owner, Boolean enabled) {
        requireOwner(owner);
        if (enabled == null) {
            aiPreferences.remove(owner);
        } else {
            aiPreferences.put(owner, enabled);
        }
        LOG.info("External estimation preference for owner={} set to {}", owner, enabled);
    }

    // ---------------------------------------------------------------
    // Data management
    // ---------------------------------------------------------------

    public void clearAll(String owner) {
        requireOwner(owner);
        synchronized (lockFor(owner)) {
            repository.clearOwner(owner);
            aiPreferences.remove(owner);
            ownerLocks.remove(owner);
            LOG.info("Cleared all data for owner={}", owner);
        }
    }

    /**
     * @return JSON document holding the owner's logs and stored prediction
     */
    public String exportData(String owner) {
        requireOwner(owner);
        synchronized (lockFor(owner)) {
            OwnerSnapshot snapshot = new OwnerSnapshot(owner, clock.instant(), logsFor(owner),
                    repository.getCurrentPrediction(owner).orElse(null));
            return codec.toJson(snapshot);
        }
    }

    /**
     * Replace the owner's data with an exported document. Imported logs and
     * the prediction are re-keyed to {@code owner}; entries that repeat an
     * earlier start date are skipped and entries that repeat an earlier id
     * get a fresh one. The document is checked in full before anything is
     * replaced.
     *
     * @return number of logs stored
     * @throws IllegalArgumentException if the document is not a valid export
     */
    public int importData(String owner, String json) {
        requireOwner(owner);
        Objects.requireNonNull(json, "json must not be null");
        OwnerSnapshot snapshot;
        try {
            snapshot = codec.getMapper().readValue(json, OwnerSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed export document: " + e.getOriginalMessage(), e);
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("Export document is empty");
        }
        List<EventLog> accepted = acceptImportedLogs(owner, snapshot.getLogs());

        synchronized (lockFor(owner)) {
            repository.clearOwner(owner);
            accepted.forEach(repository::saveLog);
            if (snapshot.getPrediction() != null) {
                repository.savePrediction(owner, snapshot.getPrediction().toBuilder().ownerKey(owner).build());
            }
            LOG.info("Imported {} log(s) for owner={}", accepted.size(), owner);
            return accepted.size();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private PredictionRecord predictAndStore(String owner, List<EventLog> logs) {
        EstimationConfig config = settings.toEstimationConfig(owner, aiPreferences.get(owner));
        PredictionRecord prediction = orchestrator.predictNext(logs, config, externalEstimator);
        repository.savePrediction(owner, prediction);
        return prediction;
    }

    private List<EventLog> acceptImportedLogs(String owner, List<EventLog> logs) {
        Set<LocalDate> dates = new HashSet<>();
        Set<String> ids = new HashSet<>();
        List<EventLog> accepted = new ArrayList<>(logs.size());
        for (EventLog log : logs) {
            if (!dates.add(log.getStartDate())) {
                LOG.warn("Skipping imported log {} for owner={}: date {} already present",
                        log.getId(), owner, log.getStartDate());
                continue;
            }
            EventLog.Builder rekeyed = log.toBuilder().ownerKey(owner);
            if (!ids.add(log.getId())) {
                String freshId = UUID.randomUUID().toString();
                LOG.warn("Imported log {} for owner={} repeats an id, stored as {}", log.getId(), owner, freshId);
                ids.add(freshId);
                rekeyed.id(freshId);
            }
            accepted.add(rekeyed.build());
        }
        return accepted;
    }

    private void recalculateAfterChange(String owner) {
        List<EventLog> logs = logsFor(owner);
        if (logs.isEmpty()) {
            // last log gone; drop the orphaned prediction too
            repository.clearOwner(owner);
            return;
        }
        try {
            predictAndStore(owner, logs);
        } catch (CyclePredictionException e) {
            repository.deletePrediction(owner);
            LOG.warn("Recalculation for owner={} failed, dropped stored prediction until next read: {}",
                    owner, e.getMessage(), e);
        }
    }

    int lockedOwnerCount() {
        return ownerLocks.size();
    }

    private Object lockFor(String owner) {
        return ownerLocks.computeIfAbsent(owner, k -> new Object());
    }

    private static String requireOwner(String owner) {
        Objects.requireNonNull(owner, "owner must not be null");
        if (owner.isBlank()) {
            throw new IllegalArgumentException("owner must not be blank");
        }
        return owner;
    }
}
