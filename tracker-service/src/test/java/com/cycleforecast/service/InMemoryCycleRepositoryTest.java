package com.cycleforecast.service;

import com.cycleforecast.core.model.EventLog;
import com.cycleforecast.core.model.PredictionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryCycleRepository}.
 */
class InMemoryCycleRepositoryTest {

    private static final Instant CREATED = Instant.parse("2025-03-01T09:00:00Z");

    private final InMemoryCycleRepository repository = new InMemoryCycleRepository();

    private static EventLog log(String id, String owner, String date) {
        return EventLog.builder().id(id).ownerKey(owner).startDate(LocalDate.parse(date)).createdAt(CREATED).build();
    }

    private static PredictionRecord prediction() {
        return PredictionRecord.builder()
                .predictedDate(LocalDate.of(2025, 3, 26))
                .averageCycleLengthDays(28)
                .confidence(0.85)
                .calculatedAt(CREATED)
                .build();
    }

    @Test
    @DisplayName("Should keep owners apart")
    void shouldIsolateOwners() {
        repository.saveLog(log("1", "alice", "2025-01-01"));
        repository.saveLog(log("2", "bob", "2025-01-01"));

        assertThat(repository.listLogsForOwner("alice")).extracting(EventLog::getId).containsExactly("1");
        assertThat(repository.listLogsForOwner("carol")).isEmpty();
        assertThat(repository.findLogById("bob", "1")).isEmpty();
    }

    @Test
    @DisplayName("Should find a log by start date and replace it on save")
    void shouldFindAndReplace() {
        repository.saveLog(log("1", "alice", "2025-01-01"));
        repository.saveLog(log("1", "alice", "2025-01-03"));

        assertThat(repository.listLogsForOwner("alice")).hasSize(1);
        assertThat(repository.findLogByDate("alice", LocalDate.of(2025, 1, 3))).isPresent();
        assertThat(repository.findLogByDate("alice", LocalDate.of(2025, 1, 1))).isEmpty();
    }

    @Test
    @DisplayName("Should report whether a delete removed anything")
    void shouldDelete() {
        repository.saveLog(log("1", "alice", "2025-01-01"));

        assertThat(repository.deleteLog("alice", "1")).isTrue();
        assertThat(repository.deleteLog("alice", "1")).isFalse();
        assertThat(repository.deleteLog("nobody", "1")).isFalse();
    }

    @Test
    @DisplayName("Should clear logs and prediction of one owner only")
    void shouldClearOwner() {
        repository.saveLog(log("1", "alice", "2025-01-01"));
        repository.saveLog(log("2", "bob", "2025-01-01"));
        repository.savePrediction("alice", prediction());
        repository.savePrediction("bob", prediction());

        repository.clearOwner("alice");

        assertThat(repository.listLogsForOwner("alice")).isEmpty();
        assertThat(repository.getCurrentPrediction("alice")).isEmpty();
        assertThat(repository.listLogsForOwner("bob")).hasSize(1);
        assertThat(repository.getCurrentPrediction("bob")).contains(prediction());
    }

    @Test
    @DisplayName("Should drop the prediction but keep the logs")
    void shouldDeletePredictionOnly() {
        repository.saveLog(log("1", "alice", "2025-01-01"));
        repository.savePrediction("alice", prediction());

        assertThat(repository.deletePrediction("alice")).isTrue();
        assertThat(repository.deletePrediction("alice")).isFalse();
        assertThat(repository.getCurrentPrediction("alice")).isEmpty();
        assertThat(repository.listLogsForOwner("alice")).hasSize(1);
    }

    @Test
    @DisplayName("Should reject logs without an owner")
    void shouldRejectOwnerlessLog() {
        EventLog ownerless = EventLog.builder().id("x").startDate(LocalDate.of(2025, 1, 1)).createdAt(CREATED).build();

        assertThatThrownBy(() -> repository.saveLog(ownerless))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("owner");
    }
}
