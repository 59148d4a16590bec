package com.cycleforecast.service;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Headline figures for one owner's history.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TrackerSummary {

    private final int totalLogs;
    private final LocalDate firstLogDate;
    private final LocalDate lastLogDate;
    private final Integer averageCycleLengthDays;

    /**
     * @param totalLogs              number of logs
     * @param firstLogDate           earliest start date, {@code null} without logs
     * @param lastLogDate            latest start date, {@code null} without logs
     * @param averageCycleLengthDays rounded mean interval, {@code null} when
     *                               no interval survives outlier filtering
     */
    public TrackerSummary(int totalLogs, LocalDate firstLogDate, LocalDate lastLogDate,
            Integer averageCycleLengthDays) {
        this.totalLogs = totalLogs;
        this.firstLogDate = firstLogDate;
        this.lastLogDate = lastLogDate;
        this.averageCycleLengthDays = averageCycleLengthDays;
    }

    public int getTotalLogs() {
        return totalLogs;
    }

    public LocalDate getFirstLogDate() {
        return firstLogDate;
    }

    public LocalDate getLastLogDate() {
        return lastLogDate;
    }

    public Integer getAverageCycleLengthDays() {
        return averageCycleLengthDays;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrackerSummary that))
            return false;
        return totalLogs == that.totalLogs
                && Objects.equals(firstLogDate, that.firstLogDate)
                && Objects.equals(lastLogDate, that.lastLogDate)
                && Objects.equals(averageCycleLengthDays, that.averageCycleLengthDays);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalLogs, firstLogDate, lastLogDate, averageCycleLengthDays);
    }

    @Override
    public String toString() {
        return "TrackerSummary{" +
                "totalLogs=" + totalLogs +
                ", firstLogDate=" + firstLogDate +
                ", lastLogDate=" + lastLogDate +
                ", averageCycleLengthDays=" + averageCycleLengthDays +
                '}';
    }
}
