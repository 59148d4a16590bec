package com.cycleforecast.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * One recorded start date of a recurring cycle.
 *
 * <p>
 * Instances are immutable. The persistence layer owns them and guarantees at
 * most one log per {@code (ownerKey, startDate)} pair; the prediction engine
 * only ever reads lists of logs.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code startDate} and
 * {@code createdAt} are required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = EventLog.Builder.class)
public final class EventLog implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Orders logs by start date, oldest first. */
    public static final Comparator<EventLog> BY_START_DATE = Comparator.comparing(EventLog::getStartDate);

    private final String id;
    private final LocalDate startDate;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String ownerKey;
    private final Integer durationDays;

    private EventLog(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.startDate = Objects.requireNonNull(builder.startDate, "startDate must not be null");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
        this.updatedAt = builder.updatedAt;
        this.ownerKey = builder.ownerKey;
        this.durationDays = builder.durationDays;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Return a copy of this log with {@code updatedAt} set; every other field
     * is unchanged.
     *
     * @param when the modification instant
     * @return the touched copy
     */
    public EventLog touch(Instant when) {
        return toBuilder().updatedAt(Objects.requireNonNull(when, "when must not be null")).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .startDate(startDate)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .ownerKey(ownerKey)
                .durationDays(durationDays);
    }

    /**
     * Latest modification instant: {@code updatedAt} when set, else
     * {@code createdAt}.
     *
     * @return last time this log changed
     */
    public Instant lastModified() {
        return updatedAt != null && updatedAt.isAfter(createdAt) ? updatedAt : createdAt;
    }

    public String getId() {
        return id;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String getOwnerKey() {
        return ownerKey;
    }

    public Integer getDurationDays() {
        return durationDays;
    }

    /**
     * Fluent builder, also used by Jackson when reading a log back.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private String id;
        private LocalDate startDate;
        private Instant createdAt;
        private Instant updatedAt;
        private String ownerKey;
        private Integer durationDays;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder ownerKey(String ownerKey) {
            this.ownerKey = ownerKey;
            return this;
        }

        public Builder durationDays(Integer durationDays) {
            this.durationDays = durationDays;
            return this;
        }

        /**
         * @return a new {@link EventLog}
         * @throws NullPointerException if {@code id}, {@code startDate} or
         *                              {@code createdAt} is missing
         */
        public EventLog build() {
            return new EventLog(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EventLog that))
            return false;
        return Objects.equals(id, that.id)
                && Objects.equals(startDate, that.startDate)
                && Objects.equals(ownerKey, that.ownerKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, startDate, ownerKey);
    }

    @Override
    public String toString() {
        return "EventLog{" +
                "id='" + id + '\'' +
                ", startDate=" + startDate +
                ", ownerKey='" + ownerKey + '\'' +
                ", createdAt=" + createdAt +
                '}';
    }
}
