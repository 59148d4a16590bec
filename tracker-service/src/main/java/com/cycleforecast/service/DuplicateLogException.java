package com.cycleforecast.service;

import java.time.LocalDate;

/**
 * Thrown when an owner already has a log starting on the requested date.
 *
 * @since 1.0.0
 */
public class DuplicateLogException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String ownerKey;
    private final LocalDate date;

    public DuplicateLogException(String ownerKey, LocalDate date) {
        super("A log already exists for " + date);
        this.ownerKey = ownerKey;
        this.date = date;
    }

    public String getOwnerKey() {
        return ownerKey;
    }

    public LocalDate getDate() {
        return date;
    }
}
