package com.clinicdocs.search.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a single document inside the ingestion pipeline.
 * <p>
 * Non-failure states form a linear order and may only move forward. {@link #FAILED} is
 * reachable from any non-terminal state. {@link #COMPLETED} and {@link #FAILED} are terminal.
 */
public enum ProcessingStatus {
    PENDING(0),
    UPLOADED(1),
    OCR_COMPLETED(2),
    COMPLETED(3),
    FAILED(-1);

    private final int order;

    ProcessingStatus(int order) {
        this.order = order;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(ProcessingStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.order > this.order;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
