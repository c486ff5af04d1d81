package com.ivamare.callsession.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a call session in its lifecycle.
 *
 * <p>A session starts {@link #ONGOING} and moves exactly once to one of the
 * terminal values. Terminal values never revert.
 */
public enum SessionStatus {
    /** Call in progress, events may still be appended */
    ONGOING("ongoing"),

    /** Call ended normally */
    COMPLETED("completed"),

    /** Call ended abnormally */
    FAILED("failed");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != ONGOING;
    }

    @JsonCreator
    public static SessionStatus fromValue(String value) {
        for (SessionStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown SessionStatus: " + value);
    }
}
