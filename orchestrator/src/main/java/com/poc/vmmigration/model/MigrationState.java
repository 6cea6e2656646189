package com.poc.vmmigration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.poc.vmmigration.exception.InvalidArgumentException;

/**
 * Execution state of a migration.
 */
public enum MigrationState {
    // Initial state
    NOT_STARTED("not_started", false),

    RUNNING("running", false),

    // Terminal states
    ERROR("error", true),
    SUCCESS("success", true);

    private final String value;
    private final boolean terminal;

    MigrationState(String value, boolean terminal) {
        this.value = value;
        this.terminal = terminal;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return terminal;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MigrationState fromValue(String value) {
        for (MigrationState state : values()) {
            if (state.value.equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new InvalidArgumentException("Unknown migration state: " + value);
    }
}
