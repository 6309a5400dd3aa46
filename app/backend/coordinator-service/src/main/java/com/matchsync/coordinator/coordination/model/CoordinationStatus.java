package com.matchsync.coordinator.coordination.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CoordinationStatus {
    COMMITTED("committed", CoordinationState.COMMITTED),
    PARTIALLY_FAILED("partially_failed", CoordinationState.PARTIALLY_FAILED),
    ABORTED("aborted", CoordinationState.ABORTED);

    private final String wireValue;
    private final CoordinationState terminalState;

    CoordinationStatus(String wireValue, CoordinationState terminalState) {
        this.wireValue = wireValue;
        this.terminalState = terminalState;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public CoordinationState getTerminalState() {
        return terminalState;
    }
}
