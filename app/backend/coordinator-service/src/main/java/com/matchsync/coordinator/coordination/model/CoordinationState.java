package com.matchsync.coordinator.coordination.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 조율 실행 상태
 *
 * Init → HealthChecking → FetchingDiaries → ComputingAvailability → Intersecting → Selecting → Committing
 * → {Committed | PartiallyFailed} → Done. 중간 단계에서는 Aborted로 끝날 수 있다.
 */
public enum CoordinationState {
    INIT("Init", false),
    HEALTH_CHECKING("HealthChecking", false),
    FETCHING_DIARIES("FetchingDiaries", false),
    COMPUTING_AVAILABILITY("ComputingAvailability", false),
    INTERSECTING("Intersecting", false),
    SELECTING("Selecting", false),
    COMMITTING("Committing", false),
    COMMITTED("Committed", true),
    PARTIALLY_FAILED("PartiallyFailed", true),
    ABORTED("Aborted", true),
    DONE("Done", false);

    private final String wireValue;
    private final boolean terminal;

    CoordinationState(String wireValue, boolean terminal) {
        this.wireValue = wireValue;
        this.terminal = terminal;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
