package com.matchsync.coordinator.coordination.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ParticipantBookingStatus {
    PENDING("pending"),
    COMMITTED("committed"),
    FAILED("failed"),
    ROLLED_BACK("rolled_back"),
    COMPENSATION_FAILED("compensation_failed");

    private final String wireValue;

    ParticipantBookingStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
