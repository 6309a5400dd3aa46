package com.matchsync.coordinator.coordination.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * committed가 아닌 결과의 사유
 */
public enum OutcomeReason {
    PARTICIPANT_UNAVAILABLE("ParticipantUnavailable"),
    DIARY_FETCH_FAILED("DiaryFetchFailed"),
    NO_COMMON_SLOT("NoCommonSlot"),
    BOOKING_FAILED("BookingFailed"),
    TIMEOUT("Timeout"),
    CONFLICT("Conflict"),
    UNREACHABLE("Unreachable");

    private final String wireValue;

    OutcomeReason(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
