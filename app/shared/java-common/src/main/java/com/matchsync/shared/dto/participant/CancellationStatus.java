package com.matchsync.shared.dto.participant;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum CancellationStatus {
    CANCELLED("cancelled"),
    NOT_FOUND("not_found"),
    ERROR("error");

    private final String wireValue;

    CancellationStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static CancellationStatus fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.wireValue.equalsIgnoreCase(value))
                .findFirst()
                .orElse(ERROR);
    }
}
