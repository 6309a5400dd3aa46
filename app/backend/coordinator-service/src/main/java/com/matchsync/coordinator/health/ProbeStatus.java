package com.matchsync.coordinator.health;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProbeStatus {
    ONLINE("online"),
    OFFLINE("offline");

    private final String wireValue;

    ProbeStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
