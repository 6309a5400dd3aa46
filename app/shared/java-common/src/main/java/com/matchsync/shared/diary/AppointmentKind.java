package com.matchsync.shared.diary;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 약속 종류
 *
 * FIXED, BOOKED는 새 예약을 막는다. FLEXIBLE, LEISURE는 참고용(advisory)이라 막지 않는다.
 */
public enum AppointmentKind {
    FIXED("fixed", true),
    FLEXIBLE("flexible", false),
    LEISURE("leisure", false),
    BOOKED("booked", true);

    private final String wireValue;
    private final boolean blocking;

    AppointmentKind(String wireValue, boolean blocking) {
        this.wireValue = wireValue;
        this.blocking = blocking;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isBlocking() {
        return blocking;
    }

    @JsonCreator
    public static AppointmentKind fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireValue.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 약속 종류: " + value));
    }
}
