package com.matchsync.coordinator.participant.client;

import lombok.Value;

/**
 * 참가자 예약 호출 결과
 */
@Value
public class BookingOutcome {

    public enum Result {
        BOOKED,
        CONFLICT,
        UNREACHABLE,
        ERROR
    }

    Result result;

    String message;

    public static BookingOutcome booked() {
        return new BookingOutcome(Result.BOOKED, null);
    }

    public static BookingOutcome of(Result result, String message) {
        return new BookingOutcome(result, message);
    }

    public boolean isBooked() {
        return result == Result.BOOKED;
    }
}
