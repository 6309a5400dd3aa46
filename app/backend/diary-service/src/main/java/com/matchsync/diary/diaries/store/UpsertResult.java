package com.matchsync.diary.diaries.store;

import com.matchsync.shared.diary.Appointment;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 약속 추가 결과
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UpsertResult {

    public enum Status {
        INSERTED,
        /** 같은 reference의 예약이 이미 있음 (재시도) */
        ALREADY_PRESENT,
        CONFLICT
    }

    private final Status status;

    private final Appointment appointment;

    private final Appointment conflict;

    public static UpsertResult inserted(Appointment appointment) {
        return new UpsertResult(Status.INSERTED, appointment, null);
    }

    public static UpsertResult alreadyPresent(Appointment appointment) {
        return new UpsertResult(Status.ALREADY_PRESENT, appointment, null);
    }

    public static UpsertResult conflict(Appointment conflict) {
        return new UpsertResult(Status.CONFLICT, null, conflict);
    }

    public boolean isBooked() {
        return status != Status.CONFLICT;
    }
}
