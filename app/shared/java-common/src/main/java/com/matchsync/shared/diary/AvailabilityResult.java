package com.matchsync.shared.diary;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 가용성 판정 결과
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AvailabilityResult {

    private static final AvailabilityResult FREE = new AvailabilityResult(true, null, false);
    private static final AvailabilityResult OUTSIDE_DAY_BOUNDS = new AvailabilityResult(false, null, true);

    private final boolean free;

    /**
     * 처음 발견된 차단 약속 (진단 메시지용, 모든 충돌을 찾지는 않음)
     */
    private final Appointment conflictingAppointment;

    private final boolean outsideDayBounds;

    public static AvailabilityResult free() {
        return FREE;
    }

    public static AvailabilityResult blockedBy(Appointment appointment) {
        return new AvailabilityResult(false, appointment, false);
    }

    public static AvailabilityResult outsideDayBounds() {
        return OUTSIDE_DAY_BOUNDS;
    }
}
