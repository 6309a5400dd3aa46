package com.matchsync.shared.diary;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 참가자 다이어리의 약속 한 건
 *
 * reference는 조율 엔진이 잡은 예약(BOOKED)에만 붙는 실행 ID로, 중복 예약 판별과 보상 취소에 사용된다.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Appointment {

    TimeRange timeRange;

    String label;

    AppointmentKind kind;

    String reference;

    public static Appointment booked(TimeRange timeRange, String label, String reference) {
        return Appointment.builder()
                .timeRange(timeRange)
                .label(label)
                .kind(AppointmentKind.BOOKED)
                .reference(reference)
                .build();
    }

    @JsonIgnore
    public boolean isBlocking() {
        return kind.isBlocking();
    }

    public boolean overlaps(TimeRange range) {
        return timeRange.overlaps(range);
    }
}
