package com.matchsync.shared.diary;

import com.matchsync.shared.diary.exception.InvalidRangeException;

import java.time.LocalDate;
import java.util.List;

/**
 * 약속 유연성 규칙에 따른 가용성 판정
 *
 * 규칙:
 * 1. 참가자의 하루 범위를 벗어나는 구간은 항상 불가
 * 2. FIXED / BOOKED 약속과 겹치면 불가 (처음 발견된 약속을 반환)
 * 3. FLEXIBLE / LEISURE 약속은 재조정 가능한 약속이므로 겹쳐도 가능으로 판정
 *
 * 상태가 없으므로 참가자 서비스와 조율 서비스 양쪽에서 같은 인스턴스를 공유해도 된다.
 */
public class AvailabilityEngine {

    public AvailabilityResult isFree(Diary diary, LocalDate date, TimeRange window) {
        if (diary == null || date == null) {
            throw new InvalidRangeException("다이어리와 날짜는 필수입니다");
        }
        return isFree(diary.appointmentsOn(date), diary.getDayBounds(), window);
    }

    /**
     * 하루치 약속 목록에 대한 판정
     *
     * @param dayAppointments 시작 시간 순으로 정렬된 약속 목록
     * @param dayBounds       하루 범위 (null이면 범위 검사 생략)
     * @param window          검사할 구간
     */
    public AvailabilityResult isFree(List<Appointment> dayAppointments, TimeRange dayBounds, TimeRange window) {
        if (window == null) {
            throw new InvalidRangeException("검사할 시간 구간은 필수입니다");
        }
        if (dayBounds != null && !dayBounds.contains(window)) {
            return AvailabilityResult.outsideDayBounds();
        }

        for (Appointment appointment : dayAppointments) {
            // 정렬되어 있으므로 구간 끝 이후에 시작하는 약속부터는 볼 필요 없음
            if (!appointment.getTimeRange().getStart().isBefore(window.getEnd())) {
                break;
            }
            if (appointment.isBlocking() && appointment.overlaps(window)) {
                return AvailabilityResult.blockedBy(appointment);
            }
        }
        return AvailabilityResult.free();
    }
}
