package com.matchsync.coordinator.coordination.algorithm;

import com.matchsync.shared.diary.AvailabilityEngine;
import com.matchsync.shared.diary.Diary;
import com.matchsync.shared.diary.TimeRange;
import com.matchsync.shared.diary.exception.InvalidRangeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 후보 구간 생성 및 참가자별 빈 구간 계산
 *
 * 알고리즘:
 * 1. dayWindowStart부터 granularity 간격으로 duration 길이의 구간 생성 (끝이 dayWindowEnd 이하인 동안)
 * 2. 탐색 날짜 × 후보 구간마다 AvailabilityEngine으로 가용성 판정
 * 3. 다이어리에 없는 날짜는 비어있지 않은 것으로 취급
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CandidateWindowGenerator {

    private final AvailabilityEngine availabilityEngine;

    /**
     * 하루 안의 후보 구간 목록
     *
     * 구간은 반열린 구간이므로 dayWindowEnd에 정확히 끝나는 구간도 포함된다. (예: 17:00-19:00)
     */
    public List<TimeRange> generateWindows(LocalTime dayWindowStart, LocalTime dayWindowEnd,
                                           int durationMinutes, int granularityMinutes) {
        if (durationMinutes <= 0) {
            throw new InvalidRangeException("지속 시간은 1분 이상이어야 합니다: " + durationMinutes);
        }
        if (granularityMinutes <= 0) {
            throw new InvalidRangeException("탐색 간격은 1분 이상이어야 합니다: " + granularityMinutes);
        }
        TimeRange dayWindow = TimeRange.of(dayWindowStart, dayWindowEnd);
        if (durationMinutes > dayWindow.durationMinutes()) {
            throw new InvalidRangeException(String.format(
                    "지속 시간(%d분)이 탐색 구간 %s보다 깁니다", durationMinutes, dayWindow));
        }

        // 분 단위 정수로 계산 (LocalTime 덧셈은 자정을 넘으면 되돌아감)
        int windowEnd = minuteOfDay(dayWindowEnd);
        List<TimeRange> windows = new ArrayList<>();
        for (int start = minuteOfDay(dayWindowStart); start + durationMinutes <= windowEnd; start += granularityMinutes) {
            windows.add(TimeRange.ofMinutes(LocalTime.of(start / 60, start % 60), durationMinutes));
        }
        return windows;
    }

    /**
     * 한 참가자의 빈 슬롯 집합
     */
    public SortedSet<CandidateSlot> freeSlots(Diary diary, List<LocalDate> searchDates, List<TimeRange> windows) {
        SortedSet<CandidateSlot> free = new TreeSet<>();
        for (LocalDate date : searchDates) {
            if (!diary.covers(date)) {
                continue;
            }
            for (TimeRange window : windows) {
                if (availabilityEngine.isFree(diary, date, window).isFree()) {
                    free.add(new CandidateSlot(date, window));
                }
            }
        }
        log.debug("빈 슬롯 계산 - participantId: {}, 날짜 수: {}, 후보 구간 수: {}, 빈 슬롯 수: {}",
                diary.getParticipantId(), searchDates.size(), windows.size(), free.size());
        return free;
    }

    private static int minuteOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }
}
