package com.matchsync.coordinator.coordination.algorithm;

import com.matchsync.shared.diary.TimeRange;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 날짜 + 시간 구간 (후보 구간 또는 모두가 비어있는 슬롯)
 *
 * 정렬 순서는 (날짜, 시작 시간, 종료 시간) 오름차순이다.
 */
@Getter
@EqualsAndHashCode
public final class CandidateSlot implements Comparable<CandidateSlot> {

    private final LocalDate date;

    private final TimeRange timeRange;

    public CandidateSlot(LocalDate date, TimeRange timeRange) {
        if (date == null || timeRange == null) {
            throw new IllegalArgumentException("날짜와 시간 구간은 필수입니다");
        }
        this.date = date;
        this.timeRange = timeRange;
    }

    public static CandidateSlot of(LocalDate date, LocalTime start, LocalTime end) {
        return new CandidateSlot(date, TimeRange.of(start, end));
    }

    public LocalTime getStart() {
        return timeRange.getStart();
    }

    public LocalTime getEnd() {
        return timeRange.getEnd();
    }

    @Override
    public int compareTo(CandidateSlot other) {
        int byDate = date.compareTo(other.date);
        return byDate != 0 ? byDate : timeRange.compareTo(other.timeRange);
    }

    @Override
    public String toString() {
        return date + " " + timeRange;
    }
}
