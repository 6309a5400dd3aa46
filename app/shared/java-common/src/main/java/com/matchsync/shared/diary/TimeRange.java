package com.matchsync.shared.diary;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.matchsync.shared.diary.exception.InvalidRangeException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Duration;
import java.time.LocalTime;

/**
 * 하루 안의 반열린 시간 구간 [start, end)
 *
 * 생성 시점에 길이가 양수인지 검증하므로, 이 타입의 인스턴스는 항상 유효한 구간이다.
 */
@Getter
@EqualsAndHashCode
public final class TimeRange implements Comparable<TimeRange> {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private final LocalTime start;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private final LocalTime end;

    @JsonCreator
    public TimeRange(
            @JsonProperty("start") @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm") LocalTime start,
            @JsonProperty("end") @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm") LocalTime end
    ) {
        if (start == null || end == null) {
            throw new InvalidRangeException("시작/종료 시간은 필수입니다");
        }
        if (!end.isAfter(start)) {
            throw new InvalidRangeException("종료 시간은 시작 시간보다 늦어야 합니다: " + start + "-" + end);
        }
        this.start = start;
        this.end = end;
    }

    public static TimeRange of(LocalTime start, LocalTime end) {
        return new TimeRange(start, end);
    }

    /**
     * 시작 시간과 길이(분)로 구간 생성
     *
     * 자정을 넘어가는 구간은 하루 안의 구간이 아니므로 거부한다.
     */
    public static TimeRange ofMinutes(LocalTime start, int durationMinutes) {
        if (durationMinutes <= 0) {
            throw new InvalidRangeException("지속 시간은 1분 이상이어야 합니다: " + durationMinutes);
        }
        if (start == null) {
            throw new InvalidRangeException("시작 시간은 필수입니다");
        }
        long minutesLeftInDay = Duration.between(start, LocalTime.MAX).toMinutes() + 1;
        if (durationMinutes > minutesLeftInDay) {
            throw new InvalidRangeException("구간이 하루를 넘어갑니다: " + start + " + " + durationMinutes + "분");
        }
        return new TimeRange(start, start.plusMinutes(durationMinutes));
    }

    /**
     * 두 구간이 겹치는지 확인 (끝과 시작이 맞닿는 것은 겹침 아님)
     */
    public boolean overlaps(TimeRange other) {
        return this.start.isBefore(other.end) && other.start.isBefore(this.end);
    }

    /**
     * other 구간이 이 구간 안에 완전히 포함되는지 확인
     */
    public boolean contains(TimeRange other) {
        return !other.start.isBefore(this.start) && !other.end.isAfter(this.end);
    }

    public long durationMinutes() {
        return Duration.between(start, end).toMinutes();
    }

    @Override
    public int compareTo(TimeRange other) {
        int byStart = this.start.compareTo(other.start);
        return byStart != 0 ? byStart : this.end.compareTo(other.end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
