package com.matchsync.shared.diary;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 참가자 한 명의 다일(multi-day) 일정 스냅샷
 *
 * 불변 객체. 날짜는 오름차순, 각 날짜의 약속은 시작 시간 순으로 정렬된 상태를 보장한다.
 * 원본 일정의 변경은 해당 참가자의 Diary Store만 할 수 있다.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Diary {

    private static final Comparator<Appointment> CHRONOLOGICAL =
            Comparator.comparing(Appointment::getTimeRange);

    private final String participantId;

    /**
     * 참가자가 약속을 받을 수 있는 하루 범위 (예: 08:00-19:00)
     */
    private final TimeRange dayBounds;

    private final SortedMap<LocalDate, List<Appointment>> days;

    @JsonCreator
    public Diary(
            @JsonProperty("participantId") String participantId,
            @JsonProperty("dayBounds") TimeRange dayBounds,
            @JsonProperty("days") Map<LocalDate, List<Appointment>> days
    ) {
        this.participantId = participantId;
        this.dayBounds = dayBounds;

        TreeMap<LocalDate, List<Appointment>> sorted = new TreeMap<>();
        if (days != null) {
            days.forEach((date, appointments) -> {
                List<Appointment> ordered = new ArrayList<>(appointments != null ? appointments : List.of());
                ordered.sort(CHRONOLOGICAL);
                sorted.put(date, Collections.unmodifiableList(ordered));
            });
        }
        this.days = Collections.unmodifiableSortedMap(sorted);
    }

    /**
     * 특정 날짜의 약속 목록 (다이어리에 없는 날짜면 빈 목록)
     */
    public List<Appointment> appointmentsOn(LocalDate date) {
        return days.getOrDefault(date, List.of());
    }

    public boolean covers(LocalDate date) {
        return days.containsKey(date);
    }
}
