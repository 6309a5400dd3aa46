package com.matchsync.coordinator.coordination.algorithm;

import com.matchsync.shared.diary.Appointment;
import com.matchsync.shared.diary.AppointmentKind;
import com.matchsync.shared.diary.AvailabilityEngine;
import com.matchsync.shared.diary.Diary;
import com.matchsync.shared.diary.TimeRange;
import com.matchsync.shared.diary.exception.InvalidRangeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CandidateWindowGenerator 테스트")
class CandidateWindowGeneratorTest {

    private static final LocalDate DAY = LocalDate.of(2026, 1, 21);

    private CandidateWindowGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new CandidateWindowGenerator(new AvailabilityEngine());
    }

    // =======================================================================
    // generateWindows
    // =======================================================================

    @Test
    @DisplayName("08:00-19:00, 2시간, 1시간 간격 - 17:00-19:00까지 10개")
    void generateWindows_endsExactlyAtWindowEnd() {
        // when
        List<TimeRange> windows = generator.generateWindows(time("08:00"), time("19:00"), 120, 60);

        // then
        assertThat(windows).hasSize(10);
        assertThat(windows.get(0)).isEqualTo(range("08:00", "10:00"));
        assertThat(windows.get(9)).isEqualTo(range("17:00", "19:00"));
    }

    @Test
    @DisplayName("간격이 길이보다 길면 구간 사이에 틈이 생긴다")
    void generateWindows_coarseGranularity() {
        // when
        List<TimeRange> windows = generator.generateWindows(time("08:00"), time("12:00"), 30, 90);

        // then
        assertThat(windows).containsExactly(
                range("08:00", "08:30"),
                range("09:30", "10:00"),
                range("11:00", "11:30"));
    }

    @Test
    @DisplayName("길이가 탐색 구간과 같으면 구간 하나")
    void generateWindows_durationEqualsWindow() {
        assertThat(generator.generateWindows(time("08:00"), time("19:00"), 660, 60))
                .containsExactly(range("08:00", "19:00"));
    }

    @Test
    @DisplayName("잘못된 입력은 InvalidRangeException")
    void generateWindows_invalid() {
        assertThatThrownBy(() -> generator.generateWindows(time("08:00"), time("19:00"), 0, 60))
                .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> generator.generateWindows(time("08:00"), time("19:00"), 60, 0))
                .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> generator.generateWindows(time("19:00"), time("08:00"), 60, 60))
                .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> generator.generateWindows(time("08:00"), time("09:00"), 120, 60))
                .isInstanceOf(InvalidRangeException.class);
    }

    // =======================================================================
    // freeSlots
    // =======================================================================

    @Test
    @DisplayName("10:00-12:00 FIXED 약속이 있으면 겹치는 3개 구간 제외")
    void freeSlots_fixedAppointmentBlocks() {
        // given
        Diary diary = diary("bean", range("08:00", "19:00"), appointment("10:00", "12:00", AppointmentKind.FIXED));
        List<TimeRange> windows = generator.generateWindows(time("08:00"), time("19:00"), 120, 60);

        // when
        SortedSet<CandidateSlot> free = generator.freeSlots(diary, List.of(DAY), windows);

        // then
        assertThat(free).extracting(CandidateSlot::getTimeRange).containsExactly(
                range("08:00", "10:00"),
                range("12:00", "14:00"),
                range("13:00", "15:00"),
                range("14:00", "16:00"),
                range("15:00", "17:00"),
                range("16:00", "18:00"),
                range("17:00", "19:00"));
    }

    @Test
    @DisplayName("LEISURE 약속은 빈 슬롯 계산에 영향 없음")
    void freeSlots_advisoryDoesNotBlock() {
        // given
        Diary diary = diary("joy", range("08:00", "19:00"), appointment("13:00", "15:00", AppointmentKind.LEISURE));
        List<TimeRange> windows = generator.generateWindows(time("08:00"), time("19:00"), 120, 60);

        // when
        SortedSet<CandidateSlot> free = generator.freeSlots(diary, List.of(DAY), windows);

        // then
        assertThat(free).hasSize(10);
    }

    @Test
    @DisplayName("참가자의 하루 범위 밖 구간은 비어있지 않음")
    void freeSlots_participantDayBounds() {
        // given
        Diary diary = diary("bean", range("09:00", "17:00"));
        List<TimeRange> windows = generator.generateWindows(time("08:00"), time("19:00"), 120, 60);

        // when
        SortedSet<CandidateSlot> free = generator.freeSlots(diary, List.of(DAY), windows);

        // then
        assertThat(free).extracting(CandidateSlot::getStart)
                .containsExactly(time("09:00"), time("10:00"), time("11:00"), time("12:00"),
                        time("13:00"), time("14:00"), time("15:00"));
    }

    @Test
    @DisplayName("다이어리에 없는 날짜는 빈 슬롯 없음")
    void freeSlots_dateNotInDiary() {
        // given
        Diary diary = diary("bean", range("08:00", "19:00"));
        List<TimeRange> windows = generator.generateWindows(time("08:00"), time("19:00"), 60, 60);

        // when
        SortedSet<CandidateSlot> free = generator.freeSlots(diary, List.of(DAY, DAY.plusDays(1)), windows);

        // then
        assertThat(free).allMatch(slot -> slot.getDate().equals(DAY)).hasSize(11);
    }

    private static Diary diary(String participantId, TimeRange dayBounds, Appointment... appointments) {
        return new Diary(participantId, dayBounds, Map.of(DAY, List.of(appointments)));
    }

    private static Appointment appointment(String start, String end, AppointmentKind kind) {
        return Appointment.builder().timeRange(range(start, end)).label(kind.getWireValue()).kind(kind).build();
    }

    private static TimeRange range(String start, String end) {
        return TimeRange.of(time(start), time(end));
    }

    private static LocalTime time(String value) {
        return LocalTime.parse(value);
    }
}
