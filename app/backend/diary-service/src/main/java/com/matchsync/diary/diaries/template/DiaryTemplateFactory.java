package com.matchsync.diary.diaries.template;

import com.matchsync.diary.common.config.DiaryProperties;
import com.matchsync.diary.common.config.DiaryProperties.ParticipantTemplate;
import com.matchsync.diary.common.config.DiaryProperties.TemplateAppointment;
import com.matchsync.diary.diaries.exception.InvalidDiaryTemplateException;
import com.matchsync.shared.diary.Appointment;
import com.matchsync.shared.diary.TimeRange;
import com.matchsync.shared.diary.exception.InvalidRangeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 설정값(diary.participants)으로부터 참가자별 기본 템플릿 생성
 *
 * 1. 시작일부터 days일 만큼 날짜 생성
 * 2. 날짜별로 적용되는 약속 선택 (every=n이면 n일마다, 같은 시간대는 뒤의 항목이 대체)
 * 3. 하루 범위 / 약속 간 겹침 검증 (겹치면 시작 실패)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DiaryTemplateFactory {

    private final Clock clock;

    public Map<String, DiaryTemplate> createTemplates(DiaryProperties properties) {
        Map<String, DiaryTemplate> templates = new LinkedHashMap<>();
        for (ParticipantTemplate participant : properties.getParticipants()) {
            if (templates.containsKey(participant.getId())) {
                throw new InvalidDiaryTemplateException("참가자 ID가 중복되었습니다: " + participant.getId());
            }
            templates.put(participant.getId(), createTemplate(participant));
        }
        return templates;
    }

    public DiaryTemplate createTemplate(ParticipantTemplate participant) {
        String participantId = participant.getId();
        TimeRange dayBounds = parseRange(participantId, participant.getDayStart(), participant.getDayEnd());
        LocalDate startDate = participant.getStartDate() != null
                ? parseDate(participantId, participant.getStartDate())
                : LocalDate.now(clock);

        TreeMap<LocalDate, List<Appointment>> days = new TreeMap<>();
        for (int offset = 0; offset < participant.getDays(); offset++) {
            LocalDate date = startDate.plusDays(offset);
            days.put(date, buildDay(participantId, date, offset, dayBounds, participant.getAppointments()));
        }

        log.info("다이어리 템플릿 생성 - participantId: {}, 기간: {} ~ {}, 하루 범위: {}",
                participantId, days.firstKey(), days.lastKey(), dayBounds);

        return DiaryTemplate.builder()
                .participantId(participantId)
                .displayName(participant.getDisplayName() != null ? participant.getDisplayName() : participantId)
                .dayBounds(dayBounds)
                .days(Collections.unmodifiableSortedMap(days))
                .build();
    }

    private List<Appointment> buildDay(
            String participantId,
            LocalDate date,
            int offset,
            TimeRange dayBounds,
            List<TemplateAppointment> entries
    ) {
        // 같은 시간대 항목은 나중 항목이 대체
        Map<TimeRange, Appointment> byRange = new LinkedHashMap<>();
        for (TemplateAppointment entry : entries) {
            if (entry.getEvery() != null && offset % entry.getEvery() != 0) {
                continue;
            }
            TimeRange range = parseRange(participantId, entry.getStart(), entry.getEnd());
            if (!dayBounds.contains(range)) {
                throw new InvalidDiaryTemplateException(String.format(
                        "약속이 하루 범위를 벗어납니다: participantId=%s, %s, bounds=%s", participantId, range, dayBounds));
            }
            byRange.put(range, Appointment.builder()
                    .timeRange(range)
                    .label(entry.getLabel())
                    .kind(entry.getKind())
                    .build());
        }

        List<Appointment> appointments = new ArrayList<>(byRange.values());
        appointments.sort((a, b) -> a.getTimeRange().compareTo(b.getTimeRange()));

        for (int i = 1; i < appointments.size(); i++) {
            Appointment previous = appointments.get(i - 1);
            Appointment current = appointments.get(i);
            if (previous.overlaps(current.getTimeRange())) {
                throw new InvalidDiaryTemplateException(String.format(
                        "같은 날 약속이 겹칩니다: participantId=%s, date=%s, '%s'(%s) / '%s'(%s)",
                        participantId, date, previous.getLabel(), previous.getTimeRange(),
                        current.getLabel(), current.getTimeRange()));
            }
        }
        return Collections.unmodifiableList(appointments);
    }

    private TimeRange parseRange(String participantId, String start, String end) {
        try {
            return TimeRange.of(LocalTime.parse(start), LocalTime.parse(end));
        } catch (DateTimeParseException | InvalidRangeException e) {
            throw new InvalidDiaryTemplateException(String.format(
                    "잘못된 시간 구간: participantId=%s, %s-%s", participantId, start, end), e);
        }
    }

    private LocalDate parseDate(String participantId, String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidDiaryTemplateException(String.format(
                    "잘못된 시작일: participantId=%s, startDate=%s", participantId, value), e);
        }
    }
}
