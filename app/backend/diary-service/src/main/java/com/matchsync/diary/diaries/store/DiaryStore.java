package com.matchsync.diary.diaries.store;

import com.matchsync.diary.common.config.DiaryProperties;
import com.matchsync.diary.diaries.exception.ParticipantNotFoundException;
import com.matchsync.diary.diaries.template.DiaryTemplate;
import com.matchsync.diary.diaries.template.DiaryTemplateFactory;
import com.matchsync.shared.diary.Appointment;
import com.matchsync.shared.diary.AvailabilityEngine;
import com.matchsync.shared.diary.Diary;
import com.matchsync.shared.diary.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 이 서비스가 소유한 참가자 다이어리 저장소 (인메모리)
 *
 * 템플릿은 시작 시 한 번 만들어 보관하므로 초기화 결과는 항상 동일하다.
 */
@Component
@Slf4j
public class DiaryStore {

    private final Map<String, DiaryTemplate> templates;
    private final Map<String, ParticipantDiary> diaries = new LinkedHashMap<>();

    public DiaryStore(DiaryProperties properties,
                      DiaryTemplateFactory templateFactory,
                      AvailabilityEngine availabilityEngine) {
        this.templates = templateFactory.createTemplates(properties);
        templates.forEach((id, template) -> diaries.put(id, new ParticipantDiary(template, availabilityEngine)));
        log.info("다이어리 저장소 초기화 완료 - 참가자: {}", diaries.keySet());
    }

    public List<DiaryTemplate> templates() {
        return new ArrayList<>(templates.values());
    }

    public DiaryTemplate getTemplate(String participantId) {
        DiaryTemplate template = templates.get(participantId);
        if (template == null) {
            throw new ParticipantNotFoundException("참가자를 찾을 수 없습니다: " + participantId);
        }
        return template;
    }

    public Diary getDiary(String participantId) {
        return find(participantId).snapshot();
    }

    public UpsertResult upsertAppointment(String participantId, LocalDate date, Appointment appointment) {
        return find(participantId).upsert(date, appointment);
    }

    public Optional<Appointment> cancelAppointment(String participantId, LocalDate date, TimeRange range, String reference) {
        return find(participantId).cancel(date, range, reference);
    }

    public Diary reset(String participantId) {
        return find(participantId).reset(getTemplate(participantId));
    }

    private ParticipantDiary find(String participantId) {
        ParticipantDiary diary = diaries.get(participantId);
        if (diary == null) {
            throw new ParticipantNotFoundException("참가자를 찾을 수 없습니다: " + participantId);
        }
        return diary;
    }
}
