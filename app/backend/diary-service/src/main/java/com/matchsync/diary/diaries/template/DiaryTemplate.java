package com.matchsync.diary.diaries.template;

import com.matchsync.shared.diary.Appointment;
import com.matchsync.shared.diary.Diary;
import com.matchsync.shared.diary.TimeRange;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;

/**
 * 참가자 다이어리의 기본 템플릿
 *
 * 서비스 시작 시 한 번 만들어지고 변하지 않으므로, 초기화는 항상 같은 다이어리를 돌려준다.
 */
@Getter
@Builder
public class DiaryTemplate {

    private final String participantId;

    private final String displayName;

    private final TimeRange dayBounds;

    private final SortedMap<LocalDate, List<Appointment>> days;

    public Diary toDiary() {
        return new Diary(participantId, dayBounds, days);
    }
}
