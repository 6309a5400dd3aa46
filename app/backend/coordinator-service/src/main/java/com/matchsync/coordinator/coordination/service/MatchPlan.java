package com.matchsync.coordinator.coordination.service;

import com.matchsync.coordinator.participant.RegisteredParticipant;
import com.matchsync.shared.diary.TimeRange;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * 검증을 마친 조율 요청 (기본값 적용 후)
 */
@Value
@Builder
class MatchPlan {

    List<RegisteredParticipant> participants;

    List<LocalDate> searchDates;

    List<TimeRange> windows;

    String label;

    String strategy;

    List<String> participantIds() {
        return participants.stream().map(RegisteredParticipant::getId).toList();
    }
}
