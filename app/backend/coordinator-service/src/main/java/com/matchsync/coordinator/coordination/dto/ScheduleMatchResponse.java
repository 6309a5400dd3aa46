package com.matchsync.coordinator.coordination.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.matchsync.coordinator.coordination.model.CoordinationState;
import com.matchsync.coordinator.coordination.model.CoordinationStatus;
import com.matchsync.coordinator.coordination.model.OutcomeReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 조율 결과
 *
 * 네트워크 오류, 충돌, 공통 시간 없음 같은 결과도 예외가 아닌 이 응답으로 전달된다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScheduleMatchResponse {

    private String runId;

    private CoordinationStatus status;

    private OutcomeReason reason;

    /**
     * 예약을 시도한 슬롯 (committed, partially_failed인 경우)
     */
    private SlotDto selectedSlot;

    private int candidatesFound;

    /**
     * 모든 참가자에게 비어있는 슬롯 전체 (시간 순)
     */
    private List<SlotDto> candidates;

    /**
     * 슬롯을 실제로 고른 전략 (대체된 경우 fallback)
     */
    private String strategy;

    private CoordinationState finalState;

    private Map<String, ParticipantResultDto> perParticipant;
}
