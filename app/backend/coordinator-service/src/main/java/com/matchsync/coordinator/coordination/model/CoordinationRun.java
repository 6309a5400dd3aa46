package com.matchsync.coordinator.coordination.model;

import com.matchsync.coordinator.coordination.algorithm.CandidateSlot;
import com.matchsync.coordinator.coordination.selection.SelectionResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 조율 실행 1회의 상태 기록
 *
 * 조율을 진행하는 스레드 하나만 변경한다. 원격 호출 결과는 Future로 받아 이 스레드에서 반영한다.
 */
@Getter
@Slf4j
public class CoordinationRun {

    private final String runId;

    private CoordinationState state = CoordinationState.INIT;

    private CoordinationState terminalState;

    private CoordinationStatus status;

    private OutcomeReason reason;

    private final Map<String, ParticipantRunState> participants = new LinkedHashMap<>();

    private List<CandidateSlot> candidates = Collections.emptyList();

    private SelectionResult selection;

    public CoordinationRun(String runId, List<String> participantIds) {
        this.runId = runId;
        participantIds.forEach(id -> participants.put(id, new ParticipantRunState(id)));
    }

    public void transitionTo(CoordinationState next) {
        if (state.isTerminal() || state == CoordinationState.DONE) {
            throw new IllegalStateException("종료된 실행은 상태를 바꿀 수 없습니다: " + state + " → " + next);
        }
        log.debug("조율 상태 전이 - runId: {}, {} → {}", runId, state.getWireValue(), next.getWireValue());
        state = next;
    }

    /**
     * 최종 결과를 기록하고 Done으로 전이
     */
    public void finish(CoordinationStatus status, OutcomeReason reason) {
        transitionTo(status.getTerminalState());
        this.terminalState = state;
        this.status = status;
        this.reason = reason;
        this.state = CoordinationState.DONE;
    }

    public ParticipantRunState participant(String participantId) {
        ParticipantRunState participant = participants.get(participantId);
        if (participant == null) {
            throw new IllegalArgumentException("이 실행에 포함되지 않은 참가자: " + participantId);
        }
        return participant;
    }

    public void recordCandidates(List<CandidateSlot> candidates) {
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
    }

    public void recordSelection(SelectionResult selection) {
        this.selection = selection;
    }

    public CandidateSlot getSelectedSlot() {
        return selection != null ? selection.getSlot() : null;
    }
}
