package com.matchsync.coordinator.coordination.model;

import lombok.Getter;

/**
 * 한 조율 실행 안에서의 참가자 상태
 */
@Getter
public class ParticipantRunState {

    private final String participantId;

    private int freeSlots;

    private ParticipantBookingStatus bookingStatus = ParticipantBookingStatus.PENDING;

    /**
     * 실패/보상 상세 (CONFLICT, UNREACHABLE, ERROR, CANCELLED, NOT_FOUND, UNSUPPORTED)
     */
    private String detail;

    private int compensationAttempts;

    /**
     * 예약 응답을 받지 못해 예약 여부를 알 수 없는 상태
     */
    private boolean inDoubt;

    public ParticipantRunState(String participantId) {
        this.participantId = participantId;
    }

    public void recordFreeSlots(int freeSlots) {
        this.freeSlots = freeSlots;
    }

    public void markCommitted() {
        this.bookingStatus = ParticipantBookingStatus.COMMITTED;
        this.detail = null;
    }

    public void markFailed(String detail) {
        this.bookingStatus = ParticipantBookingStatus.FAILED;
        this.detail = detail;
    }

    /**
     * 응답 없이 끝난 예약. 참가자 쪽에는 예약이 남아 있을 수 있으므로 보상 대상이 된다.
     */
    public void markInDoubt(String detail) {
        markFailed(detail);
        this.inDoubt = true;
    }

    public void recordCompensationAttempt() {
        if (bookingStatus != ParticipantBookingStatus.COMMITTED && !inDoubt) {
            throw new IllegalStateException("예약되지 않은 참가자는 보상할 수 없습니다: " + participantId);
        }
        compensationAttempts++;
    }

    public void markRolledBack(String detail) {
        this.bookingStatus = ParticipantBookingStatus.ROLLED_BACK;
        this.detail = detail;
    }

    public void markCompensationFailed(String detail) {
        this.bookingStatus = ParticipantBookingStatus.COMPENSATION_FAILED;
        this.detail = detail;
    }
}
