package com.matchsync.coordinator.participant.client;

/**
 * 참가자 API 호출 실패 (연결 실패, 타임아웃, 오류 응답)
 */
public class ParticipantUnreachableException extends RuntimeException {
    public ParticipantUnreachableException(String message) {
        super(message);
    }

    public ParticipantUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
