package com.matchsync.coordinator.participant.client;

import lombok.Value;

/**
 * 참가자 예약 취소(보상) 호출 결과
 */
@Value
public class CancellationOutcome {

    public enum Result {
        CANCELLED,
        NOT_FOUND,
        /** 취소 API가 없는 참가자 (재시도하지 않음) */
        UNSUPPORTED,
        UNREACHABLE,
        ERROR;

        /**
         * 예약이 더 이상 남아있지 않음이 확인된 결과
         */
        public boolean isRolledBack() {
            return this == CANCELLED || this == NOT_FOUND;
        }

        public boolean isRetryable() {
            return this == UNREACHABLE || this == ERROR;
        }
    }

    Result result;

    String message;

    public static CancellationOutcome of(Result result, String message) {
        return new CancellationOutcome(result, message);
    }
}
