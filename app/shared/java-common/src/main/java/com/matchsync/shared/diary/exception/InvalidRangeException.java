package com.matchsync.shared.diary.exception;

/**
 * 시간 구간이 잘못된 경우 (길이 0 이하, 필수 값 누락, 범위 초과)
 *
 * 충돌(Conflict)이 아니라 호출자 오류이므로 원격 호출 전에 즉시 던진다.
 */
public class InvalidRangeException extends RuntimeException {
    public InvalidRangeException(String message) {
        super(message);
    }

    public InvalidRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
