package com.matchsync.coordinator.common.exception;

public class UnknownParticipantException extends RuntimeException {
    public UnknownParticipantException(String message) {
        super(message);
    }

    public UnknownParticipantException(String message, Throwable cause) {
        super(message, cause);
    }
}
