package com.matchsync.coordinator.common.exception;

public class InvalidCoordinationRequestException extends RuntimeException {
    public InvalidCoordinationRequestException(String message) {
        super(message);
    }

    public InvalidCoordinationRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
