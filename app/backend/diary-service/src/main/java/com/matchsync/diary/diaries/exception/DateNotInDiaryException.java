package com.matchsync.diary.diaries.exception;

public class DateNotInDiaryException extends RuntimeException {
    public DateNotInDiaryException(String message) {
        super(message);
    }

    public DateNotInDiaryException(String message, Throwable cause) {
        super(message, cause);
    }
}
