package com.matchsync.diary.diaries.exception;

public class InvalidDiaryTemplateException extends RuntimeException {
    public InvalidDiaryTemplateException(String message) {
        super(message);
    }

    public InvalidDiaryTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
