package com.matchsync.coordinator.coordination.selection;

public class SlotRankingException extends RuntimeException {
    public SlotRankingException(String message) {
        super(message);
    }

    public SlotRankingException(String message, Throwable cause) {
        super(message, cause);
    }
}
