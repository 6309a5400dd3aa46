package com.matchsync.coordinator.coordination.service;

import java.time.Duration;

/**
 * 조율 실행 전체의 제한 시간
 */
final class RunDeadline {

    private final long deadlineNanos;

    private RunDeadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    static RunDeadline after(Duration timeout) {
        return new RunDeadline(System.nanoTime() + timeout.toNanos());
    }

    Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    boolean isExpired() {
        return remaining().isZero();
    }

    /**
     * 단계별 타임아웃을 남은 시간 이하로 제한
     */
    Duration clamp(Duration phaseTimeout) {
        Duration remaining = remaining();
        return phaseTimeout.compareTo(remaining) <= 0 ? phaseTimeout : remaining;
    }
}
