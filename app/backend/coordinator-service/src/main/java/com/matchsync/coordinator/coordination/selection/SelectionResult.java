package com.matchsync.coordinator.coordination.selection;

import com.matchsync.coordinator.coordination.algorithm.CandidateSlot;
import lombok.Value;

/**
 * 슬롯 선택 결과
 *
 * 후보가 없으면 slot이 null인 noCandidate (오류가 아닌 정상 결과)
 */
@Value
public class SelectionResult {

    public static final String FALLBACK = "fallback";

    CandidateSlot slot;

    /**
     * 실제로 슬롯을 고른 전략 이름 (대체된 경우 fallback)
     */
    String strategy;

    public static SelectionResult noCandidate(String strategy) {
        return new SelectionResult(null, strategy);
    }

    public boolean hasSlot() {
        return slot != null;
    }

    public boolean isFallback() {
        return FALLBACK.equals(strategy);
    }
}
