package com.matchsync.coordinator.coordination.selection;

import com.matchsync.coordinator.coordination.algorithm.CandidateSlot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 가장 이른 슬롯 우선 (선택 실패 시의 기본 동작과 같음)
 */
@Component
public class EarliestFirstStrategy implements SlotRankingStrategy {

    public static final String NAME = "earliest";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<CandidateSlot> rank(List<CandidateSlot> candidates) {
        List<CandidateSlot> ranked = new ArrayList<>(candidates);
        Collections.sort(ranked);
        return ranked;
    }
}
