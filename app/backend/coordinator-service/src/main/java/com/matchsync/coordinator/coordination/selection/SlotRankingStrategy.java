package com.matchsync.coordinator.coordination.selection;

import com.matchsync.coordinator.coordination.algorithm.CandidateSlot;

import java.util.List;

/**
 * 후보 슬롯 순위 결정 전략
 *
 * 구현체는 실패하거나 느릴 수 있다. 선택기는 결과를 검증하고 실패 시 가장 이른 슬롯으로 대체한다.
 */
public interface SlotRankingStrategy {

    /**
     * 요청에서 전략을 지정할 때 쓰는 이름 (예: earliest)
     */
    String getName();

    /**
     * @param candidates 시간 순으로 정렬된 후보 (비어있지 않음)
     * @return 선호도 높은 순서의 후보 목록
     */
    List<CandidateSlot> rank(List<CandidateSlot> candidates);
}
