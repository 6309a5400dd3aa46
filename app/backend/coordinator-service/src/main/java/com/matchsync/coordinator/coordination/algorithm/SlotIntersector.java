package com.matchsync.coordinator.coordination.algorithm;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 모든 참가자에게 비어있는 슬롯 계산 (집합 교집합)
 *
 * 결과는 (날짜, 시작 시간) 오름차순으로 정렬되므로 참가자 순서와 무관하게 같은 입력이면 같은 결과가 나온다.
 */
@Component
public class SlotIntersector {

    /**
     * @param freeSlotsByParticipant 참가자 ID → 빈 슬롯 집합
     * @return 모든 참가자에게 공통인 슬롯 (정렬됨)
     * @throws IllegalArgumentException 참가자가 없는 경우
     */
    public List<CandidateSlot> intersect(Map<String, ? extends Collection<CandidateSlot>> freeSlotsByParticipant) {
        if (freeSlotsByParticipant == null || freeSlotsByParticipant.isEmpty()) {
            throw new IllegalArgumentException("교집합을 계산할 참가자가 없습니다");
        }

        // 가장 작은 집합부터 시작하면 비교 횟수가 줄어든다
        List<Collection<CandidateSlot>> sets = new ArrayList<>(freeSlotsByParticipant.values());
        sets.sort(Comparator.comparingInt(Collection::size));

        TreeSet<CandidateSlot> common = new TreeSet<>(sets.get(0));
        for (int i = 1; i < sets.size() && !common.isEmpty(); i++) {
            common.retainAll(new TreeSet<>(sets.get(i)));
        }
        return new ArrayList<>(common);
    }
}
