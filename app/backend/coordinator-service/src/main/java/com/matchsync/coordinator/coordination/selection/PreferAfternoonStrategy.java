package com.matchsync.coordinator.coordination.selection;

import com.matchsync.coordinator.coordination.algorithm.CandidateSlot;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 오후 시간 선호 전략
 *
 * 우선순위:
 * 1. 이른 날짜
 * 2. 13:00 ~ 17:00 사이에 시작하는 슬롯
 * 3. 그 외 낮 시간 슬롯
 * 4. 09:00 이전에 시작하거나 18:00 이후에 끝나는 슬롯
 * 같은 순위 안에서는 시작 시간 순
 */
@Component
public class PreferAfternoonStrategy implements SlotRankingStrategy {

    public static final String NAME = "afternoon";

    private static final LocalTime AFTERNOON_START = LocalTime.of(13, 0);
    private static final LocalTime AFTERNOON_END = LocalTime.of(17, 0);
    private static final LocalTime EARLY_BEFORE = LocalTime.of(9, 0);
    private static final LocalTime LATE_AFTER = LocalTime.of(18, 0);

    private static final Comparator<CandidateSlot> PREFERENCE = Comparator
            .comparing(CandidateSlot::getDate)
            .thenComparingInt(PreferAfternoonStrategy::tier)
            .thenComparing(CandidateSlot::getTimeRange);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<CandidateSlot> rank(List<CandidateSlot> candidates) {
        List<CandidateSlot> ranked = new ArrayList<>(candidates);
        ranked.sort(PREFERENCE);
        return ranked;
    }

    static int tier(CandidateSlot slot) {
        LocalTime start = slot.getStart();
        if (!start.isBefore(AFTERNOON_START) && start.isBefore(AFTERNOON_END)) {
            return 0;
        }
        if (start.isBefore(EARLY_BEFORE) || slot.getEnd().isAfter(LATE_AFTER)) {
            return 2;
        }
        return 1;
    }
}
