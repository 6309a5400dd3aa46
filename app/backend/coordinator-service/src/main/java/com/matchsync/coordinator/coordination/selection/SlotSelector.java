package com.matchsync.coordinator.coordination.selection;

import com.matchsync.coordinator.common.config.CoordinationConfig;
import com.matchsync.coordinator.coordination.algorithm.CandidateSlot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 후보 슬롯 중 하나를 선택
 *
 * 전략은 전용 스레드 풀에서 제한 시간 안에 실행된다. 실패, 시간 초과, 빈 결과, 후보에 없는 슬롯이면
 * 가장 이른 후보를 선택한다. 따라서 후보가 있으면 항상 슬롯이 선택된다.
 */
@Component
@Slf4j
public class SlotSelector {

    private final Map<String, SlotRankingStrategy> strategies = new LinkedHashMap<>();
    private final ExecutorService executor;

    public SlotSelector(
            List<SlotRankingStrategy> strategies,
            @Qualifier(CoordinationConfig.RANKING_EXECUTOR) ExecutorService executor
    ) {
        strategies.forEach(strategy -> this.strategies.put(strategy.getName(), strategy));
        this.executor = executor;
    }

    public boolean supports(String strategyName) {
        return strategies.containsKey(strategyName);
    }

    public Set<String> strategyNames() {
        return Collections.unmodifiableSet(strategies.keySet());
    }

    public SelectionResult select(List<CandidateSlot> candidates, String strategyName, Duration timeout) {
        if (candidates.isEmpty()) {
            return SelectionResult.noCandidate(strategyName);
        }

        List<CandidateSlot> ordered = new ArrayList<>(candidates);
        Collections.sort(ordered);
        CandidateSlot earliest = ordered.get(0);

        SlotRankingStrategy strategy = strategies.get(strategyName);
        if (strategy == null) {
            log.warn("알 수 없는 선택 전략 '{}' - 가장 이른 슬롯 사용: {}", strategyName, earliest);
            return new SelectionResult(earliest, SelectionResult.FALLBACK);
        }

        List<CandidateSlot> input = Collections.unmodifiableList(ordered);
        Future<List<CandidateSlot>> future = executor.submit(() -> strategy.rank(input));

        try {
            List<CandidateSlot> ranked = future.get(Math.max(timeout.toMillis(), 1), TimeUnit.MILLISECONDS);
            if (ranked == null || ranked.isEmpty()) {
                log.warn("선택 전략 '{}' 결과 없음 - 가장 이른 슬롯 사용: {}", strategyName, earliest);
                return new SelectionResult(earliest, SelectionResult.FALLBACK);
            }

            CandidateSlot chosen = ranked.get(0);
            if (!ordered.contains(chosen)) {
                log.warn("선택 전략 '{}'가 후보에 없는 슬롯 반환: {} - 가장 이른 슬롯 사용", strategyName, chosen);
                return new SelectionResult(earliest, SelectionResult.FALLBACK);
            }

            log.info("슬롯 선택 완료 - 전략: {}, 슬롯: {}, 후보 수: {}", strategyName, chosen, ordered.size());
            return new SelectionResult(chosen, strategyName);
        } catch (TimeoutException e) {
            // 실행 중인 전략 스레드에 인터럽트
            future.cancel(true);
            log.warn("선택 전략 '{}' 시간 초과({}ms) - 가장 이른 슬롯 사용: {}", strategyName, timeout.toMillis(), earliest);
        } catch (ExecutionException e) {
            log.warn("선택 전략 '{}' 실패: {} - 가장 이른 슬롯 사용: {}",
                    strategyName, e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), earliest);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("선택 전략 '{}' 대기 중 인터럽트 - 가장 이른 슬롯 사용: {}", strategyName, earliest);
        }
        return new SelectionResult(earliest, SelectionResult.FALLBACK);
    }
}
