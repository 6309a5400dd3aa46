package com.matchsync.coordinator.health;

import com.matchsync.coordinator.common.config.CoordinationConfig;
import com.matchsync.coordinator.participant.RegisteredParticipant;
import com.matchsync.coordinator.participant.client.ParticipantClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 참가자 생존 여부 확인
 *
 * 다이어리 조회 전에 실행하는 가벼운 사전 점검이다. 오탐(실제로는 살아있는데 offline)은 실행 중단으로만 이어진다.
 */
@Component
@Slf4j
public class HealthProbe {

    private final ParticipantClient participantClient;
    private final ExecutorService executor;

    public HealthProbe(
            ParticipantClient participantClient,
            @Qualifier(CoordinationConfig.COORDINATION_EXECUTOR) ExecutorService executor
    ) {
        this.participantClient = participantClient;
        this.executor = executor;
    }

    public ProbeStatus probe(RegisteredParticipant participant, Duration timeout) {
        return probeAll(List.of(participant), timeout).get(participant.getId());
    }

    /**
     * 모든 참가자를 병렬로 확인한다. 제한 시간 안에 응답하지 않으면 OFFLINE.
     *
     * @return 참가자 ID → 상태 (요청 순서 유지)
     */
    public Map<String, ProbeStatus> probeAll(List<RegisteredParticipant> participants, Duration timeout) {
        Map<String, CompletableFuture<ProbeStatus>> futures = new LinkedHashMap<>();
        for (RegisteredParticipant participant : participants) {
            CompletableFuture<ProbeStatus> future = CompletableFuture
                    .supplyAsync(() -> participantClient.isOnline(participant)
                            ? ProbeStatus.ONLINE
                            : ProbeStatus.OFFLINE, executor)
                    .completeOnTimeout(ProbeStatus.OFFLINE, timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(e -> ProbeStatus.OFFLINE);
            futures.put(participant.getId(), future);
        }

        Map<String, ProbeStatus> statuses = new LinkedHashMap<>();
        futures.forEach((id, future) -> statuses.put(id, future.join()));

        statuses.forEach((id, status) -> {
            if (status == ProbeStatus.OFFLINE) {
                log.warn("참가자 offline: participantId={}", id);
            }
        });
        return statuses;
    }
}
