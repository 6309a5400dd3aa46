package com.matchsync.coordinator.health.controller;

import com.matchsync.coordinator.common.config.CoordinationProperties;
import com.matchsync.coordinator.health.HealthProbe;
import com.matchsync.coordinator.health.ProbeStatus;
import com.matchsync.coordinator.health.dto.CoordinatorHealthResponse;
import com.matchsync.coordinator.participant.ParticipantRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Tag(name = "Health", description = "조율 서비스 및 참가자 상태 API")
@RestController
@RequestMapping("/v1/coordination")
@RequiredArgsConstructor
public class HealthController {

    private final HealthProbe healthProbe;
    private final ParticipantRegistry participantRegistry;
    private final CoordinationProperties properties;

    @Operation(summary = "전체 상태 확인", description = "등록된 모든 참가자의 상태를 병렬로 확인합니다.")
    @GetMapping("/health")
    public ResponseEntity<CoordinatorHealthResponse> health() {
        Map<String, ProbeStatus> participants =
                healthProbe.probeAll(participantRegistry.all(), properties.getHealthTimeout());
        boolean allOnline = participants.values().stream().allMatch(status -> status == ProbeStatus.ONLINE);

        return ResponseEntity.ok(CoordinatorHealthResponse.builder()
                .coordinator(ProbeStatus.ONLINE)
                .participants(participants)
                .allSystems(allOnline ? CoordinatorHealthResponse.READY : CoordinatorHealthResponse.NOT_READY)
                .build());
    }
}
