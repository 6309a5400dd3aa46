package com.matchsync.coordinator.participant.service;

import com.matchsync.coordinator.common.config.CoordinationProperties;
import com.matchsync.coordinator.participant.ParticipantRegistry;
import com.matchsync.coordinator.participant.RegisteredParticipant;
import com.matchsync.coordinator.participant.client.ParticipantClient;
import com.matchsync.coordinator.participant.client.ParticipantUnreachableException;
import com.matchsync.coordinator.participant.dto.ResetParticipantsResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 참가자 관리 작업 (다이어리 초기화)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParticipantAdminService {

    private final ParticipantRegistry participantRegistry;
    private final ParticipantClient participantClient;
    private final CoordinationProperties properties;

    public ResetParticipantsResponse resetDiaries(List<String> participantIds) {
        List<RegisteredParticipant> targets = participantIds == null || participantIds.isEmpty()
                ? participantRegistry.all()
                : participantRegistry.resolve(participantIds);

        Map<String, String> results = new LinkedHashMap<>();
        for (RegisteredParticipant target : targets) {
            try {
                participantClient.resetDiary(target, properties.getAdminApiKey());
                results.put(target.getId(), ResetParticipantsResponse.RESET);
            } catch (ParticipantUnreachableException e) {
                results.put(target.getId(), ResetParticipantsResponse.FAILED);
            }
        }

        boolean allReset = results.values().stream().allMatch(ResetParticipantsResponse.RESET::equals);
        log.info("다이어리 초기화 결과: {}", results);
        return ResetParticipantsResponse.builder()
                .results(results)
                .allReset(allReset)
                .build();
    }
}
