package com.matchsync.coordinator.participant;

import com.matchsync.coordinator.common.config.CoordinationProperties;
import com.matchsync.coordinator.common.exception.UnknownParticipantException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 설정(coordination.participants)에 등록된 참가자 목록
 */
@Component
@Slf4j
public class ParticipantRegistry {

    private final Map<String, RegisteredParticipant> participants = new LinkedHashMap<>();

    public ParticipantRegistry(CoordinationProperties properties) {
        properties.getParticipants().forEach((id, endpoint) -> {
            String baseUrl = endpoint.getBaseUrl().endsWith("/")
                    ? endpoint.getBaseUrl().substring(0, endpoint.getBaseUrl().length() - 1)
                    : endpoint.getBaseUrl();
            participants.put(id, new RegisteredParticipant(id, baseUrl));
        });
        log.info("참가자 등록 완료: {}", participants.keySet());
    }

    /**
     * 요청된 ID 순서대로 참가자 조회
     *
     * @throws UnknownParticipantException 등록되지 않은 ID가 하나라도 있는 경우
     */
    public List<RegisteredParticipant> resolve(List<String> participantIds) {
        List<String> unknown = participantIds.stream()
                .filter(id -> !participants.containsKey(id))
                .toList();
        if (!unknown.isEmpty()) {
            throw new UnknownParticipantException("등록되지 않은 참가자입니다: " + unknown);
        }
        return participantIds.stream().map(participants::get).toList();
    }

    public List<RegisteredParticipant> all() {
        return Collections.unmodifiableList(new ArrayList<>(participants.values()));
    }
}
