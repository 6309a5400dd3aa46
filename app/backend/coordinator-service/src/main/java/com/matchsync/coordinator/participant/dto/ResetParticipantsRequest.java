package com.matchsync.coordinator.participant.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResetParticipantsRequest {

    /**
     * 초기화할 참가자 (비어있으면 등록된 전체)
     */
    private List<String> participantIds;
}
