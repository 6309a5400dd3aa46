package com.matchsync.coordinator.participant.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResetParticipantsResponse {

    public static final String RESET = "reset";
    public static final String FAILED = "failed";

    /**
     * 참가자 ID → reset | failed
     */
    private Map<String, String> results;

    private boolean allReset;
}
