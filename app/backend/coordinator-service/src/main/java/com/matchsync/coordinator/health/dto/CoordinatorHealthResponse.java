package com.matchsync.coordinator.health.dto;

import com.matchsync.coordinator.health.ProbeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoordinatorHealthResponse {

    public static final String READY = "ready";
    public static final String NOT_READY = "not_ready";

    private ProbeStatus coordinator;

    private Map<String, ProbeStatus> participants;

    /**
     * 모든 참가자가 online이면 ready
     */
    private String allSystems;
}
