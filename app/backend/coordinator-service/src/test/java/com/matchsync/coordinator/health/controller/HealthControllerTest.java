package com.matchsync.coordinator.health.controller;

import com.matchsync.coordinator.common.config.CoordinationProperties;
import com.matchsync.coordinator.health.HealthProbe;
import com.matchsync.coordinator.health.ProbeStatus;
import com.matchsync.coordinator.participant.ParticipantRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@DisplayName("HealthController 단위 테스트")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HealthProbe healthProbe;

    @MockBean
    private ParticipantRegistry participantRegistry;

    @MockBean
    private CoordinationProperties properties;

    @Test
    @DisplayName("offline 참가자가 있으면 allSystems NOT_READY")
    void health_NotReady() throws Exception {
        // Given
        Map<String, ProbeStatus> statuses = new LinkedHashMap<>();
        statuses.put("bean", ProbeStatus.ONLINE);
        statuses.put("joy", ProbeStatus.OFFLINE);
        given(participantRegistry.all()).willReturn(List.of());
        given(healthProbe.probeAll(any(), any())).willReturn(statuses);

        // When & Then
        mockMvc.perform(get("/v1/coordination/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.coordinator").value("online"))
                .andExpect(jsonPath("$.participants.bean").value("online"))
                .andExpect(jsonPath("$.participants.joy").value("offline"))
                .andExpect(jsonPath("$.allSystems").value("not_ready"));
    }

    @Test
    @DisplayName("모두 online이면 allSystems READY")
    void health_Ready() throws Exception {
        // Given
        given(participantRegistry.all()).willReturn(List.of());
        given(healthProbe.probeAll(any(), any())).willReturn(Map.of("bean", ProbeStatus.ONLINE));

        // When & Then
        mockMvc.perform(get("/v1/coordination/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allSystems").value("ready"));
    }
}
