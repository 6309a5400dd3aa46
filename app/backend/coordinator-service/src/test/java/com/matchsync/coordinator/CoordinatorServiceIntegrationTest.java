package com.matchsync.coordinator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 조율 서비스 통합 테스트
 *
 * 참가자 주소(*.test)는 실제로 응답하지 않으므로 원격 호출 전 검증과 헬스 체크만 확인한다.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Coordinator Service 통합 테스트")
class CoordinatorServiceIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("미등록 참가자 요청은 원격 호출 없이 400 UNKNOWN_PARTICIPANT")
    void scheduleMatch_UnknownParticipant() throws Exception {
        mockMvc.perform(post("/v1/coordination/schedule-match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"participantIds\": [\"alice\", \"ghost\"], \"durationMinutes\": 60}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("UNKNOWN_PARTICIPANT"));
    }

    @Test
    @DisplayName("탐색 구간보다 긴 약속은 400 INVALID_RANGE")
    void scheduleMatch_DurationTooLong() throws Exception {
        mockMvc.perform(post("/v1/coordination/schedule-match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"participantIds": ["alice", "bob"], "durationMinutes": 120,
                                 "dayWindowStart": "09:00", "dayWindowEnd": "10:00"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_RANGE"));
    }

    @Test
    @DisplayName("응답하지 않는 참가자는 offline, 전체 상태 not_ready")
    void health_ParticipantsOffline() throws Exception {
        mockMvc.perform(get("/v1/coordination/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.coordinator").value("online"))
                .andExpect(jsonPath("$.participants.alice").value("offline"))
                .andExpect(jsonPath("$.participants.bob").value("offline"))
                .andExpect(jsonPath("$.allSystems").value("not_ready"));
    }
}
