package com.matchsync.coordinator.health;

import com.matchsync.coordinator.participant.RegisteredParticipant;
import com.matchsync.coordinator.participant.client.ParticipantClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthProbe 테스트")
class HealthProbeTest {

    private static final RegisteredParticipant ALICE = new RegisteredParticipant("alice", "http://alice.test");
    private static final RegisteredParticipant BOB = new RegisteredParticipant("bob", "http://bob.test");
    private static final RegisteredParticipant CAROL = new RegisteredParticipant("carol", "http://carol.test");

    @Mock
    private ParticipantClient participantClient;

    private ExecutorService executor;
    private HealthProbe healthProbe;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        healthProbe = new HealthProbe(participantClient, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("참가자별 상태를 요청 순서대로 반환")
    void probeAll() {
        // given
        given(participantClient.isOnline(ALICE)).willReturn(true);
        given(participantClient.isOnline(BOB)).willReturn(false);
        given(participantClient.isOnline(CAROL)).willThrow(new IllegalStateException("boom"));

        // when
        Map<String, ProbeStatus> statuses = healthProbe.probeAll(List.of(ALICE, BOB, CAROL), Duration.ofSeconds(2));

        // then
        assertThat(statuses).containsExactly(
                entry("alice", ProbeStatus.ONLINE),
                entry("bob", ProbeStatus.OFFLINE),
                entry("carol", ProbeStatus.OFFLINE));
    }

    @Test
    @DisplayName("제한 시간 안에 응답하지 않으면 OFFLINE")
    void probe_timeout() {
        // given
        given(participantClient.isOnline(ALICE)).willAnswer(invocation -> {
            Thread.sleep(2_000);
            return true;
        });

        // when
        ProbeStatus status = healthProbe.probe(ALICE, Duration.ofMillis(100));

        // then
        assertThat(status).isEqualTo(ProbeStatus.OFFLINE);
    }
}
