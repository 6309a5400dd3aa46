package com.matchsync.coordinator.coordination.service;

import com.matchsync.coordinator.common.config.CoordinationProperties;
import com.matchsync.coordinator.common.exception.InvalidCoordinationRequestException;
import com.matchsync.coordinator.common.exception.UnknownParticipantException;
import com.matchsync.coordinator.coordination.algorithm.CandidateWindowGenerator;
import com.matchsync.coordinator.coordination.algorithm.SlotIntersector;
import com.matchsync.coordinator.coordination.dto.ScheduleMatchRequest;
import com.matchsync.coordinator.coordination.dto.ScheduleMatchResponse;
import com.matchsync.coordinator.coordination.dto.SlotDto;
import com.matchsync.coordinator.coordination.model.CoordinationState;
import com.matchsync.coordinator.coordination.model.CoordinationStatus;
import com.matchsync.coordinator.coordination.model.OutcomeReason;
import com.matchsync.coordinator.coordination.model.ParticipantBookingStatus;
import com.matchsync.coordinator.coordination.selection.EarliestFirstStrategy;
import com.matchsync.coordinator.coordination.selection.PreferAfternoonStrategy;
import com.matchsync.coordinator.coordination.selection.SlotSelector;
import com.matchsync.coordinator.health.HealthProbe;
import com.matchsync.coordinator.participant.ParticipantRegistry;
import com.matchsync.coordinator.participant.RegisteredParticipant;
import com.matchsync.coordinator.participant.client.BookingOutcome;
import com.matchsync.coordinator.participant.client.CancellationOutcome;
import com.matchsync.coordinator.participant.client.ParticipantClient;
import com.matchsync.coordinator.participant.client.ParticipantUnreachableException;
import com.matchsync.shared.diary.Appointment;
import com.matchsync.shared.diary.AppointmentKind;
import com.matchsync.shared.diary.AvailabilityEngine;
import com.matchsync.shared.diary.Diary;
import com.matchsync.shared.diary.TimeRange;
import com.matchsync.shared.diary.exception.InvalidRangeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("BookingCoordinator 테스트")
class BookingCoordinatorTest {

    private static final LocalDate DATE = LocalDate.of(2026, 1, 21);
    private static final TimeRange DAY_BOUNDS = range("08:00", "19:00");

    private static final RegisteredParticipant ALICE = new RegisteredParticipant("alice", "http://alice.test");
    private static final RegisteredParticipant BOB = new RegisteredParticipant("bob", "http://bob.test");

    @Mock
    private ParticipantClient participantClient;

    private ExecutorService executor;
    private CoordinationProperties properties;
    private BookingCoordinator bookingCoordinator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);

        properties = new CoordinationProperties();
        Map<String, CoordinationProperties.ParticipantEndpoint> endpoints = new LinkedHashMap<>();
        endpoints.put("alice", endpoint("http://alice.test"));
        endpoints.put("bob", endpoint("http://bob.test/"));
        properties.setParticipants(endpoints);
        properties.setHealthTimeout(Duration.ofSeconds(1));
        properties.setFetchTimeout(Duration.ofSeconds(1));
        properties.setBookingTimeout(Duration.ofSeconds(1));
        properties.setCompensationTimeout(Duration.ofSeconds(1));
        properties.setRankingTimeout(Duration.ofSeconds(1));
        properties.setRunTimeout(Duration.ofSeconds(10));

        CandidateWindowGenerator windowGenerator = new CandidateWindowGenerator(new AvailabilityEngine());
        SlotSelector slotSelector = new SlotSelector(
                List.of(new EarliestFirstStrategy(), new PreferAfternoonStrategy()), executor);

        bookingCoordinator = new BookingCoordinator(
                new ParticipantRegistry(properties),
                participantClient,
                new HealthProbe(participantClient, executor),
                windowGenerator,
                new SlotIntersector(),
                slotSelector,
                properties,
                executor,
                Clock.fixed(DATE.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC));

        given(participantClient.isOnline(any())).willReturn(true);
        given(participantClient.book(any(), any(), any(), anyString(), anyString())).willReturn(BookingOutcome.booked());
        given(participantClient.cancel(any(), any(), any(), anyString()))
                .willReturn(CancellationOutcome.of(CancellationOutcome.Result.CANCELLED, null));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ==================== 정상 예약 ====================

    @Nested
    @DisplayName("모든 참가자 예약 성공")
    class Committed {

        @BeforeEach
        void setUp() {
            givenDiary(ALICE, Map.of(DATE, List.of(fixed("10:00", "12:00"))));
            givenDiary(BOB, Map.of(DATE, List.of(fixed("10:00", "12:00"))));
        }

        @Test
        @DisplayName("earliest 전략이면 08:00-10:00 예약, 후보 7개")
        void earliest() {
            // when
            ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request("earliest"));

            // then
            assertThat(response.getStatus()).isEqualTo(CoordinationStatus.COMMITTED);
            assertThat(response.getReason()).isNull();
            assertThat(response.getFinalState()).isEqualTo(CoordinationState.COMMITTED);
            assertThat(response.getCandidatesFound()).isEqualTo(7);
            assertThat(response.getCandidates()).extracting(SlotDto::getStart)
                    .containsExactly(time("08:00"), time("12:00"), time("13:00"), time("14:00"),
                            time("15:00"), time("16:00"), time("17:00"));
            assertThat(response.getSelectedSlot().getStart()).isEqualTo(time("08:00"));
            assertThat(response.getSelectedSlot().getEnd()).isEqualTo(time("10:00"));
            assertThat(response.getStrategy()).isEqualTo("earliest");
            assertThat(response.getPerParticipant().values())
                    .allSatisfy(result -> {
                        assertThat(result.getBookingStatus()).isEqualTo(ParticipantBookingStatus.COMMITTED);
                        assertThat(result.getFreeSlots()).isEqualTo(7);
                    });

            then(participantClient).should()
                    .book(ALICE, DATE, range("08:00", "10:00"), "Sync", response.getRunId());
            then(participantClient).should()
                    .book(BOB, DATE, range("08:00", "10:00"), "Sync", response.getRunId());
            then(participantClient).should(never()).cancel(any(), any(), any(), anyString());
        }

        @Test
        @DisplayName("afternoon 전략이면 13:00-15:00 예약")
        void afternoon() {
            // when
            ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request("afternoon"));

            // then
            assertThat(response.getStatus()).isEqualTo(CoordinationStatus.COMMITTED);
            assertThat(response.getSelectedSlot().getStart()).isEqualTo(time("13:00"));
            assertThat(response.getSelectedSlot().getEnd()).isEqualTo(time("15:00"));
        }

        @Test
        @DisplayName("label이 없으면 기본 설명으로 예약")
        void defaultLabel() {
            // given
            ScheduleMatchRequest request = request("earliest");
            request.setLabel(null);

            // when
            bookingCoordinator.scheduleMatch(request);

            // then
            then(participantClient).should()
                    .book(eq(ALICE), eq(DATE), any(), eq(properties.getDefaultLabel()), anyString());
        }
    }

    @Test
    @DisplayName("하루가 꽉 찬 날은 제외하고 다른 날의 공통 슬롯 예약")
    void multiDay() {
        // given
        LocalDate nextDay = DATE.plusDays(1);
        givenDiary(ALICE, Map.of(DATE, List.of(), nextDay, List.of()));
        givenDiary(BOB, Map.of(DATE, List.of(fixed("08:00", "19:00")), nextDay, List.of()));
        ScheduleMatchRequest request = request("earliest");
        request.setSearchDays(2);

        // when
        ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request);

        // then
        assertThat(response.getStatus()).isEqualTo(CoordinationStatus.COMMITTED);
        assertThat(response.getCandidates()).extracting(SlotDto::getDate).containsOnly(nextDay);
        assertThat(response.getSelectedSlot().getDate()).isEqualTo(nextDay);
        assertThat(response.getPerParticipant().get("bob").getFreeSlots()).isEqualTo(10);
    }

    // ==================== 중단 ====================

    @Nested
    @DisplayName("중단 (aborted)")
    class Aborted {

        @Test
        @DisplayName("공통 빈 시간이 없으면 NoCommonSlot, 예약 호출 없음")
        void noCommonSlot() {
            // given
            givenDiary(ALICE, Map.of(DATE, List.of(fixed("08:00", "19:00"))));
            givenDiary(BOB, Map.of(DATE, List.of()));

            // when
            ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request("earliest"));

            // then
            assertThat(response.getStatus()).isEqualTo(CoordinationStatus.ABORTED);
            assertThat(response.getReason()).isEqualTo(OutcomeReason.NO_COMMON_SLOT);
            assertThat(response.getFinalState()).isEqualTo(CoordinationState.ABORTED);
            assertThat(response.getCandidatesFound()).isZero();
            assertThat(response.getSelectedSlot()).isNull();
            then(participantClient).should(never()).book(any(), any(), any(), anyString(), anyString());
        }

        @Test
        @DisplayName("offline 참가자가 있으면 ParticipantUnavailable, 다이어리 조회 안 함")
        void participantUnavailable() {
            // given
            given(participantClient.isOnline(BOB)).willReturn(false);

            // when
            ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request("earliest"));

            // then
            assertThat(response.getStatus()).isEqualTo(CoordinationStatus.ABORTED);
            assertThat(response.getReason()).isEqualTo(OutcomeReason.PARTICIPANT_UNAVAILABLE);
            assertThat(response.getPerParticipant().get("bob").getBookingStatus())
                    .isEqualTo(ParticipantBookingStatus.FAILED);
            assertThat(response.getPerParticipant().get("bob").getDetail()).isEqualTo("UNREACHABLE");
            assertThat(response.getPerParticipant().get("alice").getBookingStatus())
                    .isEqualTo(ParticipantBookingStatus.PENDING);
            then(participantClient).should(never()).getDiary(any());
        }

        @Test
        @DisplayName("다이어리 조회 실패면 DiaryFetchFailed, 일부 다이어리로 진행하지 않음")
        void diaryFetchFailed() {
            // given
            givenDiary(ALICE, Map.of(DATE, List.of()));
            given(participantClient.getDiary(BOB)).willThrow(new ParticipantUnreachableException("bob down"));

            // when
            ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request("earliest"));

            // then
            assertThat(response.getStatus()).isEqualTo(CoordinationStatus.ABORTED);
            assertThat(response.getReason()).isEqualTo(OutcomeReason.DIARY_FETCH_FAILED);
            assertThat(response.getPerParticipant().get("bob").getDetail()).isEqualTo("UNREACHABLE");
            then(participantClient).should(never()).book(any(), any(), any(), anyString(), anyString());
        }

        @Test
        @DisplayName("모든 예약이 실패하면 BookingFailed, 보상 없음")
        void allBookingsFailed() {
            // given
            givenDiary(ALICE, Map.of(DATE, List.of()));
            givenDiary(BOB, Map.of(DATE, List.of()));
            given(participantClient.book(any(), any(), any(), anyString(), anyString()))
                    .willReturn(BookingOutcome.of(BookingOutcome.Result.CONFLICT, "taken"));

            // when
            ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request("earliest"));

            // then
            assertThat(response.getStatus()).isEqualTo(CoordinationStatus.ABORTED);
            assertThat(response.getReason()).isEqualTo(OutcomeReason.BOOKING_FAILED);
            assertThat(response.getSelectedSlot()).isNull();
            then(participantClient).should(never()).cancel(any(), any(), any(), anyString());
        }

        @Test
        @DisplayName("예약 중 전체 제한 시간을 넘기면 Timeout")
        void runTimeout() {
            // given
            properties.setRunTimeout(Duration.ofMillis(500));
            givenDiary(ALICE, Map.of(DATE, List.of()));
            givenDiary(BOB, Map.of(DATE, List.of()));
            given(participantClient.book(any(), any(), any(), anyString(), anyString())).willAnswer(invocation -> {
                Thread.sleep(3_000);
                return BookingOutcome.booked();
            });

            // when
            ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request("earliest"));

            // then
            assertThat(response.getStatus()).isEqualTo(CoordinationStatus.ABORTED);
            assertThat(response.getReason()).isEqualTo(OutcomeReason.TIMEOUT);
            assertThat(response.getSelectedSlot()).isNull();
            assertThat(response.getPerParticipant().values()).allSatisfy(result -> {
                assertThat(result.getBookingStatus()).isEqualTo(ParticipantBookingStatus.ROLLED_BACK);
                assertThat(result.getCompensationAttempts()).isEqualTo(1);
            });
            then(participantClient).should()
                    .cancel(ALICE, DATE, range("08:00", "10:00"), response.getRunId());
            then(participantClient).should()
                    .cancel(BOB, DATE, range("08:00", "10:00"), response.getRunId());
        }

        @Test
        @DisplayName("응답 없는 예약의 취소도 실패하면 aborted이지만 compensation_failed로 보고")
        void inDoubtBookingNotCancelled() {
            // given
            givenDiary(ALICE, Map.of(DATE, List.of()));
            givenDiary(BOB, Map.of(DATE, List.of()));
            given(participantClient.book(any(), any(), any(), anyString(), anyString()))
                    .willReturn(BookingOutcome.of(BookingOutcome.Result.UNREACHABLE, "read timed out"));
            given(participantClient.cancel(eq(BOB), any(), any(), anyString()))
                    .willReturn(CancellationOutcome.of(CancellationOutcome.Result.UNREACHABLE, "down"));

            // when
            ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request("earliest"));

            // then
            assertThat(response.getStatus()).isEqualTo(CoordinationStatus.ABORTED);
            assertThat(response.getReason()).isEqualTo(OutcomeReason.BOOKING_FAILED);
            assertThat(response.getPerParticipant().get("alice").getBookingStatus())
                    .isEqualTo(ParticipantBookingStatus.ROLLED_BACK);
            assertThat(response.getPerParticipant().get("bob").getBookingStatus())
                    .isEqualTo(ParticipantBookingStatus.COMPENSATION_FAILED);
            assertThat(response.getPerParticipant().get("bob").getCompensationAttempts()).isEqualTo(2);
            then(participantClient).should(times(2)).cancel(eq(BOB), any(), any(), anyString());
        }
    }

    // ==================== 부분 실패 / 보상 ====================

    @Nested
    @DisplayName("부분 실패 (partially_failed)")
    class PartiallyFailed {

        @BeforeEach
        void setUp() {
            givenDiary(ALICE, Map.of(DATE, List.of()));
            givenDiary(BOB, Map.of(DATE, List.of()));
        }

        @Test
        @DisplayName("bob 충돌이면 alice 예약을 취소하고 rolled_back")
        void conflictCompensated() {
            // given
            givenBobConflict();

            // when
            ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request("earliest"));

            // then
            assertThat(response.getStatus()).isEqualTo(CoordinationStatus.PARTIALLY_FAILED);
            assertThat(response.getReason()).isEqualTo(OutcomeReason.CONFLICT);
            assertThat(response.getFinalState()).isEqualTo(CoordinationState.PARTIALLY_FAILED);
            assertThat(response.getSelectedSlot().getStart()).isEqualTo(time("08:00"));

            assertThat(response.getPerParticipant().get("alice").getBookingStatus())
                    .isEqualTo(ParticipantBookingStatus.ROLLED_BACK);
            assertThat(response.getPerParticipant().get("alice").getCompensationAttempts()).isEqualTo(1);
            assertThat(response.getPerParticipant().get("bob").getBookingStatus())
                    .isEqualTo(ParticipantBookingStatus.FAILED);
            assertThat(response.getPerParticipant().get("bob").getDetail()).isEqualTo("CONFLICT");

            then(participantClient).should()
                    .cancel(ALICE, DATE, range("08:00", "10:00"), response.getRunId());
            then(participantClient).should(never()).cancel(eq(BOB), any(), any(), anyString());
        }

        @Test
        @DisplayName("첫 취소가 실패해도 재시도로 rolled_back")
        void compensationRetried() {
            // given
            givenBobConflict();
            given(participantClient.cancel(eq(ALICE), any(), any(), anyString())).willReturn(
                    CancellationOutcome.of(CancellationOutcome.Result.ERROR, "500"),
                    CancellationOutcome.of(CancellationOutcome.Result.CANCELLED, null));

            // when
            ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request("earliest"));

            // then
            assertThat(response.getPerParticipant().get("alice").getBookingStatus())
                    .isEqualTo(ParticipantBookingStatus.ROLLED_BACK);
            assertThat(response.getPerParticipant().get("alice").getCompensationAttempts()).isEqualTo(2);
        }

        @Test
        @DisplayName("재시도 후에도 취소 실패면 compensation_failed")
        void compensationFailed() {
            // given
            givenBobConflict();
            given(participantClient.cancel(eq(ALICE), any(), any(), anyString()))
                    .willReturn(CancellationOutcome.of(CancellationOutcome.Result.UNREACHABLE, "down"));

            // when
            ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request("earliest"));

            // then
            assertThat(response.getStatus()).isEqualTo(CoordinationStatus.PARTIALLY_FAILED);
            assertThat(response.getPerParticipant().get("alice").getBookingStatus())
                    .isEqualTo(ParticipantBookingStatus.COMPENSATION_FAILED);
            assertThat(response.getPerParticipant().get("alice").getCompensationAttempts()).isEqualTo(2);
            then(participantClient).should(times(2)).cancel(eq(ALICE), any(), any(), anyString());
        }

        @Test
        @DisplayName("취소 API가 없으면 재시도 없이 compensation_failed")
        void compensationUnsupported() {
            // given
            givenBobConflict();
            given(participantClient.cancel(eq(ALICE), any(), any(), anyString()))
                    .willReturn(CancellationOutcome.of(CancellationOutcome.Result.UNSUPPORTED, "404 NOT_FOUND"));

            // when
            ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request("earliest"));

            // then
            assertThat(response.getPerParticipant().get("alice").getBookingStatus())
                    .isEqualTo(ParticipantBookingStatus.COMPENSATION_FAILED);
            assertThat(response.getPerParticipant().get("alice").getDetail()).isEqualTo("UNSUPPORTED");
            then(participantClient).should(times(1)).cancel(eq(ALICE), any(), any(), anyString());
        }

        @Test
        @DisplayName("예약 응답 시간 초과면 Unreachable, 늦게 반영될 수 있는 bob 예약까지 취소")
        void bookingTimeout() {
            // given
            properties.setBookingTimeout(Duration.ofMillis(200));
            given(participantClient.book(eq(BOB), any(), any(), anyString(), anyString())).willAnswer(invocation -> {
                Thread.sleep(600);
                return BookingOutcome.booked();
            });
            given(participantClient.cancel(eq(BOB), any(), any(), anyString()))
                    .willReturn(CancellationOutcome.of(CancellationOutcome.Result.NOT_FOUND, null));

            // when
            ScheduleMatchResponse response = bookingCoordinator.scheduleMatch(request("earliest"));

            // then
            assertThat(response.getStatus()).isEqualTo(CoordinationStatus.PARTIALLY_FAILED);
            assertThat(response.getReason()).isEqualTo(OutcomeReason.UNREACHABLE);
            assertThat(response.getPerParticipant().get("alice").getBookingStatus())
                    .isEqualTo(ParticipantBookingStatus.ROLLED_BACK);
            assertThat(response.getPerParticipant().get("bob").getBookingStatus())
                    .isEqualTo(ParticipantBookingStatus.ROLLED_BACK);
            assertThat(response.getPerParticipant().get("bob").getDetail()).isEqualTo("NOT_FOUND");
            assertThat(response.getPerParticipant().get("bob").getCompensationAttempts()).isEqualTo(1);
            then(participantClient).should()
                    .cancel(BOB, DATE, range("08:00", "10:00"), response.getRunId());
        }

        private void givenBobConflict() {
            given(participantClient.book(eq(BOB), any(), any(), anyString(), anyString()))
                    .willReturn(BookingOutcome.of(BookingOutcome.Result.CONFLICT, "taken"));
        }
    }

    // ==================== 요청 검증 ====================

    @Nested
    @DisplayName("요청 검증 - 원격 호출 전에 실패")
    class Validation {

        @Test
        @DisplayName("중복 참가자 ID")
        void duplicateParticipants() {
            // given
            ScheduleMatchRequest request = request("earliest");
            request.setParticipantIds(List.of("alice", "alice"));

            // when & then
            assertThatThrownBy(() -> bookingCoordinator.scheduleMatch(request))
                    .isInstanceOf(InvalidCoordinationRequestException.class);
            then(participantClient).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("등록되지 않은 참가자")
        void unknownParticipant() {
            // given
            ScheduleMatchRequest request = request("earliest");
            request.setParticipantIds(List.of("alice", "mallory"));

            // when & then
            assertThatThrownBy(() -> bookingCoordinator.scheduleMatch(request))
                    .isInstanceOf(UnknownParticipantException.class)
                    .hasMessageContaining("mallory");
            then(participantClient).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("약속 길이가 하루 탐색 구간보다 길면 InvalidRangeException")
        void durationLongerThanWindow() {
            // given
            ScheduleMatchRequest request = request("earliest");
            request.setDurationMinutes(12 * 60);

            // when & then
            assertThatThrownBy(() -> bookingCoordinator.scheduleMatch(request))
                    .isInstanceOf(InvalidRangeException.class);
            then(participantClient).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("약속 길이 0분은 InvalidRangeException")
        void zeroDuration() {
            // given
            ScheduleMatchRequest request = request("earliest");
            request.setDurationMinutes(0);

            // when & then
            assertThatThrownBy(() -> bookingCoordinator.scheduleMatch(request))
                    .isInstanceOf(InvalidRangeException.class);
        }

        @Test
        @DisplayName("하루 탐색 구간 역전은 InvalidRangeException")
        void invertedWindow() {
            // given
            ScheduleMatchRequest request = request("earliest");
            request.setDayWindowStart(time("19:00"));
            request.setDayWindowEnd(time("08:00"));

            // when & then
            assertThatThrownBy(() -> bookingCoordinator.scheduleMatch(request))
                    .isInstanceOf(InvalidRangeException.class);
        }

        @Test
        @DisplayName("알 수 없는 선택 전략")
        void unknownStrategy() {
            // when & then
            assertThatThrownBy(() -> bookingCoordinator.scheduleMatch(request("random")))
                    .isInstanceOf(InvalidCoordinationRequestException.class)
                    .hasMessageContaining("random");
            then(participantClient).shouldHaveNoInteractions();
        }
    }

    // ==================== 헬퍼 ====================

    private void givenDiary(RegisteredParticipant participant, Map<LocalDate, List<Appointment>> days) {
        given(participantClient.getDiary(participant)).willReturn(new Diary(participant.getId(), DAY_BOUNDS, days));
    }

    private static ScheduleMatchRequest request(String strategy) {
        return ScheduleMatchRequest.builder()
                .participantIds(List.of("alice", "bob"))
                .durationMinutes(120)
                .dayWindowStart(time("08:00"))
                .dayWindowEnd(time("19:00"))
                .searchDays(1)
                .startDate(DATE)
                .granularityMinutes(60)
                .label("Sync")
                .strategy(strategy)
                .build();
    }

    private static CoordinationProperties.ParticipantEndpoint endpoint(String baseUrl) {
        CoordinationProperties.ParticipantEndpoint endpoint = new CoordinationProperties.ParticipantEndpoint();
        endpoint.setBaseUrl(baseUrl);
        return endpoint;
    }

    private static Appointment fixed(String start, String end) {
        return Appointment.builder()
                .timeRange(range(start, end))
                .label("Busy")
                .kind(AppointmentKind.FIXED)
                .build();
    }

    private static TimeRange range(String start, String end) {
        return TimeRange.of(time(start), time(end));
    }

    private static LocalTime time(String value) {
        return LocalTime.parse(value);
    }
}
