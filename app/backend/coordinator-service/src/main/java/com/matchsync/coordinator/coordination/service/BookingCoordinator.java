package com.matchsync.coordinator.coordination.service;

import com.matchsync.coordinator.common.config.CoordinationConfig;
import com.matchsync.coordinator.common.config.CoordinationProperties;
import com.matchsync.coordinator.common.exception.InvalidCoordinationRequestException;
import com.matchsync.coordinator.coordination.algorithm.CandidateSlot;
import com.matchsync.coordinator.coordination.algorithm.CandidateWindowGenerator;
import com.matchsync.coordinator.coordination.algorithm.SlotIntersector;
import com.matchsync.coordinator.coordination.dto.ParticipantResultDto;
import com.matchsync.coordinator.coordination.dto.ScheduleMatchRequest;
import com.matchsync.coordinator.coordination.dto.ScheduleMatchResponse;
import com.matchsync.coordinator.coordination.dto.SlotDto;
import com.matchsync.coordinator.coordination.model.CoordinationRun;
import com.matchsync.coordinator.coordination.model.CoordinationState;
import com.matchsync.coordinator.coordination.model.CoordinationStatus;
import com.matchsync.coordinator.coordination.model.OutcomeReason;
import com.matchsync.coordinator.coordination.model.ParticipantRunState;
import com.matchsync.coordinator.coordination.selection.SelectionResult;
import com.matchsync.coordinator.coordination.selection.SlotSelector;
import com.matchsync.coordinator.health.HealthProbe;
import com.matchsync.coordinator.health.ProbeStatus;
import com.matchsync.coordinator.participant.ParticipantRegistry;
import com.matchsync.coordinator.participant.RegisteredParticipant;
import com.matchsync.coordinator.participant.client.BookingOutcome;
import com.matchsync.coordinator.participant.client.CancellationOutcome;
import com.matchsync.coordinator.participant.client.ParticipantClient;
import com.matchsync.shared.diary.Diary;
import com.matchsync.shared.diary.TimeRange;
import com.matchsync.shared.diary.exception.InvalidRangeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * 다자간 약속 조율 (사가 방식 예약)
 *
 * 1. 요청 검증 (원격 호출 전에 실패)
 * 2. 헬스 체크 - 하나라도 offline이면 중단
 * 3. 다이어리 병렬 조회 - 하나라도 실패하면 중단 (일부 다이어리로 교집합을 구하지 않음)
 * 4. 참가자별 빈 슬롯 계산 → 교집합 → 슬롯 선택
 * 5. 모든 참가자에게 병렬 예약
 * 6. 일부만 성공하면 성공한 참가자에게 보상 취소 (재시도 최대 1회)
 *
 * 원격 호출 실패는 예외로 전파하지 않고 응답의 status/reason/perParticipant로 전달한다.
 */
@Service
@Slf4j
public class BookingCoordinator {

    private static final int MAX_COMPENSATION_ATTEMPTS = 2;

    private final ParticipantRegistry participantRegistry;
    private final ParticipantClient participantClient;
    private final HealthProbe healthProbe;
    private final CandidateWindowGenerator windowGenerator;
    private final SlotIntersector slotIntersector;
    private final SlotSelector slotSelector;
    private final CoordinationProperties properties;
    private final ExecutorService executor;
    private final Clock clock;

    public BookingCoordinator(
            ParticipantRegistry participantRegistry,
            ParticipantClient participantClient,
            HealthProbe healthProbe,
            CandidateWindowGenerator windowGenerator,
            SlotIntersector slotIntersector,
            SlotSelector slotSelector,
            CoordinationProperties properties,
            @Qualifier(CoordinationConfig.COORDINATION_EXECUTOR) ExecutorService executor,
            Clock clock
    ) {
        this.participantRegistry = participantRegistry;
        this.participantClient = participantClient;
        this.healthProbe = healthProbe;
        this.windowGenerator = windowGenerator;
        this.slotIntersector = slotIntersector;
        this.slotSelector = slotSelector;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    public ScheduleMatchResponse scheduleMatch(ScheduleMatchRequest request) {
        MatchPlan plan = plan(request);
        CoordinationRun run = new CoordinationRun(UUID.randomUUID().toString(), plan.participantIds());
        RunDeadline deadline = RunDeadline.after(properties.getRunTimeout());

        log.info("조율 시작 - runId: {}, participants: {}, 기간: {} ~ {}, 후보 구간 수: {}, strategy: {}",
                run.getRunId(), plan.participantIds(), plan.getSearchDates().get(0),
                plan.getSearchDates().get(plan.getSearchDates().size() - 1), plan.getWindows().size(), plan.getStrategy());

        execute(run, plan, deadline);

        log.info("조율 종료 - runId: {}, status: {}, reason: {}, slot: {}",
                run.getRunId(), run.getStatus().getWireValue(),
                run.getReason() != null ? run.getReason().getWireValue() : null, run.getSelectedSlot());
        return toResponse(run);
    }

    // =======================================================================
    // 요청 검증
    // =======================================================================

    MatchPlan plan(ScheduleMatchRequest request) {
        List<String> participantIds = request.getParticipantIds();
        if (participantIds == null || participantIds.isEmpty()) {
            throw new InvalidCoordinationRequestException("참가자 목록은 필수입니다");
        }
        if (participantIds.stream().anyMatch(id -> id == null || id.isBlank())) {
            throw new InvalidCoordinationRequestException("참가자 ID는 비어있을 수 없습니다");
        }
        if (new HashSet<>(participantIds).size() != participantIds.size()) {
            throw new InvalidCoordinationRequestException("참가자 ID가 중복되었습니다: " + participantIds);
        }

        if (request.getDurationMinutes() == null || request.getDurationMinutes() <= 0) {
            throw new InvalidRangeException("약속 길이는 1분 이상이어야 합니다: " + request.getDurationMinutes());
        }

        int searchDays = request.getSearchDays() != null ? request.getSearchDays() : properties.getDefaultSearchDays();
        if (searchDays < 1 || searchDays > 31) {
            throw new InvalidCoordinationRequestException("탐색 일수는 1~31이어야 합니다: " + searchDays);
        }

        int granularity = request.getGranularityMinutes() != null
                ? request.getGranularityMinutes()
                : properties.getDefaultGranularityMinutes();

        String strategy = request.getStrategy() != null && !request.getStrategy().isBlank()
                ? request.getStrategy()
                : properties.getDefaultStrategy();
        if (!slotSelector.supports(strategy)) {
            throw new InvalidCoordinationRequestException(
                    "알 수 없는 선택 전략: " + strategy + " (지원: " + slotSelector.strategyNames() + ")");
        }

        LocalTime dayStart = request.getDayWindowStart() != null
                ? request.getDayWindowStart()
                : LocalTime.parse(properties.getDefaultDayWindowStart());
        LocalTime dayEnd = request.getDayWindowEnd() != null
                ? request.getDayWindowEnd()
                : LocalTime.parse(properties.getDefaultDayWindowEnd());

        // 구간 역전, 길이 초과, 간격 오류는 InvalidRangeException
        List<TimeRange> windows = windowGenerator.generateWindows(
                dayStart, dayEnd, request.getDurationMinutes(), granularity);

        List<RegisteredParticipant> participants = participantRegistry.resolve(participantIds);

        LocalDate startDate = request.getStartDate() != null ? request.getStartDate() : LocalDate.now(clock);
        List<LocalDate> searchDates = new ArrayList<>();
        for (int i = 0; i < searchDays; i++) {
            searchDates.add(startDate.plusDays(i));
        }

        String label = request.getLabel() != null && !request.getLabel().isBlank()
                ? request.getLabel()
                : properties.getDefaultLabel();

        return MatchPlan.builder()
                .participants(participants)
                .searchDates(searchDates)
                .windows(windows)
                .label(label)
                .strategy(strategy)
                .build();
    }

    // =======================================================================
    // 실행
    // =======================================================================

    private void execute(CoordinationRun run, MatchPlan plan, RunDeadline deadline) {
        List<RegisteredParticipant> participants = plan.getParticipants();

        // 1. 헬스 체크
        run.transitionTo(CoordinationState.HEALTH_CHECKING);
        if (deadline.isExpired()) {
            run.finish(CoordinationStatus.ABORTED, OutcomeReason.TIMEOUT);
            return;
        }
        Map<String, ProbeStatus> health = healthProbe.probeAll(participants, deadline.clamp(properties.getHealthTimeout()));
        boolean allOnline = true;
        for (Map.Entry<String, ProbeStatus> entry : health.entrySet()) {
            if (entry.getValue() != ProbeStatus.ONLINE) {
                run.participant(entry.getKey()).markFailed(BookingOutcome.Result.UNREACHABLE.name());
                allOnline = false;
            }
        }
        if (!allOnline) {
            log.warn("조율 중단 - runId: {}, offline 참가자 있음: {}", run.getRunId(), health);
            run.finish(CoordinationStatus.ABORTED,
                    deadline.isExpired() ? OutcomeReason.TIMEOUT : OutcomeReason.PARTICIPANT_UNAVAILABLE);
            return;
        }

        // 2. 다이어리 조회
        run.transitionTo(CoordinationState.FETCHING_DIARIES);
        if (deadline.isExpired()) {
            run.finish(CoordinationStatus.ABORTED, OutcomeReason.TIMEOUT);
            return;
        }
        Map<String, CompletableFuture<Diary>> fetches =
                fanOut(participants, participantClient::getDiary, deadline.clamp(properties.getFetchTimeout()));
        Map<String, Diary> diaries = new LinkedHashMap<>();
        fetches.forEach((participantId, future) -> {
            try {
                diaries.put(participantId, future.join());
            } catch (CompletionException e) {
                log.warn("다이어리 조회 실패 - runId: {}, participantId: {}, timeout: {}",
                        run.getRunId(), participantId, isTimeout(e));
                run.participant(participantId).markFailed(BookingOutcome.Result.UNREACHABLE.name());
            }
        });
        if (diaries.size() < participants.size()) {
            run.finish(CoordinationStatus.ABORTED,
                    deadline.isExpired() ? OutcomeReason.TIMEOUT : OutcomeReason.DIARY_FETCH_FAILED);
            return;
        }

        // 3. 참가자별 빈 슬롯 계산
        run.transitionTo(CoordinationState.COMPUTING_AVAILABILITY);
        Map<String, SortedSet<CandidateSlot>> freeSlots = new LinkedHashMap<>();
        diaries.forEach((participantId, diary) -> {
            SortedSet<CandidateSlot> free = windowGenerator.freeSlots(diary, plan.getSearchDates(), plan.getWindows());
            run.participant(participantId).recordFreeSlots(free.size());
            freeSlots.put(participantId, free);
        });

        // 4. 교집합
        run.transitionTo(CoordinationState.INTERSECTING);
        List<CandidateSlot> candidates = slotIntersector.intersect(freeSlots);
        run.recordCandidates(candidates);
        log.debug("공통 슬롯 - runId: {}, 후보 수: {}", run.getRunId(), candidates.size());
        if (candidates.isEmpty()) {
            log.info("공통 빈 시간 없음 - runId: {}", run.getRunId());
            run.finish(CoordinationStatus.ABORTED, OutcomeReason.NO_COMMON_SLOT);
            return;
        }

        // 5. 슬롯 선택
        run.transitionTo(CoordinationState.SELECTING);
        if (deadline.isExpired()) {
            run.finish(CoordinationStatus.ABORTED, OutcomeReason.TIMEOUT);
            return;
        }
        SelectionResult selection = slotSelector.select(
                candidates, plan.getStrategy(), deadline.clamp(properties.getRankingTimeout()));
        run.recordSelection(selection);
        if (deadline.isExpired()) {
            run.finish(CoordinationStatus.ABORTED, OutcomeReason.TIMEOUT);
            return;
        }

        // 6. 예약
        run.transitionTo(CoordinationState.COMMITTING);
        commit(run, plan, selection.getSlot(), deadline);
    }

    private void commit(CoordinationRun run, MatchPlan plan, CandidateSlot slot, RunDeadline deadline) {
        List<RegisteredParticipant> participants = plan.getParticipants();
        Map<String, CompletableFuture<BookingOutcome>> bookings = fanOut(
                participants,
                participant -> participantClient.book(
                        participant, slot.getDate(), slot.getTimeRange(), plan.getLabel(), run.getRunId()),
                deadline.clamp(properties.getBookingTimeout()));

        List<RegisteredParticipant> committed = new ArrayList<>();
        List<RegisteredParticipant> inDoubt = new ArrayList<>();
        OutcomeReason firstFailure = null;
        boolean anyTimeout = false;

        for (RegisteredParticipant participant : participants) {
            ParticipantRunState state = run.participant(participant.getId());
            BookingOutcome outcome;
            try {
                outcome = bookings.get(participant.getId()).join();
            } catch (CompletionException e) {
                boolean timeout = isTimeout(e);
                anyTimeout |= timeout;
                outcome = timeout
                        ? BookingOutcome.of(BookingOutcome.Result.UNREACHABLE, "예약 응답 시간 초과")
                        : BookingOutcome.of(BookingOutcome.Result.ERROR, causeMessage(e));
            }

            if (outcome.isBooked()) {
                state.markCommitted();
                committed.add(participant);
            } else {
                log.warn("예약 실패 - runId: {}, participantId: {}, result: {}, message: {}",
                        run.getRunId(), participant.getId(), outcome.getResult(), outcome.getMessage());
                if (outcome.getResult() == BookingOutcome.Result.UNREACHABLE) {
                    state.markInDoubt(outcome.getResult().name());
                    inDoubt.add(participant);
                } else {
                    state.markFailed(outcome.getResult().name());
                }
                if (firstFailure == null) {
                    firstFailure = reasonFor(outcome.getResult());
                }
            }
        }

        boolean runTimedOut = anyTimeout && deadline.isExpired();

        if (committed.size() == participants.size()) {
            run.finish(CoordinationStatus.COMMITTED, null);
            return;
        }

        // 응답 없이 끝난 예약은 늦게 반영될 수 있으므로 확정된 예약과 함께 취소한다.
        List<RegisteredParticipant> toCompensate = new ArrayList<>(committed);
        toCompensate.addAll(inDoubt);
        if (!toCompensate.isEmpty()) {
            compensate(run, toCompensate, slot);
        }

        if (committed.isEmpty()) {
            run.finish(CoordinationStatus.ABORTED, runTimedOut ? OutcomeReason.TIMEOUT : OutcomeReason.BOOKING_FAILED);
            return;
        }
        run.finish(CoordinationStatus.PARTIALLY_FAILED, runTimedOut ? OutcomeReason.TIMEOUT : firstFailure);
    }

    /**
     * 예약에 성공했거나 예약 여부를 알 수 없는 참가자의 예약을 취소한다.
     *
     * 취소에는 runId가 reference로 실리므로 여러 번 보내도 안전하고, not_found도 롤백으로 본다.
     *
     * 취소 API가 없거나 재시도 후에도 실패하면 compensation_failed로 남긴다. (운영자 확인 필요)
     */
    private void compensate(CoordinationRun run, List<RegisteredParticipant> targets, CandidateSlot slot) {
        log.warn("보상 취소 시작 - runId: {}, 대상: {}",
                run.getRunId(), targets.stream().map(RegisteredParticipant::getId).toList());

        List<RegisteredParticipant> pending = targets;
        for (int attempt = 1; attempt <= MAX_COMPENSATION_ATTEMPTS && !pending.isEmpty(); attempt++) {
            Map<String, CompletableFuture<CancellationOutcome>> cancellations = fanOut(
                    pending,
                    participant -> participantClient.cancel(
                            participant, slot.getDate(), slot.getTimeRange(), run.getRunId()),
                    properties.getCompensationTimeout());

            List<RegisteredParticipant> retry = new ArrayList<>();
            for (RegisteredParticipant participant : pending) {
                ParticipantRunState state = run.participant(participant.getId());
                state.recordCompensationAttempt();

                CancellationOutcome outcome;
                try {
                    outcome = cancellations.get(participant.getId()).join();
                } catch (CompletionException e) {
                    outcome = isTimeout(e)
                            ? CancellationOutcome.of(CancellationOutcome.Result.UNREACHABLE, "취소 응답 시간 초과")
                            : CancellationOutcome.of(CancellationOutcome.Result.ERROR, causeMessage(e));
                }

                CancellationOutcome.Result result = outcome.getResult();
                if (result.isRolledBack()) {
                    state.markRolledBack(result.name());
                    log.info("보상 취소 완료 - runId: {}, participantId: {}, result: {}",
                            run.getRunId(), participant.getId(), result);
                } else if (result.isRetryable() && attempt < MAX_COMPENSATION_ATTEMPTS) {
                    log.warn("보상 취소 실패, 재시도 - runId: {}, participantId: {}, result: {}",
                            run.getRunId(), participant.getId(), result);
                    retry.add(participant);
                } else {
                    state.markCompensationFailed(result.name());
                    log.error("보상 취소 실패 - 수동 확인 필요 - runId: {}, participantId: {}, slot: {}, result: {}, message: {}",
                            run.getRunId(), participant.getId(), slot, result, outcome.getMessage());
                }
            }
            pending = retry;
        }
    }

    // =======================================================================
    // 공통
    // =======================================================================

    private <T> Map<String, CompletableFuture<T>> fanOut(
            List<RegisteredParticipant> participants,
            Function<RegisteredParticipant, T> call,
            Duration timeout
    ) {
        // 올림: 남은 시간으로 잘린 타임아웃이 전체 마감보다 먼저 끝나지 않도록
        long timeoutMillis = Math.max((timeout.toNanos() + 999_999) / 1_000_000, 1);
        Map<String, CompletableFuture<T>> futures = new LinkedHashMap<>();
        for (RegisteredParticipant participant : participants) {
            futures.put(participant.getId(), CompletableFuture
                    .supplyAsync(() -> call.apply(participant), executor)
                    .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS));
        }
        return futures;
    }

    private static boolean isTimeout(CompletionException e) {
        return e.getCause() instanceof TimeoutException;
    }

    private static String causeMessage(CompletionException e) {
        return e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
    }

    private static OutcomeReason reasonFor(BookingOutcome.Result result) {
        return switch (result) {
            case CONFLICT -> OutcomeReason.CONFLICT;
            case UNREACHABLE -> OutcomeReason.UNREACHABLE;
            default -> OutcomeReason.BOOKING_FAILED;
        };
    }

    private ScheduleMatchResponse toResponse(CoordinationRun run) {
        Map<String, ParticipantResultDto> perParticipant = new LinkedHashMap<>();
        run.getParticipants().forEach((id, state) -> perParticipant.put(id, ParticipantResultDto.from(state)));

        boolean attempted = run.getStatus() != CoordinationStatus.ABORTED;
        SelectionResult selection = run.getSelection();

        return ScheduleMatchResponse.builder()
                .runId(run.getRunId())
                .status(run.getStatus())
                .reason(run.getReason())
                .selectedSlot(attempted && run.getSelectedSlot() != null ? SlotDto.from(run.getSelectedSlot()) : null)
                .candidatesFound(run.getCandidates().size())
                .candidates(run.getCandidates().stream().map(SlotDto::from).toList())
                .strategy(selection != null ? selection.getStrategy() : null)
                .finalState(run.getTerminalState())
                .perParticipant(perParticipant)
                .build();
    }
}
