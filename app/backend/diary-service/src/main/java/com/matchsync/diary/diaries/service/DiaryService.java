package com.matchsync.diary.diaries.service;

import com.matchsync.diary.common.config.DiaryProperties;
import com.matchsync.diary.diaries.dto.ParticipantSummaryResponse;
import com.matchsync.diary.diaries.exception.DateNotInDiaryException;
import com.matchsync.diary.diaries.store.DiaryStore;
import com.matchsync.diary.diaries.store.UpsertResult;
import com.matchsync.shared.diary.Appointment;
import com.matchsync.shared.diary.AvailabilityEngine;
import com.matchsync.shared.diary.AvailabilityResult;
import com.matchsync.shared.diary.Diary;
import com.matchsync.shared.diary.TimeRange;
import com.matchsync.shared.dto.participant.AvailabilityResponse;
import com.matchsync.shared.dto.participant.BookingResponse;
import com.matchsync.shared.dto.participant.BookingStatus;
import com.matchsync.shared.dto.participant.CancelRequest;
import com.matchsync.shared.dto.participant.CancellationResponse;
import com.matchsync.shared.dto.participant.CancellationStatus;
import com.matchsync.shared.dto.participant.HealthResponse;
import com.matchsync.shared.dto.participant.SlotRequest;
import com.matchsync.shared.security.ServiceAuthValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class DiaryService {

    private final DiaryStore diaryStore;
    private final AvailabilityEngine availabilityEngine;
    private final ServiceAuthValidator serviceAuthValidator;
    private final DiaryProperties diaryProperties;

    public List<ParticipantSummaryResponse> getParticipants() {
        return diaryStore.templates().stream()
                .map(ParticipantSummaryResponse::from)
                .toList();
    }

    public Diary getDiary(String participantId) {
        return diaryStore.getDiary(participantId);
    }

    /**
     * 가용성 확인 (읽기 전용, 결과는 요청 시점 기준)
     */
    public AvailabilityResponse checkAvailability(String participantId, SlotRequest request) {
        TimeRange window = request.toTimeRange();
        Diary diary = diaryStore.getDiary(participantId);
        if (!diary.covers(request.getDate())) {
            throw new DateNotInDiaryException(String.format(
                    "다이어리에 없는 날짜입니다: participantId=%s, date=%s", participantId, request.getDate()));
        }

        AvailabilityResult result = availabilityEngine.isFree(diary, request.getDate(), window);

        String reason = null;
        if (result.isOutsideDayBounds()) {
            reason = "하루 범위(" + diary.getDayBounds() + ")를 벗어난 구간입니다";
        } else if (!result.isFree()) {
            reason = "'" + result.getConflictingAppointment().getLabel() + "' 약속과 겹칩니다";
        }

        log.debug("가용성 확인 - participantId: {}, date: {}, window: {}, free: {}",
                participantId, request.getDate(), window, result.isFree());

        return AvailabilityResponse.builder()
                .participantId(participantId)
                .date(request.getDate())
                .free(result.isFree())
                .conflict(result.getConflictingAppointment())
                .reason(reason)
                .build();
    }

    /**
     * 예약 (BOOKED 약속 추가)
     *
     * 같은 reference로 재요청하면 새로 추가하지 않고 booked를 돌려준다.
     */
    public BookingResponse book(String participantId, SlotRequest request) {
        String label = request.getLabel() != null && !request.getLabel().isBlank()
                ? request.getLabel()
                : diaryProperties.getDefaultBookingLabel();
        Appointment appointment = Appointment.booked(request.toTimeRange(), label, request.getReference());

        UpsertResult result = diaryStore.upsertAppointment(participantId, request.getDate(), appointment);

        if (!result.isBooked()) {
            Appointment conflict = result.getConflict();
            return BookingResponse.builder()
                    .participantId(participantId)
                    .status(BookingStatus.CONFLICT)
                    .conflict(conflict)
                    .message(conflict != null
                            ? "'" + conflict.getLabel() + "' 약속과 겹칩니다"
                            : "예약할 수 없는 시간입니다")
                    .build();
        }

        return BookingResponse.builder()
                .participantId(participantId)
                .status(BookingStatus.BOOKED)
                .appointment(result.getAppointment())
                .build();
    }

    public CancellationResponse cancel(String participantId, CancelRequest request) {
        Optional<Appointment> removed = diaryStore.cancelAppointment(
                participantId, request.getDate(), request.toTimeRange(), request.getReference());

        if (removed.isEmpty()) {
            log.info("취소할 예약 없음 - participantId: {}, date: {}, range: {}-{}",
                    participantId, request.getDate(), request.getStart(), request.getEnd());
            return CancellationResponse.builder()
                    .participantId(participantId)
                    .status(CancellationStatus.NOT_FOUND)
                    .message("일치하는 예약이 없습니다")
                    .build();
        }

        return CancellationResponse.builder()
                .participantId(participantId)
                .status(CancellationStatus.CANCELLED)
                .build();
    }

    /**
     * 다이어리를 기본 템플릿으로 초기화 (관리 API Key 필요)
     */
    public Diary reset(String participantId, String apiKey) {
        String caller = serviceAuthValidator.validateAndGetCaller(apiKey);
        log.info("다이어리 초기화 요청 - participantId: {}, caller: {}", participantId, caller);
        return diaryStore.reset(participantId);
    }

    public HealthResponse health(String participantId) {
        // 존재하지 않는 참가자는 404
        diaryStore.getTemplate(participantId);
        return HealthResponse.builder()
                .participantId(participantId)
                .status(HealthResponse.ONLINE)
                .build();
    }
}
