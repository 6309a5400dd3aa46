package com.matchsync.diary.diaries.controller;

import com.matchsync.diary.diaries.dto.ParticipantSummaryResponse;
import com.matchsync.diary.diaries.service.DiaryService;
import com.matchsync.shared.diary.Diary;
import com.matchsync.shared.dto.participant.AvailabilityResponse;
import com.matchsync.shared.dto.participant.BookingResponse;
import com.matchsync.shared.dto.participant.BookingStatus;
import com.matchsync.shared.dto.participant.CancelRequest;
import com.matchsync.shared.dto.participant.CancellationResponse;
import com.matchsync.shared.dto.participant.HealthResponse;
import com.matchsync.shared.dto.participant.SlotRequest;
import com.matchsync.shared.security.ServiceAuthValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 참가자 다이어리 API
 */
@Tag(name = "Participant Diary", description = "참가자 다이어리 조회/예약 API")
@RestController
@RequestMapping("/v1/participants")
@RequiredArgsConstructor
@Slf4j
public class DiaryController {

    private final DiaryService diaryService;

    @Operation(summary = "참가자 목록 조회", description = "이 서비스가 관리하는 참가자 ID와 표시 이름을 반환합니다.")
    @GetMapping
    public ResponseEntity<List<ParticipantSummaryResponse>> getParticipants() {
        return ResponseEntity.ok(diaryService.getParticipants());
    }

    @Operation(summary = "다이어리 조회", description = "참가자의 전체 다이어리 스냅샷을 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "참가자 없음")
    })
    @GetMapping("/{participantId}/diary")
    public ResponseEntity<Diary> getDiary(@PathVariable String participantId) {
        log.info("GET /v1/participants/{}/diary", participantId);
        return ResponseEntity.ok(diaryService.getDiary(participantId));
    }

    @Operation(summary = "가용성 확인", description = "해당 날짜/시간 구간에 예약 가능한지 확인합니다. 다이어리는 변경되지 않습니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "확인 성공"),
            @ApiResponse(responseCode = "400", description = "잘못된 시간 구간"),
            @ApiResponse(responseCode = "404", description = "참가자 또는 날짜 없음")
    })
    @PostMapping("/{participantId}/availability/check")
    public ResponseEntity<AvailabilityResponse> checkAvailability(
            @PathVariable String participantId,
            @Valid @RequestBody SlotRequest request
    ) {
        log.info("POST /v1/participants/{}/availability/check - date: {}, {}-{}",
                participantId, request.getDate(), request.getStart(), request.getEnd());
        return ResponseEntity.ok(diaryService.checkAvailability(participantId, request));
    }

    @Operation(summary = "예약", description = "확정/예약된 약속과 겹치지 않으면 booked 약속을 추가합니다. 같은 reference 재요청은 멱등 처리됩니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "예약 성공"),
            @ApiResponse(responseCode = "400", description = "잘못된 시간 구간"),
            @ApiResponse(responseCode = "404", description = "참가자 또는 날짜 없음"),
            @ApiResponse(responseCode = "409", description = "기존 약속과 충돌")
    })
    @PostMapping("/{participantId}/appointments/book")
    public ResponseEntity<BookingResponse> book(
            @PathVariable String participantId,
            @Valid @RequestBody SlotRequest request
    ) {
        log.info("POST /v1/participants/{}/appointments/book - date: {}, {}-{}, reference: {}",
                participantId, request.getDate(), request.getStart(), request.getEnd(), request.getReference());

        BookingResponse response = diaryService.book(participantId, request);
        if (response.getStatus() == BookingStatus.CONFLICT) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
        }
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "예약 취소", description = "같은 구간(및 reference)의 booked 약속을 제거합니다. 없으면 not_found를 반환합니다.")
    @PostMapping("/{participantId}/appointments/cancel")
    public ResponseEntity<CancellationResponse> cancel(
            @PathVariable String participantId,
            @Valid @RequestBody CancelRequest request
    ) {
        log.info("POST /v1/participants/{}/appointments/cancel - date: {}, {}-{}, reference: {}",
                participantId, request.getDate(), request.getStart(), request.getEnd(), request.getReference());
        return ResponseEntity.ok(diaryService.cancel(participantId, request));
    }

    @Operation(summary = "다이어리 초기화", description = "다이어리를 기본 템플릿으로 되돌립니다. (관리 API Key 필요)")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "초기화 성공"),
            @ApiResponse(responseCode = "401", description = "API Key 없음/불일치"),
            @ApiResponse(responseCode = "404", description = "참가자 없음")
    })
    @PostMapping("/{participantId}/diary/reset")
    public ResponseEntity<Diary> reset(
            @PathVariable String participantId,
            @Parameter(hidden = true) @RequestHeader(value = ServiceAuthValidator.API_KEY_HEADER, required = false) String apiKey
    ) {
        log.info("POST /v1/participants/{}/diary/reset", participantId);
        return ResponseEntity.ok(diaryService.reset(participantId, apiKey));
    }

    @Operation(summary = "헬스 체크")
    @GetMapping("/{participantId}/health")
    public ResponseEntity<HealthResponse> health(@PathVariable String participantId) {
        return ResponseEntity.ok(diaryService.health(participantId));
    }
}
