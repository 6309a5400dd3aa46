package com.matchsync.coordinator.coordination.controller;

import com.matchsync.coordinator.coordination.dto.ScheduleMatchRequest;
import com.matchsync.coordinator.coordination.dto.ScheduleMatchResponse;
import com.matchsync.coordinator.coordination.service.BookingCoordinator;
import com.matchsync.coordinator.participant.dto.ResetParticipantsRequest;
import com.matchsync.coordinator.participant.dto.ResetParticipantsResponse;
import com.matchsync.coordinator.participant.service.ParticipantAdminService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 다자간 약속 조율 API
 */
@Tag(name = "Schedule Coordination", description = "다자간 약속 조율 API")
@RestController
@RequestMapping("/v1/coordination")
@RequiredArgsConstructor
@Slf4j
public class CoordinationController {

    private final BookingCoordinator bookingCoordinator;
    private final ParticipantAdminService participantAdminService;

    @Operation(
            summary = "공통 빈 시간 찾고 예약",
            description = "참가자들의 다이어리에서 모두가 비어있는 시간을 찾아 하나를 선택하고 모든 참가자에게 예약합니다. "
                    + "일부 참가자만 예약되면 성공한 예약을 취소(보상)하고 partially_failed를 반환합니다."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조율 완료 (committed, partially_failed, aborted 모두 200)"),
            @ApiResponse(responseCode = "400", description = "잘못된 요청 (시간 구간, 중복/미등록 참가자, 전략 등)")
    })
    @PostMapping("/schedule-match")
    public ResponseEntity<ScheduleMatchResponse> scheduleMatch(@Valid @RequestBody ScheduleMatchRequest request) {
        log.info("POST /v1/coordination/schedule-match - participants: {}, duration: {}분",
                request.getParticipantIds(), request.getDurationMinutes());

        return ResponseEntity.ok(bookingCoordinator.scheduleMatch(request));
    }

    @Operation(summary = "참가자 다이어리 초기화", description = "등록된(또는 지정한) 참가자의 다이어리를 기본 템플릿으로 되돌립니다.")
    @PostMapping("/participants/reset")
    public ResponseEntity<ResetParticipantsResponse> resetParticipants(
            @RequestBody(required = false) ResetParticipantsRequest request
    ) {
        log.info("POST /v1/coordination/participants/reset");
        return ResponseEntity.ok(participantAdminService.resetDiaries(
                request != null ? request.getParticipantIds() : null));
    }
}
