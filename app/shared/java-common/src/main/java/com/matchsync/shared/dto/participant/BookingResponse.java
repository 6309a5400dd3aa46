package com.matchsync.shared.dto.participant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.matchsync.shared.diary.Appointment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 예약 응답 DTO
 *
 * status=booked  → appointment에 저장된 예약
 * status=conflict → conflict에 예약을 막은 약속
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BookingResponse {

    private String participantId;

    private BookingStatus status;

    private Appointment appointment;

    private Appointment conflict;

    private String message;
}
