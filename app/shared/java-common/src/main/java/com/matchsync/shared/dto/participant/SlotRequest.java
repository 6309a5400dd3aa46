package com.matchsync.shared.dto.participant;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.matchsync.shared.diary.TimeRange;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 가용성 확인 / 예약 요청 DTO
 *
 * POST /v1/participants/{participantId}/availability/check
 * POST /v1/participants/{participantId}/appointments/book
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotRequest {

    @NotNull(message = "날짜는 필수입니다")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate date;

    @NotNull(message = "시작 시간은 필수입니다")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime start;

    @NotNull(message = "종료 시간은 필수입니다")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime end;

    @Size(max = 255, message = "약속 설명은 255자 이하여야 합니다")
    private String label;

    /**
     * 조율 실행 ID (optional). 같은 reference로 다시 예약하면 멱등 처리된다.
     */
    @Size(max = 64, message = "reference는 64자 이하여야 합니다")
    private String reference;

    public TimeRange toTimeRange() {
        return TimeRange.of(start, end);
    }
}
