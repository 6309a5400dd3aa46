package com.matchsync.shared.dto.participant;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.matchsync.shared.diary.TimeRange;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 예약 취소(보상) 요청 DTO
 *
 * POST /v1/participants/{participantId}/appointments/cancel
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancelRequest {

    @NotNull(message = "날짜는 필수입니다")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate date;

    @NotNull(message = "시작 시간은 필수입니다")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime start;

    @NotNull(message = "종료 시간은 필수입니다")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime end;

    /**
     * 취소할 예약의 조율 실행 ID (optional). 지정하면 reference가 같은 예약만 취소한다.
     */
    private String reference;

    public TimeRange toTimeRange() {
        return TimeRange.of(start, end);
    }
}
