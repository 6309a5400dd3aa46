package com.matchsync.coordinator.coordination.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 다자간 약속 조율 요청
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "다자간 약속 조율 요청")
public class ScheduleMatchRequest {

    @Schema(description = "참가자 ID 목록 (중복 불가)", example = "[\"bean\", \"joy\"]", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotEmpty(message = "참가자 목록은 필수입니다")
    private List<@NotBlank(message = "참가자 ID는 비어있을 수 없습니다") String> participantIds;

    @Schema(description = "약속 길이 (분)", example = "120", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotNull(message = "약속 길이는 필수입니다")
    @Min(value = 1, message = "약속 길이는 1분 이상이어야 합니다")
    private Integer durationMinutes;

    @Schema(description = "하루 탐색 시작 시간 (기본: 설정값)", example = "08:00", type = "string")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime dayWindowStart;

    @Schema(description = "하루 탐색 종료 시간 (기본: 설정값)", example = "19:00", type = "string")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime dayWindowEnd;

    @Schema(description = "탐색 일수 (1~31, 기본: 설정값)", example = "7")
    @Min(value = 1, message = "탐색 일수는 1 이상이어야 합니다")
    @Max(value = 31, message = "탐색 일수는 31 이하여야 합니다")
    private Integer searchDays;

    @Schema(description = "탐색 시작일 (기본: 오늘)", example = "2026-01-21", type = "string")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @Schema(description = "후보 구간 간격 (분, 기본: 설정값)", example = "60")
    @Min(value = 1, message = "탐색 간격은 1분 이상이어야 합니다")
    private Integer granularityMinutes;

    @Schema(description = "예약될 약속 설명", example = "Project sync")
    @Size(max = 255, message = "약속 설명은 255자 이하여야 합니다")
    private String label;

    @Schema(description = "슬롯 선택 전략 (earliest, afternoon, remote)", example = "afternoon")
    private String strategy;
}
