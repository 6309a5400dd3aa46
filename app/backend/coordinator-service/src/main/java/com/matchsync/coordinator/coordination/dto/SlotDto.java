package com.matchsync.coordinator.coordination.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.matchsync.coordinator.coordination.algorithm.CandidateSlot;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotDto {

    @Schema(description = "날짜", example = "2026-01-21")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate date;

    @Schema(description = "시작 시간", example = "14:00")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime start;

    @Schema(description = "종료 시간", example = "16:00")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime end;

    public static SlotDto from(CandidateSlot slot) {
        return SlotDto.builder()
                .date(slot.getDate())
                .start(slot.getStart())
                .end(slot.getEnd())
                .build();
    }
}
