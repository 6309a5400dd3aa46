package com.matchsync.coordinator.coordination.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.matchsync.coordinator.coordination.model.ParticipantBookingStatus;
import com.matchsync.coordinator.coordination.model.ParticipantRunState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParticipantResultDto {

    private int freeSlots;

    private ParticipantBookingStatus bookingStatus;

    private String detail;

    private int compensationAttempts;

    public static ParticipantResultDto from(ParticipantRunState state) {
        return ParticipantResultDto.builder()
                .freeSlots(state.getFreeSlots())
                .bookingStatus(state.getBookingStatus())
                .detail(state.getDetail())
                .compensationAttempts(state.getCompensationAttempts())
                .build();
    }
}
