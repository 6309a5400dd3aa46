package com.matchsync.shared.dto.participant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 참가자 생존 확인 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    public static final String ONLINE = "online";

    private String participantId;

    private String status;

    @JsonIgnore
    public boolean isOnline() {
        return ONLINE.equalsIgnoreCase(status);
    }
}
