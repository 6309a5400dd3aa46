package com.matchsync.diary.diaries.dto;

import com.matchsync.diary.diaries.template.DiaryTemplate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 참가자 목록 항목 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantSummaryResponse {

    private String participantId;

    private String displayName;

    public static ParticipantSummaryResponse from(DiaryTemplate template) {
        return ParticipantSummaryResponse.builder()
                .participantId(template.getParticipantId())
                .displayName(template.getDisplayName())
                .build();
    }
}
