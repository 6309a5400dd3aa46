package com.matchsync.coordinator.coordination.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 외부 순위 결정 API 요청
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankingRequest {

    /**
     * 자연어 선호 조건 (순위 결정 API가 참고)
     */
    private String preferences;

    private List<SlotDto> candidates;
}
