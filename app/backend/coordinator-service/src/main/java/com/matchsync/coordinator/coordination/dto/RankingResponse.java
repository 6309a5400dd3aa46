package com.matchsync.coordinator.coordination.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 외부 순위 결정 API 응답
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankingResponse {

    /**
     * 후보 목록의 0-based 인덱스, 선호 높은 순
     */
    private List<Integer> ranking;

    /**
     * 선택 이유 (로그용)
     */
    private String reasoning;
}
