package com.matchsync.coordinator.coordination.selection;

import com.matchsync.coordinator.common.config.CoordinationProperties;
import com.matchsync.coordinator.common.config.RestClientConfig;
import com.matchsync.coordinator.coordination.algorithm.CandidateSlot;
import com.matchsync.coordinator.coordination.dto.RankingRequest;
import com.matchsync.coordinator.coordination.dto.RankingResponse;
import com.matchsync.coordinator.coordination.dto.SlotDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 외부 순위 결정 API(예: LLM 기반 비서)에 후보 목록을 보내고 인덱스 순위를 받는 전략
 *
 * 응답이 없거나 인덱스가 범위를 벗어나면 SlotRankingException을 던지고, 선택기가 기본 슬롯으로 대체한다.
 */
@Component
@Slf4j
public class RemoteRankingStrategy implements SlotRankingStrategy {

    public static final String NAME = "remote";

    static final String PREFERENCES = "Prefer earlier days in the week. "
            + "Prefer afternoon slots starting between 13:00 and 17:00. "
            + "Avoid very early or very late slots.";

    private final RestTemplate rankingRestTemplate;
    private final CoordinationProperties properties;

    public RemoteRankingStrategy(
            @Qualifier(RestClientConfig.RANKING_REST_TEMPLATE) RestTemplate rankingRestTemplate,
            CoordinationProperties properties
    ) {
        this.rankingRestTemplate = rankingRestTemplate;
        this.properties = properties;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<CandidateSlot> rank(List<CandidateSlot> candidates) {
        String url = properties.getRanking().getUrl();
        if (url == null || url.isBlank()) {
            throw new SlotRankingException("coordination.ranking.url이 설정되지 않았습니다");
        }

        RankingRequest request = RankingRequest.builder()
                .preferences(PREFERENCES)
                .candidates(candidates.stream().map(SlotDto::from).toList())
                .build();

        RankingResponse response;
        try {
            log.debug("외부 순위 결정 요청: 후보 수={}", candidates.size());
            response = rankingRestTemplate.postForObject(url, request, RankingResponse.class);
        } catch (RestClientException e) {
            throw new SlotRankingException("외부 순위 결정 API 호출 실패: " + e.getMessage(), e);
        }

        if (response == null || response.getRanking() == null || response.getRanking().isEmpty()) {
            throw new SlotRankingException("외부 순위 결정 API 응답에 순위가 없습니다");
        }

        Set<Integer> indexes = new LinkedHashSet<>(response.getRanking());
        List<CandidateSlot> ranked = new ArrayList<>();
        for (Integer index : indexes) {
            if (index == null || index < 0 || index >= candidates.size()) {
                throw new SlotRankingException("범위를 벗어난 후보 인덱스: " + index + " (후보 수: " + candidates.size() + ")");
            }
            ranked.add(candidates.get(index));
        }

        log.info("외부 순위 결정 완료: 1순위={}, 이유={}", ranked.get(0), response.getReasoning());
        return ranked;
    }
}
