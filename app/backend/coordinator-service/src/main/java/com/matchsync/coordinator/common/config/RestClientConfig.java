package com.matchsync.coordinator.common.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.stream.Stream;

/**
 * 용도별 RestTemplate 설정
 *
 * 모든 원격 호출은 명시적인 연결/읽기 타임아웃을 가진다.
 */
@Configuration
public class RestClientConfig {

    public static final String HEALTH_REST_TEMPLATE = "healthRestTemplate";
    public static final String RANKING_REST_TEMPLATE = "rankingRestTemplate";

    /**
     * 다이어리 조회, 예약, 보상 취소, 초기화용
     */
    @Bean
    @Primary
    public RestTemplate participantRestTemplate(RestTemplateBuilder builder, CoordinationProperties properties) {
        Duration readTimeout = Stream.of(
                        properties.getFetchTimeout(),
                        properties.getBookingTimeout(),
                        properties.getCompensationTimeout())
                .max(Duration::compareTo)
                .orElseThrow();

        return builder
                .setConnectTimeout(properties.getFetchTimeout())
                .setReadTimeout(readTimeout)
                .build();
    }

    @Bean(HEALTH_REST_TEMPLATE)
    public RestTemplate healthRestTemplate(RestTemplateBuilder builder, CoordinationProperties properties) {
        return builder
                .setConnectTimeout(properties.getHealthTimeout())
                .setReadTimeout(properties.getHealthTimeout())
                .build();
    }

    @Bean(RANKING_REST_TEMPLATE)
    public RestTemplate rankingRestTemplate(RestTemplateBuilder builder, CoordinationProperties properties) {
        return builder
                .setConnectTimeout(properties.getRankingTimeout())
                .setReadTimeout(properties.getRankingTimeout())
                .build();
    }
}
