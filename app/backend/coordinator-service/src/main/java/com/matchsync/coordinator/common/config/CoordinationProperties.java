package com.matchsync.coordinator.common.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 조율 엔진 설정 프로퍼티
 *
 * 모든 원격 호출의 타임아웃, 기본 탐색 조건, 참가자 주소 목록을 application.yml의 coordination 설정에서 받는다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "coordination")
public class CoordinationProperties {

    /**
     * startDate가 없을 때 "오늘"을 계산하는 타임존
     */
    @NotBlank
    private String zone = "UTC";

    @NotNull
    private Duration healthTimeout = Duration.ofSeconds(2);

    @NotNull
    private Duration fetchTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration bookingTimeout = Duration.ofSeconds(10);

    /**
     * 보상 취소 1회 시도의 타임아웃 (재시도는 최대 1번)
     */
    @NotNull
    private Duration compensationTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration rankingTimeout = Duration.ofSeconds(30);

    /**
     * 조율 실행 전체의 제한 시간
     */
    @NotNull
    private Duration runTimeout = Duration.ofSeconds(60);

    @Min(1)
    private int defaultGranularityMinutes = 60;

    @Min(1)
    @Max(31)
    private int defaultSearchDays = 7;

    @NotBlank
    private String defaultDayWindowStart = "08:00";

    @NotBlank
    private String defaultDayWindowEnd = "19:00";

    @NotBlank
    private String defaultLabel = "Shared appointment";

    @NotBlank
    private String defaultStrategy = "afternoon";

    @Min(1)
    private int executorThreads = 16;

    @Min(1)
    private int rankingThreads = 4;

    /**
     * 참가자 다이어리 초기화 요청 시 전달하는 관리 API Key
     */
    private String adminApiKey;

    @Valid
    private Map<String, ParticipantEndpoint> participants = new LinkedHashMap<>();

    @Valid
    private Ranking ranking = new Ranking();

    @Getter
    @Setter
    public static class ParticipantEndpoint {

        /**
         * 참가자 API 기준 주소 (예: http://localhost:8081/v1/participants/bean)
         */
        @NotBlank
        private String baseUrl;
    }

    @Getter
    @Setter
    public static class Ranking {

        /**
         * remote 전략이 후보 목록을 보내는 외부 순위 결정 API 주소
         */
        private String url;
    }
}
