package com.matchsync.coordinator.common.config;

import com.matchsync.shared.diary.AvailabilityEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(CoordinationProperties.class)
public class CoordinationConfig {

    public static final String COORDINATION_EXECUTOR = "coordinationExecutor";
    public static final String RANKING_EXECUTOR = "rankingExecutor";

    /**
     * 참가자 호출(헬스 체크, 다이어리 조회, 예약, 보상)을 병렬로 실행하는 스레드 풀
     */
    @Bean(name = COORDINATION_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService coordinationExecutor(CoordinationProperties properties) {
        return Executors.newFixedThreadPool(
                properties.getExecutorThreads(),
                new CustomizableThreadFactory("coordination-"));
    }

    /**
     * 슬롯 선택 전략 전용 스레드 풀. 응답 없는 원격 랭커가 참가자 호출 스레드를 붙잡지 않도록 분리한다.
     */
    @Bean(name = RANKING_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService rankingExecutor(CoordinationProperties properties) {
        return Executors.newFixedThreadPool(
                properties.getRankingThreads(),
                new CustomizableThreadFactory("ranking-"));
    }

    @Bean
    public AvailabilityEngine availabilityEngine() {
        return new AvailabilityEngine();
    }

    @Bean
    public Clock clock(CoordinationProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }
}
