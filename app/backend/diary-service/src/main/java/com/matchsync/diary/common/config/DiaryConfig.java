package com.matchsync.diary.common.config;

import com.matchsync.shared.diary.AvailabilityEngine;
import com.matchsync.shared.security.ServiceAuthValidator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(DiaryProperties.class)
public class DiaryConfig {

    @Bean
    public AvailabilityEngine availabilityEngine() {
        return new AvailabilityEngine();
    }

    @Bean
    public ServiceAuthValidator serviceAuthValidator(DiaryProperties properties) {
        // 설정은 호출자 → key 형태, 검증기는 key → 호출자 형태
        Map<String, String> keyToCaller = new HashMap<>();
        properties.getApiKeys().forEach((caller, key) -> keyToCaller.put(key, caller));
        return new ServiceAuthValidator(keyToCaller);
    }

    @Bean
    public Clock clock(DiaryProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }
}
