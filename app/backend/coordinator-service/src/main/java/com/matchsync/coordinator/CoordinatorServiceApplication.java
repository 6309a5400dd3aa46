package com.matchsync.coordinator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Coordinator Service Application
 * 여러 참가자 다이어리의 공통 빈 시간을 찾아 모두에게 예약하는 조율 서비스
 */
@SpringBootApplication
public class CoordinatorServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoordinatorServiceApplication.class, args);
    }
}
