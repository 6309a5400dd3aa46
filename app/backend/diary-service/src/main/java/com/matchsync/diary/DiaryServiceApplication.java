package com.matchsync.diary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Diary Service Application
 * 참가자 다이어리 관리 서비스 (조회, 가용성 확인, 예약, 취소, 초기화)
 */
@SpringBootApplication
public class DiaryServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiaryServiceApplication.class, args);
    }
}
