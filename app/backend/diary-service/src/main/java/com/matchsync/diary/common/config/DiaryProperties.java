package com.matchsync.diary.common.config;

import com.matchsync.shared.diary.AppointmentKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 다이어리 서비스 설정 프로퍼티
 *
 * application.yml의 diary 설정을 바인딩한다. 참가자 기본 템플릿이 잘못되면 시작 시 에러가 발생한다.
 * 시간은 "HH:mm", 날짜는 "yyyy-MM-dd" 형식 문자열로 받는다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "diary")
public class DiaryProperties {

    /**
     * 기본 시작일 계산에 쓰는 타임존 (예: Asia/Seoul)
     */
    @NotBlank
    private String zone = "UTC";

    /**
     * 예약 요청에 label이 없을 때 사용하는 설명
     */
    @NotBlank
    private String defaultBookingLabel = "Shared appointment";

    /**
     * 관리 API 호출자 → API Key (예: coordinator-service: ${DIARY_ADMIN_API_KEY})
     */
    private Map<String, String> apiKeys = new HashMap<>();

    @Valid
    @NotEmpty(message = "diary.participants에 참가자가 최소 1명 필요합니다")
    private List<ParticipantTemplate> participants = new ArrayList<>();

    @Getter
    @Setter
    public static class ParticipantTemplate {

        @NotBlank
        private String id;

        private String displayName;

        @NotBlank
        private String dayStart = "08:00";

        @NotBlank
        private String dayEnd = "19:00";

        @Min(1)
        private int days = 10;

        /**
         * 첫 날짜 (없으면 서비스 시작일)
         */
        private String startDate;

        @Valid
        private List<TemplateAppointment> appointments = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class TemplateAppointment {

        @NotBlank
        private String start;

        @NotBlank
        private String end;

        @NotBlank
        private String label;

        @NotNull
        private AppointmentKind kind;

        /**
         * n이면 시작일 기준 n일마다 적용 (없으면 매일)
         */
        @Min(1)
        private Integer every;
    }
}
