package com.matchsync.diary.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI 설정
 */
@Configuration
public class OpenApiConfig {

    @Value("${springdoc.server.url:/}")
    private String serverUrl;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Diary Service API")
                        .version("1.0.0")
                        .description("참가자 다이어리 조회, 가용성 확인, 예약/취소, 초기화 API"))
                .servers(List.of(
                        new Server()
                                .url(serverUrl)
                                .description("Diary Service")
                ));
    }
}
