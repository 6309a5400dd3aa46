package com.matchsync.coordinator.common.config;

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
                        .title("Coordinator Service API")
                        .version("1.0.0")
                        .description("다자간 약속 조율 (공통 빈 시간 탐색, 슬롯 선택, 예약/보상) API"))
                .servers(List.of(
                        new Server()
                                .url(serverUrl)
                                .description("Coordinator Service")
                ));
    }
}
