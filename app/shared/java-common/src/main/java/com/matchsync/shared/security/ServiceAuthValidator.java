package com.matchsync.shared.security;

import com.matchsync.shared.security.exception.UnauthorizedException;

import java.util.HashMap;
import java.util.Map;

/**
 * 관리용 API(다이어리 초기화 등) 호출 시 API Key를 검증하고 호출자를 식별한다.
 *
 * <p>사용 예시:</p>
 * <pre>
 * ServiceAuthValidator validator = new ServiceAuthValidator(Map.of("coordinator-admin-key", "coordinator-service"));
 * String caller = validator.validateAndGetCaller(apiKeyHeader);
 * // caller = "coordinator-service"
 * </pre>
 */
public class ServiceAuthValidator {

    public static final String API_KEY_HEADER = "X-Api-Key";

    private final Map<String, String> apiKeyToCaller;

    /**
     * @param apiKeyToCaller API Key → 호출자 이름 매핑 (빈 key는 무시)
     */
    public ServiceAuthValidator(Map<String, String> apiKeyToCaller) {
        this.apiKeyToCaller = new HashMap<>();
        apiKeyToCaller.forEach((key, caller) -> {
            if (key != null && !key.isBlank()) {
                this.apiKeyToCaller.put(key, caller);
            }
        });
    }

    /**
     * @return 호출자 이름
     * @throws UnauthorizedException API Key가 없거나 등록되지 않은 경우
     */
    public String validateAndGetCaller(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new UnauthorizedException("API Key가 필요합니다");
        }

        String caller = apiKeyToCaller.get(apiKey);
        if (caller == null) {
            throw new UnauthorizedException("유효하지 않은 API Key입니다");
        }
        return caller;
    }

    public boolean isValid(String apiKey) {
        return apiKey != null && !apiKey.isBlank() && apiKeyToCaller.containsKey(apiKey);
    }
}
