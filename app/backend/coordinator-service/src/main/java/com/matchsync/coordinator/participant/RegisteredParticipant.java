package com.matchsync.coordinator.participant;

import lombok.Value;

/**
 * 조율 대상으로 등록된 참가자 (ID + API 주소)
 */
@Value
public class RegisteredParticipant {

    String id;

    String baseUrl;
}
