package com.matchsync.coordinator.participant.client;

import com.matchsync.coordinator.common.config.RestClientConfig;
import com.matchsync.coordinator.participant.RegisteredParticipant;
import com.matchsync.shared.diary.Diary;
import com.matchsync.shared.diary.TimeRange;
import com.matchsync.shared.dto.participant.BookingResponse;
import com.matchsync.shared.dto.participant.BookingStatus;
import com.matchsync.shared.dto.participant.CancelRequest;
import com.matchsync.shared.dto.participant.CancellationResponse;
import com.matchsync.shared.dto.participant.CancellationStatus;
import com.matchsync.shared.dto.participant.HealthResponse;
import com.matchsync.shared.dto.participant.SlotRequest;
import com.matchsync.shared.security.ServiceAuthValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.Set;

/**
 * 참가자 다이어리 API 클라이언트
 *
 * 네트워크/응답 오류는 예외로 전파하지 않고 결과 객체로 변환한다. (다이어리 조회와 초기화는 예외)
 */
@Component
@Slf4j
public class ParticipantClient {

    /**
     * 취소 API가 없는 참가자로 간주하는 응답 코드
     */
    private static final Set<HttpStatus> CANCEL_UNSUPPORTED = Set.of(
            HttpStatus.NOT_FOUND, HttpStatus.METHOD_NOT_ALLOWED, HttpStatus.NOT_IMPLEMENTED);

    private final RestTemplate restTemplate;
    private final RestTemplate healthRestTemplate;

    public ParticipantClient(
            RestTemplate restTemplate,
            @Qualifier(RestClientConfig.HEALTH_REST_TEMPLATE) RestTemplate healthRestTemplate
    ) {
        this.restTemplate = restTemplate;
        this.healthRestTemplate = healthRestTemplate;
    }

    /**
     * 다이어리 조회
     *
     * @throws ParticipantUnreachableException 조회 실패 또는 빈 응답
     */
    public Diary getDiary(RegisteredParticipant participant) {
        String url = participant.getBaseUrl() + "/diary";

        try {
            log.debug("다이어리 조회: participantId={}", participant.getId());
            Diary diary = restTemplate.getForObject(url, Diary.class);
            if (diary == null) {
                throw new ParticipantUnreachableException("다이어리 응답이 비어있습니다: " + participant.getId());
            }
            log.debug("다이어리 조회 결과: participantId={}, 날짜 수={}", participant.getId(), diary.getDays().size());
            return diary;
        } catch (RestClientException e) {
            log.error("다이어리 조회 실패: participantId={}, error={}", participant.getId(), e.getMessage());
            throw new ParticipantUnreachableException("다이어리 조회 실패: " + participant.getId(), e);
        }
    }

    /**
     * booked 약속 추가 요청 (reference = 조율 실행 ID)
     */
    public BookingOutcome book(RegisteredParticipant participant, LocalDate date, TimeRange range,
                               String label, String reference) {
        String url = participant.getBaseUrl() + "/appointments/book";
        SlotRequest request = SlotRequest.builder()
                .date(date)
                .start(range.getStart())
                .end(range.getEnd())
                .label(label)
                .reference(reference)
                .build();

        try {
            log.debug("예약 요청: participantId={}, date={}, range={}, reference={}",
                    participant.getId(), date, range, reference);
            BookingResponse response = restTemplate.postForObject(url, request, BookingResponse.class);

            if (response == null || response.getStatus() == null) {
                return BookingOutcome.of(BookingOutcome.Result.ERROR, "예약 응답이 비어있습니다");
            }
            if (response.getStatus() == BookingStatus.BOOKED) {
                return BookingOutcome.booked();
            }
            if (response.getStatus() == BookingStatus.CONFLICT) {
                return BookingOutcome.of(BookingOutcome.Result.CONFLICT, response.getMessage());
            }
            return BookingOutcome.of(BookingOutcome.Result.ERROR, response.getMessage());
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                log.warn("예약 충돌: participantId={}, date={}, range={}", participant.getId(), date, range);
                return BookingOutcome.of(BookingOutcome.Result.CONFLICT, e.getResponseBodyAsString());
            }
            log.error("예약 실패: participantId={}, status={}, error={}",
                    participant.getId(), e.getStatusCode(), e.getMessage());
            return BookingOutcome.of(BookingOutcome.Result.ERROR, e.getStatusCode().toString());
        } catch (ResourceAccessException e) {
            log.error("예약 요청 연결 실패: participantId={}, error={}", participant.getId(), e.getMessage());
            return BookingOutcome.of(BookingOutcome.Result.UNREACHABLE, e.getMessage());
        } catch (RestClientException e) {
            log.error("예약 실패: participantId={}, error={}", participant.getId(), e.getMessage());
            return BookingOutcome.of(BookingOutcome.Result.ERROR, e.getMessage());
        }
    }

    /**
     * 보상 취소 요청
     */
    public CancellationOutcome cancel(RegisteredParticipant participant, LocalDate date, TimeRange range,
                                      String reference) {
        String url = participant.getBaseUrl() + "/appointments/cancel";
        CancelRequest request = CancelRequest.builder()
                .date(date)
                .start(range.getStart())
                .end(range.getEnd())
                .reference(reference)
                .build();

        try {
            log.debug("예약 취소 요청: participantId={}, date={}, range={}, reference={}",
                    participant.getId(), date, range, reference);
            CancellationResponse response = restTemplate.postForObject(url, request, CancellationResponse.class);

            if (response == null || response.getStatus() == null) {
                return CancellationOutcome.of(CancellationOutcome.Result.ERROR, "취소 응답이 비어있습니다");
            }
            if (response.getStatus() == CancellationStatus.CANCELLED) {
                return CancellationOutcome.of(CancellationOutcome.Result.CANCELLED, null);
            }
            if (response.getStatus() == CancellationStatus.NOT_FOUND) {
                return CancellationOutcome.of(CancellationOutcome.Result.NOT_FOUND, response.getMessage());
            }
            return CancellationOutcome.of(CancellationOutcome.Result.ERROR, response.getMessage());
        } catch (HttpStatusCodeException e) {
            HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
            if (status != null && CANCEL_UNSUPPORTED.contains(status)) {
                log.warn("취소 API 미지원: participantId={}, status={}", participant.getId(), e.getStatusCode());
                return CancellationOutcome.of(CancellationOutcome.Result.UNSUPPORTED, e.getStatusCode().toString());
            }
            log.error("예약 취소 실패: participantId={}, status={}", participant.getId(), e.getStatusCode());
            return CancellationOutcome.of(CancellationOutcome.Result.ERROR, e.getStatusCode().toString());
        } catch (ResourceAccessException e) {
            log.error("예약 취소 연결 실패: participantId={}, error={}", participant.getId(), e.getMessage());
            return CancellationOutcome.of(CancellationOutcome.Result.UNREACHABLE, e.getMessage());
        } catch (RestClientException e) {
            log.error("예약 취소 실패: participantId={}, error={}", participant.getId(), e.getMessage());
            return CancellationOutcome.of(CancellationOutcome.Result.ERROR, e.getMessage());
        }
    }

    /**
     * 헬스 체크 (짧은 타임아웃 전용 RestTemplate 사용)
     *
     * @return online 응답이면 true (실패 시 false)
     */
    public boolean isOnline(RegisteredParticipant participant) {
        String url = participant.getBaseUrl() + "/health";

        try {
            HealthResponse response = healthRestTemplate.getForObject(url, HealthResponse.class);
            return response != null && response.isOnline();
        } catch (RestClientException e) {
            log.warn("헬스 체크 실패: participantId={}, error={}", participant.getId(), e.getMessage());
            return false;
        }
    }

    /**
     * 다이어리 초기화 (관리 API Key 전달)
     *
     * @throws ParticipantUnreachableException 초기화 실패
     */
    public Diary resetDiary(RegisteredParticipant participant, String adminApiKey) {
        String url = participant.getBaseUrl() + "/diary/reset";
        HttpHeaders headers = new HttpHeaders();
        if (adminApiKey != null) {
            headers.set(ServiceAuthValidator.API_KEY_HEADER, adminApiKey);
        }

        try {
            ResponseEntity<Diary> response = restTemplate.exchange(
                    url, HttpMethod.POST, new HttpEntity<>(headers), Diary.class);
            log.info("다이어리 초기화 완료: participantId={}", participant.getId());
            return response.getBody();
        } catch (RestClientException e) {
            log.error("다이어리 초기화 실패: participantId={}, error={}", participant.getId(), e.getMessage());
            throw new ParticipantUnreachableException("다이어리 초기화 실패: " + participant.getId(), e);
        }
    }
}
