package com.matchsync.diary.diaries.store;

import com.matchsync.diary.diaries.exception.DateNotInDiaryException;
import com.matchsync.diary.diaries.template.DiaryTemplate;
import com.matchsync.shared.diary.Appointment;
import com.matchsync.shared.diary.AppointmentKind;
import com.matchsync.shared.diary.AvailabilityEngine;
import com.matchsync.shared.diary.AvailabilityResult;
import com.matchsync.shared.diary.Diary;
import com.matchsync.shared.diary.TimeRange;
import com.matchsync.shared.diary.exception.InvalidRangeException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 참가자 한 명의 다이어리 원본
 *
 * 날짜별 약속 목록은 불변 리스트로 교체하는 방식으로만 변경한다.
 * 같은 날짜의 "확인 후 추가"는 날짜별 락 안에서 원자적으로 수행되고,
 * 초기화는 쓰기 락으로 모든 날짜 작업과 배타적으로 수행된다.
 */
@Slf4j
public class ParticipantDiary {

    private final String participantId;
    private final TimeRange dayBounds;
    private final AvailabilityEngine availabilityEngine;

    private final Map<LocalDate, List<Appointment>> days = new ConcurrentHashMap<>();
    private final Map<LocalDate, ReentrantLock> dateLocks = new ConcurrentHashMap<>();
    private final ReadWriteLock resetLock = new ReentrantReadWriteLock();

    /**
     * reference를 붙여 취소된 예약. 취소보다 늦게 도착한 같은 예약 요청은 다시 받지 않는다.
     */
    private final Set<CancelledBooking> cancelledBookings = ConcurrentHashMap.newKeySet();

    public ParticipantDiary(DiaryTemplate template, AvailabilityEngine availabilityEngine) {
        this.participantId = template.getParticipantId();
        this.dayBounds = template.getDayBounds();
        this.availabilityEngine = availabilityEngine;
        this.days.putAll(template.getDays());
    }

    public String getParticipantId() {
        return participantId;
    }

    public Diary snapshot() {
        resetLock.readLock().lock();
        try {
            return new Diary(participantId, dayBounds, days);
        } finally {
            resetLock.readLock().unlock();
        }
    }

    /**
     * FIXED/BOOKED 약속과 겹치지 않으면 추가한다.
     *
     * 같은 구간, 같은 reference의 BOOKED 약속이 이미 있으면 새로 추가하지 않고 기존 약속을 돌려준다.
     * 이미 취소된 reference의 예약이면 CONFLICT.
     *
     * @throws DateNotInDiaryException 다이어리 기간 밖의 날짜
     * @throws InvalidRangeException   하루 범위를 벗어나는 구간
     */
    public UpsertResult upsert(LocalDate date, Appointment appointment) {
        TimeRange range = appointment.getTimeRange();
        if (range == null) {
            throw new InvalidRangeException("약속 시간 구간은 필수입니다");
        }
        if (!dayBounds.contains(range)) {
            throw new InvalidRangeException(String.format(
                    "하루 범위(%s)를 벗어난 구간입니다: %s", dayBounds, range));
        }

        resetLock.readLock().lock();
        try {
            ReentrantLock dateLock = lockFor(date);
            dateLock.lock();
            try {
                List<Appointment> current = requireDay(date);

                Optional<Appointment> existing = findSameBooking(current, appointment);
                if (existing.isPresent()) {
                    log.info("이미 등록된 예약 - participantId: {}, date: {}, range: {}, reference: {}",
                            participantId, date, range, appointment.getReference());
                    return UpsertResult.alreadyPresent(existing.get());
                }
                if (isCancelled(date, appointment)) {
                    log.warn("취소된 예약의 지연 요청 거부 - participantId: {}, date: {}, range: {}, reference: {}",
                            participantId, date, range, appointment.getReference());
                    return UpsertResult.conflict(null);
                }

                AvailabilityResult availability = availabilityEngine.isFree(current, dayBounds, range);
                if (!availability.isFree()) {
                    log.info("예약 충돌 - participantId: {}, date: {}, range: {}, 충돌 약속: {}",
                            participantId, date, range, availability.getConflictingAppointment());
                    return UpsertResult.conflict(availability.getConflictingAppointment());
                }

                List<Appointment> updated = new ArrayList<>(current);
                updated.add(appointment);
                updated.sort((a, b) -> a.getTimeRange().compareTo(b.getTimeRange()));
                days.put(date, Collections.unmodifiableList(updated));

                log.info("약속 추가 - participantId: {}, date: {}, range: {}, kind: {}",
                        participantId, date, range, appointment.getKind().getWireValue());
                return UpsertResult.inserted(appointment);
            } finally {
                dateLock.unlock();
            }
        } finally {
            resetLock.readLock().unlock();
        }
    }

    /**
     * 같은 구간의 BOOKED 약속 하나를 제거한다. reference가 주어지면 reference도 일치해야 하고,
     * 제거할 약속이 없어도 이후 같은 reference의 예약 요청을 막도록 기록한다.
     *
     * @return 제거된 약속 (없으면 empty)
     */
    public Optional<Appointment> cancel(LocalDate date, TimeRange range, String reference) {
        resetLock.readLock().lock();
        try {
            ReentrantLock dateLock = lockFor(date);
            dateLock.lock();
            try {
                List<Appointment> current = days.get(date);
                if (current == null) {
                    return Optional.empty();
                }
                if (reference != null) {
                    cancelledBookings.add(new CancelledBooking(date, range, reference));
                }

                Optional<Appointment> target = current.stream()
                        .filter(a -> a.getKind() == AppointmentKind.BOOKED)
                        .filter(a -> a.getTimeRange().equals(range))
                        .filter(a -> reference == null || reference.equals(a.getReference()))
                        .findFirst();

                target.ifPresent(removed -> {
                    List<Appointment> updated = new ArrayList<>(current);
                    updated.remove(removed);
                    days.put(date, Collections.unmodifiableList(updated));
                    log.info("예약 취소 - participantId: {}, date: {}, range: {}, reference: {}",
                            participantId, date, range, removed.getReference());
                });
                return target;
            } finally {
                dateLock.unlock();
            }
        } finally {
            resetLock.readLock().unlock();
        }
    }

    public Diary reset(DiaryTemplate template) {
        resetLock.writeLock().lock();
        try {
            days.clear();
            days.putAll(template.getDays());
            cancelledBookings.clear();
            log.info("다이어리 초기화 - participantId: {}, 날짜 수: {}", participantId, days.size());
            return new Diary(participantId, dayBounds, days);
        } finally {
            resetLock.writeLock().unlock();
        }
    }

    private List<Appointment> requireDay(LocalDate date) {
        List<Appointment> current = days.get(date);
        if (current == null) {
            throw new DateNotInDiaryException(String.format(
                    "다이어리에 없는 날짜입니다: participantId=%s, date=%s", participantId, date));
        }
        return current;
    }

    private Optional<Appointment> findSameBooking(List<Appointment> current, Appointment candidate) {
        if (candidate.getKind() != AppointmentKind.BOOKED || candidate.getReference() == null) {
            return Optional.empty();
        }
        return current.stream()
                .filter(a -> a.getKind() == AppointmentKind.BOOKED)
                .filter(a -> a.getTimeRange().equals(candidate.getTimeRange()))
                .filter(a -> Objects.equals(a.getReference(), candidate.getReference()))
                .findFirst();
    }

    private boolean isCancelled(LocalDate date, Appointment candidate) {
        return candidate.getKind() == AppointmentKind.BOOKED
                && candidate.getReference() != null
                && cancelledBookings.contains(
                        new CancelledBooking(date, candidate.getTimeRange(), candidate.getReference()));
    }

    private ReentrantLock lockFor(LocalDate date) {
        return dateLocks.computeIfAbsent(date, d -> new ReentrantLock());
    }

    @Value
    private static class CancelledBooking {
        LocalDate date;
        TimeRange range;
        String reference;
    }
}
