package personal.cinema.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import personal.cinema.core.booking.application.port.in.ExtendHoldUseCase;
import personal.cinema.core.booking.application.port.in.GetHoldsUseCase;
import personal.cinema.core.booking.application.port.in.HoldSeatCommand;
import personal.cinema.core.booking.application.port.in.HoldSeatUseCase;
import personal.cinema.core.booking.application.port.in.ReleaseHoldUseCase;
import personal.cinema.core.booking.application.port.out.SeatLockRepository;
import personal.cinema.core.booking.domain.exception.SeatUnavailableException;
import personal.cinema.core.booking.domain.model.SeatReservation;
import personal.cinema.core.booking.domain.service.ReservationManager;
import personal.cinema.core.config.BookingProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Seat Hold Service
 * 좌석 홀드 생성/연장/해제/조회
 *
 * 동시성 방어:
 * 1. SeatLockRepository (선택, Redis SETNX) - DB 접근 전 fail-fast
 * 2. 상영 행 비관적 락 - 같은 상영의 홀드/예매 생성 직렬화
 * 3. (showing_id, seat_id) 유니크 제약 - 최종 방어선
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeatHoldService implements
        HoldSeatUseCase,
        ExtendHoldUseCase,
        ReleaseHoldUseCase,
        GetHoldsUseCase {

    private final SeatLockRepository seatLockRepository;
    private final ReservationManager reservationManager;
    private final BookingProperties bookingProperties;
    private final Clock clock;

    @Override
    public SeatReservation holdSeat(HoldSeatCommand command) {
        log.info("Holding seat: userId={}, showingId={}, seatId={}",
                command.userId(), command.showingId(), command.seatId());

        // 1. Fail-Fast 선점 (DB 접근 없이 즉시 409)
        if (!seatLockRepository.tryLock(command.showingId(), command.seatId(), command.userId())) {
            log.warn("Seat lock contended: showingId={}, seatId={}", command.showingId(), command.seatId());
            throw new SeatUnavailableException(command.showingId(), command.seatId(), "being processed");
        }

        try {
            // 2. DB 트랜잭션 내에서 검증 및 저장 (ReservationManager 위임)
            SeatReservation saved = reservationManager.holdSeatInTransaction(
                    command, LocalDateTime.now(clock), bookingProperties.holdTtl());

            log.info("Seat held: reservationId={}, userId={}, seatId={}, expiresAt={}",
                    saved.id(), command.userId(), command.seatId(), saved.expiresAt());
            return saved;

        } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
            // 동시 요청이 유니크 제약 또는 락 대기에서 밀린 경우
            log.warn("Concurrent hold detected: showingId={}, seatId={}", command.showingId(), command.seatId());
            throw new SeatUnavailableException(command.showingId(), command.seatId(), "concurrent hold");

        } finally {
            seatLockRepository.unlock(command.showingId(), command.seatId(), command.userId());
        }
    }

    @Override
    public SeatReservation extendHold(Long reservationId, Long userId, Integer minutes) {
        int extensionMinutes = minutes != null
                ? minutes
                : bookingProperties.getHold().getDefaultExtensionMinutes();

        SeatReservation extended = reservationManager.extendHold(
                reservationId, userId, Duration.ofMinutes(extensionMinutes), LocalDateTime.now(clock));

        log.info("Hold extended: reservationId={}, minutes={}, expiresAt={}",
                reservationId, extensionMinutes, extended.expiresAt());
        return extended;
    }

    @Override
    public void releaseHold(Long reservationId, Long userId) {
        if (reservationManager.releaseHold(reservationId, userId, LocalDateTime.now(clock))) {
            log.info("Hold released: reservationId={}, userId={}", reservationId, userId);
        }
    }

    @Override
    public List<SeatReservation> getActiveHolds(Long userId) {
        return reservationManager.findActiveHolds(userId, LocalDateTime.now(clock));
    }
}
