package personal.cinema.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.cinema.core.booking.application.port.in.HoldSeatCommand;
import personal.cinema.core.booking.application.port.out.SeatRepository;
import personal.cinema.core.booking.application.port.out.SeatReservationRepository;
import personal.cinema.core.booking.application.port.out.ShowingRepository;
import personal.cinema.core.booking.domain.exception.ReservationNotFoundException;
import personal.cinema.core.booking.domain.exception.SeatNotFoundException;
import personal.cinema.core.booking.domain.exception.SeatUnavailableException;
import personal.cinema.core.booking.domain.exception.ShowingNotFoundException;
import personal.cinema.core.booking.domain.model.Seat;
import personal.cinema.core.booking.domain.model.SeatReservation;
import personal.cinema.core.booking.domain.model.SeatState;
import personal.cinema.core.booking.domain.model.Showing;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Reservation Domain Service (Transaction Manager)
 * 좌석 홀드 생성/연장/해제를 트랜잭션 단위로 실행한다.
 * 상영 행에 대한 비관적 락이 1차, (showing_id, seat_id) 유니크 제약이 2차 방어선이다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationManager {

    private final ShowingRepository showingRepository;
    private final SeatRepository seatRepository;
    private final SeatReservationRepository seatReservationRepository;
    private final AvailabilityResolver availabilityResolver;

    /**
     * 트랜잭션 내에서 좌석 홀드 생성
     *
     * @param command 홀드 커맨드
     * @param now     현재 시각
     * @param ttl     홀드 유지 시간
     * @return 저장된 홀드
     */
    @Transactional
    public SeatReservation holdSeatInTransaction(HoldSeatCommand command, LocalDateTime now, Duration ttl) {
        // 1. 상영 잠금 (같은 상영의 홀드/예매 생성 직렬화)
        Showing showing = showingRepository.findByIdForUpdate(command.showingId())
                .orElseThrow(() -> new ShowingNotFoundException(command.showingId()));

        // 2. 좌석 검증
        Seat seat = seatRepository.findById(command.seatId())
                .orElseThrow(() -> new SeatNotFoundException(command.seatId()));
        if (!seat.isOnScreen(showing.screenId())) {
            throw new SeatNotFoundException(seat.id(), showing.screenId());
        }

        // 3. 가용성 검증 (물리 상태, 예매, 살아있는 홀드)
        SeatState state = availabilityResolver.stateOf(showing, seat, now);
        if (state != SeatState.AVAILABLE) {
            log.warn("Seat not available for hold: showingId={}, seatId={}, state={}",
                    showing.id(), seat.id(), state);
            throw new SeatUnavailableException(showing.id(), seat.id(), state.name());
        }

        // 4. 만료된 행 정리 후 insert (유니크 제약 충돌 방지)
        int removed = seatReservationRepository.deleteExpired(showing.id(), seat.id(), now);
        if (removed > 0) {
            log.debug("Superseded expired hold: showingId={}, seatId={}", showing.id(), seat.id());
        }

        SeatReservation reservation = SeatReservation.create(
                command.userId(), showing.id(), seat.id(), command.sessionId(), now, ttl);
        return seatReservationRepository.save(reservation);
    }

    /**
     * 홀드 연장
     *
     * @throws ReservationNotFoundException 없거나, 타인 소유이거나, 이미 만료된 경우
     */
    @Transactional
    public SeatReservation extendHold(Long reservationId, Long userId, Duration extension, LocalDateTime now) {
        SeatReservation reservation = seatReservationRepository.findById(reservationId)
                .orElseThrow(() -> new ReservationNotFoundException(reservationId));
        reservation.ensureOwnership(userId);

        SeatReservation extended = reservation.extend(extension, now);
        return seatReservationRepository.save(extended);
    }

    /**
     * 홀드 해제 (멱등)
     * 만료된 홀드는 소유자와 무관하게 이미 해제된 것으로 보고 정리만 한다.
     *
     * @return 살아있는 홀드를 실제로 삭제했으면 true
     */
    @Transactional
    public boolean releaseHold(Long reservationId, Long userId, LocalDateTime now) {
        Optional<SeatReservation> found = seatReservationRepository.findById(reservationId);
        if (found.isEmpty()) {
            log.debug("Hold already released: reservationId={}", reservationId);
            return false;
        }
        if (found.get().isExpired(now)) {
            log.debug("Hold already expired: reservationId={}", reservationId);
            seatReservationRepository.deleteById(reservationId);
            return false;
        }
        found.get().ensureOwnership(userId);
        seatReservationRepository.deleteById(reservationId);
        return true;
    }

    @Transactional(readOnly = true)
    public List<SeatReservation> findActiveHolds(Long userId, LocalDateTime now) {
        return seatReservationRepository.findLiveByUserId(userId, now);
    }

    /**
     * 만료 홀드 일괄 삭제
     */
    @Transactional
    public int deleteExpiredHolds(LocalDateTime now) {
        return seatReservationRepository.deleteAllExpired(now);
    }
}
