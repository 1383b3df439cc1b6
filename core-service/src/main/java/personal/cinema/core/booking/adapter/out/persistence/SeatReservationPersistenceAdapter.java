package personal.cinema.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cinema.core.booking.application.port.out.SeatReservationRepository;
import personal.cinema.core.booking.domain.exception.ReservationNotFoundException;
import personal.cinema.core.booking.domain.model.SeatReservation;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Seat Reservation Persistence Adapter
 * JPA를 사용한 좌석 홀드 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeatReservationPersistenceAdapter implements SeatReservationRepository {

    private final JpaSeatReservationRepository jpaSeatReservationRepository;

    @Override
    public SeatReservation save(SeatReservation reservation) {
        log.debug("Saving hold: showingId={}, seatId={}, expiresAt={}",
                reservation.showingId(), reservation.seatId(), reservation.expiresAt());

        if (reservation.id() == null) {
            // 유니크 제약 위반을 트랜잭션 커밋이 아닌 이 시점에 드러내기 위해 즉시 flush
            return jpaSeatReservationRepository.saveAndFlush(SeatReservationEntity.fromDomain(reservation))
                    .toDomain();
        }

        SeatReservationEntity entity = jpaSeatReservationRepository.findById(reservation.id())
                .orElseThrow(() -> new ReservationNotFoundException(reservation.id()));
        entity.updateExpiresAt(reservation.expiresAt());
        return entity.toDomain();
    }

    @Override
    public Optional<SeatReservation> findById(Long reservationId) {
        log.debug("Finding hold: reservationId={}", reservationId);
        return jpaSeatReservationRepository.findById(reservationId)
                .map(SeatReservationEntity::toDomain);
    }

    @Override
    public List<SeatReservation> findLiveByShowingId(Long showingId, LocalDateTime now) {
        return jpaSeatReservationRepository.findLiveByShowingId(showingId, now).stream()
                .map(SeatReservationEntity::toDomain)
                .toList();
    }

    @Override
    public Optional<SeatReservation> findLive(Long showingId, Long seatId, LocalDateTime now) {
        return jpaSeatReservationRepository.findLive(showingId, seatId, now)
                .map(SeatReservationEntity::toDomain);
    }

    @Override
    public List<SeatReservation> findLiveByUserId(Long userId, LocalDateTime now) {
        return jpaSeatReservationRepository.findLiveByUserId(userId, now).stream()
                .map(SeatReservationEntity::toDomain)
                .toList();
    }

    @Override
    public void deleteById(Long reservationId) {
        log.debug("Deleting hold: reservationId={}", reservationId);
        jpaSeatReservationRepository.deleteById(reservationId);
        jpaSeatReservationRepository.flush();
    }

    @Override
    public int deleteExpired(Long showingId, Long seatId, LocalDateTime now) {
        return jpaSeatReservationRepository.deleteExpired(showingId, seatId, now);
    }

    @Override
    public int deleteAllExpired(LocalDateTime now) {
        return jpaSeatReservationRepository.deleteAllExpired(now);
    }
}
