package personal.cinema.core.booking.application.port.out;

import personal.cinema.core.booking.domain.model.SeatReservation;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Seat Reservation Repository (Output Port)
 * 좌석 홀드 저장소 인터페이스
 * (showing_id, seat_id) 유니크 제약이 동시 홀드의 2차 방어선이다.
 */
public interface SeatReservationRepository {

    /**
     * 홀드 저장 (즉시 flush)
     * 유니크 제약 위반은 호출 시점에 DataIntegrityViolationException으로 드러난다.
     *
     * @param reservation 홀드 정보
     * @return 저장된 홀드 (ID 포함)
     */
    SeatReservation save(SeatReservation reservation);

    Optional<SeatReservation> findById(Long reservationId);

    /**
     * 상영의 살아있는 홀드 조회 (expiresAt >= now)
     */
    List<SeatReservation> findLiveByShowingId(Long showingId, LocalDateTime now);

    /**
     * 특정 좌석의 살아있는 홀드 조회
     */
    Optional<SeatReservation> findLive(Long showingId, Long seatId, LocalDateTime now);

    /**
     * 사용자의 살아있는 홀드 조회 (만료 임박순)
     */
    List<SeatReservation> findLiveByUserId(Long userId, LocalDateTime now);

    void deleteById(Long reservationId);

    /**
     * 특정 (상영, 좌석)의 만료된 홀드 삭제
     * 새 홀드가 만료된 행을 대체할 수 있도록 insert 직전에 호출한다.
     *
     * @return 삭제된 행 수
     */
    int deleteExpired(Long showingId, Long seatId, LocalDateTime now);

    /**
     * 전체 만료 홀드 삭제 (스윕)
     *
     * @return 삭제된 행 수
     */
    int deleteAllExpired(LocalDateTime now);
}
