package personal.cinema.core.booking.application.port.out;

import personal.cinema.core.booking.domain.model.Booking;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Booking Repository (Output Port)
 * 예매 저장소 인터페이스 (BookedSeat 포함)
 */
public interface BookingRepository {

    /**
     * 예매 저장 (좌석 스냅샷 포함, 즉시 flush)
     *
     * @param booking 예매 정보
     * @return 저장된 예매 (ID 포함)
     */
    Booking save(Booking booking);

    Optional<Booking> findById(Long bookingId);

    /**
     * 예매 조회 + 비관적 쓰기 락
     * 확정/취소/만료가 같은 예매에 대해 경쟁하지 않도록 한다.
     */
    Optional<Booking> findByIdForUpdate(Long bookingId);

    /**
     * 사용자의 예매 목록 (최신순)
     */
    List<Booking> findByUserId(Long userId);

    /**
     * 상영에서 좌석을 점유 중인 좌석 ID
     * CONFIRMED 또는 만료 전 PENDING 예매의 좌석
     *
     * @param showingId 상영 ID
     * @param now       현재 시각
     * @return 점유 좌석 ID 집합
     */
    Set<Long> findActiveSeatIds(Long showingId, LocalDateTime now);

    /**
     * 만료 시각이 지난 PENDING 예매 ID (스윕 대상)
     */
    List<Long> findExpiredPendingIds(LocalDateTime now);
}
