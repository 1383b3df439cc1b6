package personal.cinema.core.booking.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.cinema.core.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Booking
 */
public interface JpaBookingRepository extends JpaRepository<BookingEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BookingEntity b WHERE b.id = :id")
    Optional<BookingEntity> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT DISTINCT b FROM BookingEntity b LEFT JOIN FETCH b.seats " +
            "WHERE b.userId = :userId ORDER BY b.bookedAt DESC, b.id DESC")
    List<BookingEntity> findByUserIdWithSeats(@Param("userId") Long userId);

    /**
     * 좌석을 점유 중인 예매의 좌석 ID
     * CONFIRMED 이거나, PENDING 이면서 expires_at >= now
     */
    @Query("SELECT bs.seatId FROM BookedSeatEntity bs JOIN bs.booking b " +
            "WHERE b.showingId = :showingId " +
            "AND (b.status = :confirmed OR (b.status = :pending AND b.expiresAt >= :now))")
    List<Long> findActiveSeatIds(@Param("showingId") Long showingId,
                                 @Param("now") LocalDateTime now,
                                 @Param("confirmed") BookingStatus confirmed,
                                 @Param("pending") BookingStatus pending);

    @Query("SELECT b.id FROM BookingEntity b WHERE b.status = :status AND b.expiresAt < :now ORDER BY b.expiresAt ASC")
    List<Long> findIdsByStatusAndExpiresAtBefore(@Param("status") BookingStatus status,
                                                 @Param("now") LocalDateTime now);
}
