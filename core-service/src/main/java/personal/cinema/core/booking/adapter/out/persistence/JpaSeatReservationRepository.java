package personal.cinema.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for SeatReservation
 * 살아있는 홀드: expires_at >= now
 */
public interface JpaSeatReservationRepository extends JpaRepository<SeatReservationEntity, Long> {

    @Query("SELECT r FROM SeatReservationEntity r WHERE r.showingId = :showingId AND r.expiresAt >= :now")
    List<SeatReservationEntity> findLiveByShowingId(@Param("showingId") Long showingId,
                                                    @Param("now") LocalDateTime now);

    @Query("SELECT r FROM SeatReservationEntity r " +
            "WHERE r.showingId = :showingId AND r.seatId = :seatId AND r.expiresAt >= :now")
    Optional<SeatReservationEntity> findLive(@Param("showingId") Long showingId,
                                             @Param("seatId") Long seatId,
                                             @Param("now") LocalDateTime now);

    @Query("SELECT r FROM SeatReservationEntity r " +
            "WHERE r.userId = :userId AND r.expiresAt >= :now ORDER BY r.expiresAt ASC")
    List<SeatReservationEntity> findLiveByUserId(@Param("userId") Long userId,
                                                 @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM SeatReservationEntity r " +
            "WHERE r.showingId = :showingId AND r.seatId = :seatId AND r.expiresAt < :now")
    int deleteExpired(@Param("showingId") Long showingId,
                      @Param("seatId") Long seatId,
                      @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM SeatReservationEntity r WHERE r.expiresAt < :now")
    int deleteAllExpired(@Param("now") LocalDateTime now);
}
