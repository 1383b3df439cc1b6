package personal.cinema.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Spring Data JPA Repository for BookingHistory
 */
public interface JpaBookingHistoryRepository extends JpaRepository<BookingHistoryEntity, Long> {

    @Query("SELECT h FROM BookingHistoryEntity h WHERE h.booking.id = :bookingId ORDER BY h.occurredAt ASC, h.id ASC")
    List<BookingHistoryEntity> findByBookingId(@Param("bookingId") Long bookingId);
}
