package personal.cinema.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Spring Data JPA Repository for Seat
 */
public interface JpaSeatRepository extends JpaRepository<SeatEntity, Long> {

    List<SeatEntity> findByScreenIdOrderByRowLabelAscSeatNumberAsc(Long screenId);
}
