package personal.cinema.core.booking.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Showing
 */
public interface JpaShowingRepository extends JpaRepository<ShowingEntity, Long> {

    /**
     * 비관적 쓰기 락 (SELECT ... FOR UPDATE)
     * 락 대기가 길어지면 PessimisticLockingFailureException으로 실패한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT s FROM ShowingEntity s WHERE s.id = :id")
    Optional<ShowingEntity> findByIdForUpdate(@Param("id") Long id);

    List<ShowingEntity> findByScreenIdOrderByStartTimeAsc(Long screenId);
}
