package personal.cinema.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cinema.core.booking.application.port.out.ShowingRepository;
import personal.cinema.core.booking.domain.model.Showing;

import java.util.List;
import java.util.Optional;

/**
 * Showing Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShowingPersistenceAdapter implements ShowingRepository {

    private final JpaShowingRepository jpaShowingRepository;

    @Override
    public Optional<Showing> findById(Long showingId) {
        log.debug("Finding showing: showingId={}", showingId);
        return jpaShowingRepository.findById(showingId)
                .map(ShowingEntity::toDomain);
    }

    @Override
    public Optional<Showing> findByIdForUpdate(Long showingId) {
        log.debug("Locking showing: showingId={}", showingId);
        return jpaShowingRepository.findByIdForUpdate(showingId)
                .map(ShowingEntity::toDomain);
    }

    @Override
    public List<Showing> findByScreenId(Long screenId) {
        return jpaShowingRepository.findByScreenIdOrderByStartTimeAsc(screenId).stream()
                .map(ShowingEntity::toDomain)
                .toList();
    }

    @Override
    public Showing save(Showing showing) {
        return jpaShowingRepository.save(ShowingEntity.fromDomain(showing)).toDomain();
    }
}
