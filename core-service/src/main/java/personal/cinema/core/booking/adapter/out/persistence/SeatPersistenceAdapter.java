package personal.cinema.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cinema.core.booking.application.port.out.SeatRepository;
import personal.cinema.core.booking.domain.model.Seat;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Seat Persistence Adapter
 * JPA를 사용한 좌석 카탈로그 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeatPersistenceAdapter implements SeatRepository {

    private final JpaSeatRepository jpaSeatRepository;

    @Override
    public Optional<Seat> findById(Long seatId) {
        log.debug("Finding seat: seatId={}", seatId);
        return jpaSeatRepository.findById(seatId)
                .map(SeatEntity::toDomain);
    }

    @Override
    public List<Seat> findAllById(Collection<Long> seatIds) {
        return jpaSeatRepository.findAllById(seatIds).stream()
                .map(SeatEntity::toDomain)
                .toList();
    }

    @Override
    public List<Seat> findByScreenId(Long screenId) {
        log.debug("Finding seats by screen: screenId={}", screenId);
        return jpaSeatRepository.findByScreenIdOrderByRowLabelAscSeatNumberAsc(screenId).stream()
                .map(SeatEntity::toDomain)
                .toList();
    }

    @Override
    public List<Seat> saveAll(List<Seat> seats) {
        List<SeatEntity> entities = seats.stream()
                .map(SeatEntity::fromDomain)
                .toList();
        return jpaSeatRepository.saveAll(entities).stream()
                .map(SeatEntity::toDomain)
                .toList();
    }
}
