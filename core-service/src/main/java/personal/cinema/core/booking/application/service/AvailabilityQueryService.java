package personal.cinema.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.cinema.core.booking.application.port.in.GetAvailableSeatsUseCase;
import personal.cinema.core.booking.application.port.out.ShowingRepository;
import personal.cinema.core.booking.domain.exception.ShowingNotFoundException;
import personal.cinema.core.booking.domain.model.Seat;
import personal.cinema.core.booking.domain.model.SeatAvailability;
import personal.cinema.core.booking.domain.model.Showing;
import personal.cinema.core.booking.domain.service.AvailabilityResolver;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Availability Query Service
 * 상영별 좌석 가용성 조회 (읽기 전용)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AvailabilityQueryService implements GetAvailableSeatsUseCase {

    private final ShowingRepository showingRepository;
    private final AvailabilityResolver availabilityResolver;
    private final Clock clock;

    @Override
    public List<Long> getAvailableSeatIds(Long showingId) {
        Showing showing = loadShowing(showingId);
        List<Long> seatIds = availabilityResolver.availableSeats(showing, LocalDateTime.now(clock)).stream()
                .map(Seat::id)
                .toList();

        log.debug("Available seats: showingId={}, count={}", showingId, seatIds.size());
        return seatIds;
    }

    @Override
    public List<SeatAvailability> getSeatMap(Long showingId) {
        return availabilityResolver.seatMap(loadShowing(showingId), LocalDateTime.now(clock));
    }

    private Showing loadShowing(Long showingId) {
        return showingRepository.findById(showingId)
                .orElseThrow(() -> new ShowingNotFoundException(showingId));
    }
}
