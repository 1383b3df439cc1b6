package personal.cinema.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.cinema.core.booking.application.port.out.BookingRepository;
import personal.cinema.core.booking.application.port.out.SeatRepository;
import personal.cinema.core.booking.application.port.out.SeatReservationRepository;
import personal.cinema.core.booking.domain.model.Seat;
import personal.cinema.core.booking.domain.model.SeatAvailability;
import personal.cinema.core.booking.domain.model.SeatReservation;
import personal.cinema.core.booking.domain.model.SeatState;
import personal.cinema.core.booking.domain.model.Showing;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Availability Resolver
 * 상영의 좌석 중 지금 구매 가능한 좌석을 계산한다. (부수 효과 없음)
 *
 * 가용 좌석 = 상영관 좌석 중 물리 상태 AVAILABLE
 *          - (CONFIRMED 또는 만료 전 PENDING 예매의 좌석)
 *          - (살아있는 홀드의 좌석)
 *
 * 뒤따르는 변경과 같은 트랜잭션 안에서 호출되어야 한다.
 */
@Component
@RequiredArgsConstructor
public class AvailabilityResolver {

    private final SeatRepository seatRepository;
    private final SeatReservationRepository seatReservationRepository;
    private final BookingRepository bookingRepository;

    /**
     * 구매 가능한 좌석 목록 (좌석 ID 오름차순)
     */
    public List<Seat> availableSeats(Showing showing, LocalDateTime now) {
        return seatMap(showing, now).stream()
                .filter(SeatAvailability::isAvailable)
                .map(SeatAvailability::seat)
                .sorted(Comparator.comparing(Seat::id))
                .toList();
    }

    /**
     * 단일 좌석 가용 여부
     */
    public boolean isSeatAvailable(Showing showing, Seat seat, LocalDateTime now) {
        return stateOf(showing, seat, now) == SeatState.AVAILABLE;
    }

    /**
     * 단일 좌석의 현재 상태
     * 상영관이 다른 좌석은 UNAVAILABLE로 본다.
     */
    public SeatState stateOf(Showing showing, Seat seat, LocalDateTime now) {
        if (!seat.isOnScreen(showing.screenId()) || !seat.isPhysicallyAvailable()) {
            return SeatState.UNAVAILABLE;
        }
        if (bookingRepository.findActiveSeatIds(showing.id(), now).contains(seat.id())) {
            return SeatState.BOOKED;
        }
        if (seatReservationRepository.findLive(showing.id(), seat.id(), now).isPresent()) {
            return SeatState.HELD;
        }
        return SeatState.AVAILABLE;
    }

    /**
     * 상영의 전체 좌석 현황 (상영관 좌석 배치 순)
     */
    public List<SeatAvailability> seatMap(Showing showing, LocalDateTime now) {
        List<Seat> seats = seatRepository.findByScreenId(showing.screenId());
        Set<Long> bookedSeatIds = bookingRepository.findActiveSeatIds(showing.id(), now);
        Map<Long, SeatReservation> liveHolds = liveHoldsBySeat(showing, now);

        return seats.stream()
                .map(seat -> new SeatAvailability(
                        seat,
                        resolve(seat, bookedSeatIds, liveHolds),
                        showing.priceFor(seat)))
                .toList();
    }

    /**
     * 상영의 살아있는 홀드 (좌석 ID 기준)
     */
    public Map<Long, SeatReservation> liveHoldsBySeat(Showing showing, LocalDateTime now) {
        return seatReservationRepository.findLiveByShowingId(showing.id(), now).stream()
                .collect(Collectors.toMap(SeatReservation::seatId, Function.identity()));
    }

    private SeatState resolve(Seat seat, Set<Long> bookedSeatIds, Map<Long, SeatReservation> liveHolds) {
        if (!seat.isPhysicallyAvailable()) {
            return SeatState.UNAVAILABLE;
        }
        if (bookedSeatIds.contains(seat.id())) {
            return SeatState.BOOKED;
        }
        if (liveHolds.containsKey(seat.id())) {
            return SeatState.HELD;
        }
        return SeatState.AVAILABLE;
    }
}
