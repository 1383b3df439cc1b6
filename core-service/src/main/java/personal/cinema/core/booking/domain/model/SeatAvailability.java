package personal.cinema.core.booking.domain.model;

import java.math.BigDecimal;

/**
 * 상영별 좌석 현황 한 건
 */
public record SeatAvailability(
        Seat seat,
        SeatState state,
        BigDecimal price
) {
    public boolean isAvailable() {
        return state == SeatState.AVAILABLE;
    }
}
