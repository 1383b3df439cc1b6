package personal.cinema.core.booking.domain.model;

/**
 * 특정 상영에서의 좌석 유효 상태 (좌석 배치도 표시용)
 */
public enum SeatState {
    AVAILABLE,
    HELD,
    BOOKED,
    UNAVAILABLE
}
