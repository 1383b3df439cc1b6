package personal.cinema.core.booking.domain.exception;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

/**
 * Seat Not Found Exception
 * 좌석이 없거나 상영관에 속하지 않는 경우 발생
 */
public class SeatNotFoundException extends BusinessException {
    public SeatNotFoundException(Long seatId) {
        super(ErrorCode.SEAT_NOT_FOUND,
                String.format("Seat not found: seatId=%d", seatId));
    }

    public SeatNotFoundException(Long seatId, Long screenId) {
        super(ErrorCode.SEAT_NOT_FOUND,
                String.format("Seat does not belong to screen: seatId=%d, screenId=%d", seatId, screenId));
    }
}
