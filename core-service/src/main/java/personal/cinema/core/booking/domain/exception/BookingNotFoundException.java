package personal.cinema.core.booking.domain.exception;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

/**
 * Booking Not Found Exception
 * 예매가 없거나 요청자 소유가 아닌 경우 발생
 */
public class BookingNotFoundException extends BusinessException {
    public BookingNotFoundException(Long bookingId) {
        super(ErrorCode.BOOKING_NOT_FOUND,
                String.format("Booking not found: bookingId=%d", bookingId));
    }
}
