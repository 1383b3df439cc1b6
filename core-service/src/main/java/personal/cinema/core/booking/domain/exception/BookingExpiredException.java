package personal.cinema.core.booking.domain.exception;

import lombok.Getter;
import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

/**
 * Booking Expired Exception
 * 결제 대기(PENDING) 예매가 만료 시각을 넘긴 경우 발생
 */
@Getter
public class BookingExpiredException extends BusinessException {

    private final Long bookingId;

    public BookingExpiredException(Long bookingId) {
        super(ErrorCode.BOOKING_EXPIRED,
                String.format("Booking has expired: bookingId=%d", bookingId));
        this.bookingId = bookingId;
    }
}
