package personal.cinema.core.booking.domain.exception;

import lombok.Getter;
import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;
import personal.cinema.core.booking.domain.model.BookingStatus;

/**
 * Invalid Booking Transition Exception
 * 상태 머신이 허용하지 않는 전이를 시도한 경우 발생 (클라이언트 오류, 재시도 불가)
 */
@Getter
public class InvalidBookingTransitionException extends BusinessException {

    private final BookingStatus currentStatus;
    private final BookingStatus attemptedStatus;

    public InvalidBookingTransitionException(Long bookingId, BookingStatus currentStatus,
                                             BookingStatus attemptedStatus) {
        super(ErrorCode.INVALID_BOOKING_TRANSITION,
                String.format("Cannot move booking from %s to %s: bookingId=%d",
                        currentStatus, attemptedStatus, bookingId));
        this.currentStatus = currentStatus;
        this.attemptedStatus = attemptedStatus;
    }

    public InvalidBookingTransitionException(Long bookingId, BookingStatus currentStatus,
                                             BookingStatus attemptedStatus, String reason) {
        super(ErrorCode.INVALID_BOOKING_TRANSITION,
                String.format("Cannot move booking from %s to %s: bookingId=%d, reason=%s",
                        currentStatus, attemptedStatus, bookingId, reason));
        this.currentStatus = currentStatus;
        this.attemptedStatus = attemptedStatus;
    }
}
