package personal.cinema.core.booking.application.port.in;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

/**
 * Cancel Booking Command
 */
public record CancelBookingCommand(
        Long bookingId,
        Long userId,
        String reason
) {
    public CancelBookingCommand {
        if (bookingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null");
        }
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
    }
}
