package personal.cinema.core.booking.application.port.in;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

/**
 * Confirm Booking Command
 */
public record ConfirmBookingCommand(
        Long bookingId,
        Long userId,
        String paymentMethod,
        String paymentReference
) {
    public ConfirmBookingCommand {
        if (bookingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null");
        }
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (paymentMethod == null || paymentMethod.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Payment method cannot be null or blank");
        }
        if (paymentReference == null || paymentReference.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Payment reference cannot be null or blank");
        }
    }
}
