package personal.cinema.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Size;
import personal.cinema.core.booking.application.port.in.CancelBookingCommand;

/**
 * 예매 취소 요청 DTO
 */
public record CancelBookingRequest(
        @Size(max = 500, message = "취소 사유는 500자를 넘을 수 없습니다.")
        String reason
) {
    public CancelBookingCommand toCommand(Long bookingId, Long userId) {
        return new CancelBookingCommand(bookingId, userId, reason);
    }
}
