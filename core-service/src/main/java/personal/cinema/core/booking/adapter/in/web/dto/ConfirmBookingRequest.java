package personal.cinema.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.cinema.core.booking.application.port.in.ConfirmBookingCommand;

/**
 * 예매 확정(결제 완료) 요청 DTO
 */
public record ConfirmBookingRequest(
        @NotBlank(message = "결제 수단은 필수입니다.")
        @Size(max = 50)
        String paymentMethod,

        @NotBlank(message = "결제 참조 번호는 필수입니다.")
        @Size(max = 100)
        String paymentReference
) {
    public ConfirmBookingCommand toCommand(Long bookingId, Long userId) {
        return new ConfirmBookingCommand(bookingId, userId, paymentMethod, paymentReference);
    }
}
