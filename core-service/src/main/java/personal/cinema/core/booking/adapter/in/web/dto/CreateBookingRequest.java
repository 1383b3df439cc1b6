package personal.cinema.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.cinema.core.booking.application.port.in.CreateBookingCommand;

import java.util.List;

/**
 * 예매 생성 요청 DTO
 */
public record CreateBookingRequest(
        @NotNull(message = "상영 ID는 필수입니다.")
        Long showingId,

        @NotEmpty(message = "좌석을 하나 이상 선택해야 합니다.")
        List<@NotNull Long> seatIds,

        @Size(max = 500, message = "메모는 500자를 넘을 수 없습니다.")
        String notes
) {
    public CreateBookingCommand toCommand(Long userId) {
        return new CreateBookingCommand(userId, showingId, seatIds, notes);
    }
}
