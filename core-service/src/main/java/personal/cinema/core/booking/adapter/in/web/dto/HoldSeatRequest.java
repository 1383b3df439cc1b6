package personal.cinema.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.cinema.core.booking.application.port.in.HoldSeatCommand;

/**
 * 좌석 홀드 요청 DTO
 */
public record HoldSeatRequest(
        @NotNull(message = "상영 ID는 필수입니다.")
        Long showingId,

        @NotNull(message = "좌석 ID는 필수입니다.")
        Long seatId,

        @Size(max = 100, message = "세션 ID는 100자를 넘을 수 없습니다.")
        String sessionId
) {
    public HoldSeatCommand toCommand(Long userId) {
        return new HoldSeatCommand(userId, showingId, seatId, sessionId);
    }
}
