package personal.cinema.core.booking.application.port.in;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

/**
 * Hold Seat Command
 * 좌석 홀드 커맨드
 */
public record HoldSeatCommand(
        Long userId,
        Long showingId,
        Long seatId,
        String sessionId
) {
    public HoldSeatCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (showingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Showing ID cannot be null");
        }
        if (seatId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seat ID cannot be null");
        }
    }
}
