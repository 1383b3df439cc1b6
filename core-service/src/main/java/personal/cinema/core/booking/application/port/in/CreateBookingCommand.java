package personal.cinema.core.booking.application.port.in;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Create Booking Command
 * 좌석 목록은 비어 있지 않고 중복이 없어야 한다.
 */
public record CreateBookingCommand(
        Long userId,
        Long showingId,
        List<Long> seatIds,
        String notes
) {
    public CreateBookingCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (showingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Showing ID cannot be null");
        }
        if (seatIds == null || seatIds.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "At least one seat is required");
        }
        if (seatIds.stream().anyMatch(Objects::isNull)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seat ID cannot be null");
        }
        if (new HashSet<>(seatIds).size() != seatIds.size()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seat IDs must not contain duplicates");
        }
        seatIds = List.copyOf(seatIds);
    }
}
