package personal.cinema.core.booking.domain.exception;

import lombok.Getter;
import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

/**
 * Seat Unavailable Exception
 * 좌석이 이미 다른 사용자에게 홀드/예매되었거나 물리적으로 판매 불가능한 경우 발생
 * HTTP 409 Conflict 반환용 (다른 좌석으로 재시도 가능)
 */
@Getter
public class SeatUnavailableException extends BusinessException {

    private final Long showingId;
    private final Long seatId;

    public SeatUnavailableException(Long showingId, Long seatId) {
        super(ErrorCode.SEAT_UNAVAILABLE,
                String.format("Seat is unavailable: showingId=%d, seatId=%d", showingId, seatId));
        this.showingId = showingId;
        this.seatId = seatId;
    }

    public SeatUnavailableException(Long showingId, Long seatId, String reason) {
        super(ErrorCode.SEAT_UNAVAILABLE,
                String.format("Seat is unavailable: showingId=%d, seatId=%d, reason=%s", showingId, seatId, reason));
        this.showingId = showingId;
        this.seatId = seatId;
    }
}
