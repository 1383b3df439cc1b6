package personal.cinema.core.booking.domain.model;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

import java.math.BigDecimal;

/**
 * Booked Seat Domain Model
 * 예매에 포함된 좌석과 예매 시점에 고정된 가격
 */
public record BookedSeat(
        Long id,
        Long seatId,
        BigDecimal pricePaid
) {
    public BookedSeat {
        if (seatId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seat ID cannot be null");
        }
        if (pricePaid == null || pricePaid.compareTo(BigDecimal.ZERO) < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Price paid must not be negative");
        }
    }

    public static BookedSeat of(Long seatId, BigDecimal pricePaid) {
        return new BookedSeat(null, seatId, pricePaid);
    }
}
