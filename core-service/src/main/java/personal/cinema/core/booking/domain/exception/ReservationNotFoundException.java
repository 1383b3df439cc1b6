package personal.cinema.core.booking.domain.exception;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

/**
 * Reservation Not Found Exception
 * 홀드가 없거나, 요청자 소유가 아니거나, 이미 만료된 경우 발생
 */
public class ReservationNotFoundException extends BusinessException {
    public ReservationNotFoundException(Long reservationId) {
        super(ErrorCode.RESERVATION_NOT_FOUND,
                String.format("Reservation not found: reservationId=%d", reservationId));
    }
}
