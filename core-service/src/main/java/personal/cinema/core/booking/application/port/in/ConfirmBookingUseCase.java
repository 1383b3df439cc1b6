package personal.cinema.core.booking.application.port.in;

import personal.cinema.core.booking.domain.model.Booking;

/**
 * Confirm Booking UseCase (Input Port)
 */
public interface ConfirmBookingUseCase {

    /**
     * 예매 확정 (PENDING -> CONFIRMED)
     * 상영 시작 여부와 무관하게 확정할 수 있다.
     *
     * @throws personal.cinema.core.booking.domain.exception.BookingExpiredException 만료된 경우 (예매는 EXPIRED로 저장됨)
     * @throws personal.cinema.core.booking.domain.exception.InvalidBookingTransitionException PENDING이 아닌 경우
     * @throws personal.cinema.core.booking.domain.exception.BookingNotFoundException 없거나 타인 소유인 경우
     */
    Booking confirmBooking(ConfirmBookingCommand command);
}
