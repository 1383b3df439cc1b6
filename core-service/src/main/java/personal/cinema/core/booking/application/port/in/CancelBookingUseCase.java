package personal.cinema.core.booking.application.port.in;

import personal.cinema.core.booking.domain.model.Booking;

/**
 * Cancel Booking UseCase (Input Port)
 */
public interface CancelBookingUseCase {

    /**
     * 예매 취소 (-> CANCELLED)
     * 상영 시작 이후에는 취소할 수 없다.
     *
     * @throws personal.cinema.core.booking.domain.exception.InvalidBookingTransitionException 허용되지 않는 상태이거나 상영이 시작된 경우
     * @throws personal.cinema.core.booking.domain.exception.BookingNotFoundException 없거나 타인 소유인 경우
     */
    Booking cancelBooking(CancelBookingCommand command);
}
