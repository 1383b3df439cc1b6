package personal.cinema.core.booking.application.port.in;

import personal.cinema.core.booking.domain.model.Booking;

/**
 * Create Booking UseCase (Input Port)
 */
public interface CreateBookingUseCase {

    /**
     * 예매 생성 (PENDING)
     * 전부 성공하거나 전부 실패한다. 좌석 하나라도 불가하면 어떤 좌석도 점유하지 않는다.
     *
     * @param command 예매 커맨드 (userId, showingId, seatIds, notes)
     * @return 생성된 예매 (가격 스냅샷 포함)
     * @throws personal.cinema.core.booking.domain.exception.SeatUnavailableException 불가 좌석이 포함된 경우
     */
    Booking createBooking(CreateBookingCommand command);
}
