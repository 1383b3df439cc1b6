package personal.cinema.core.booking.application.port.in;

import personal.cinema.core.booking.domain.model.Booking;
import personal.cinema.core.booking.domain.model.BookingHistory;

import java.util.List;

/**
 * Get Booking UseCase (Input Port)
 * 예매 조회 유스케이스
 */
public interface GetBookingUseCase {

    /**
     * 예매 단건 조회 (소유자만)
     *
     * @throws personal.cinema.core.booking.domain.exception.BookingNotFoundException 없거나 타인 소유인 경우
     */
    Booking getBooking(Long bookingId, Long userId);

    /**
     * 사용자의 예매 목록 (최신순)
     */
    List<Booking> getBookings(Long userId);

    /**
     * 예매 감사 로그 (발생순)
     */
    List<BookingHistory> getHistory(Long bookingId, Long userId);
}
