package personal.cinema.core.booking.application.port.out;

import personal.cinema.core.booking.domain.model.BookingHistory;

import java.util.List;

/**
 * Booking History Repository (Output Port)
 * 추가 전용 감사 로그 저장소
 */
public interface BookingHistoryRepository {

    BookingHistory save(BookingHistory history);

    /**
     * 예매의 감사 로그 (발생순)
     */
    List<BookingHistory> findByBookingId(Long bookingId);
}
