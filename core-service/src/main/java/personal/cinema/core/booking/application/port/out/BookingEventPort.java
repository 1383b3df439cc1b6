package personal.cinema.core.booking.application.port.out;

import personal.cinema.core.booking.domain.model.Booking;
import personal.cinema.core.booking.domain.model.BookingHistory;

/**
 * Booking Event Port
 * 예매 상태 변경 이벤트 기록 책임 (Outbox 패턴)
 * 호출자의 트랜잭션 안에서 outbox 행을 남긴다.
 */
public interface BookingEventPort {

    /**
     * 예매 상태 변경 이벤트 기록
     *
     * @param booking 상태가 바뀐 예매
     * @param history 같은 전이에 대한 감사 로그
     */
    void publishBookingEvent(Booking booking, BookingHistory history);
}
