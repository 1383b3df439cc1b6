package personal.cinema.core.booking.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cinema.core.booking.adapter.out.persistence.OutboxEventFactory;
import personal.cinema.core.booking.application.port.out.BookingEventPort;
import personal.cinema.core.booking.application.port.out.OutboxEventRepository;
import personal.cinema.core.booking.domain.model.Booking;
import personal.cinema.core.booking.domain.model.BookingHistory;
import personal.cinema.core.booking.domain.model.OutboxEvent;

/**
 * Booking Event Adapter
 * Outbox 패턴을 사용한 예매 이벤트 기록 구현체
 * 호출자의 트랜잭션에 참여하므로 예매 변경과 이벤트가 함께 커밋/롤백된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventAdapter implements BookingEventPort {

    private final OutboxEventRepository outboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;

    @Override
    public void publishBookingEvent(Booking booking, BookingHistory history) {
        OutboxEvent event = outboxEventFactory.createBookingEvent(booking, history);
        outboxEventRepository.save(event);
        log.debug("Booking event recorded: bookingId={}, type={}", booking.id(), event.eventType());
    }
}
