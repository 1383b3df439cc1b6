package personal.cinema.core.booking.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;
import personal.cinema.core.booking.domain.model.Booking;
import personal.cinema.core.booking.domain.model.BookingHistory;
import personal.cinema.core.booking.domain.model.OutboxEvent;
import personal.cinema.core.booking.domain.service.BookingEventType;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Outbox Event Factory (Adapter Layer)
 * 예매 상태 변경을 OutboxEvent로 변환하는 팩토리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventFactory {

    private final ObjectMapper objectMapper;

    public OutboxEvent createBookingEvent(Booking booking, BookingHistory history) {
        BookingEventType type = BookingEventType.of(history.action());
        BookingEventPayload event = new BookingEventPayload(
                booking.id(),
                booking.bookingReference(),
                booking.userId(),
                booking.showingId(),
                booking.status().name(),
                booking.totalAmount(),
                booking.seatIds(),
                history.actor(),
                history.occurredAt().toString(),
                history.metadata());

        try {
            String payload = objectMapper.writeValueAsString(event);
            return OutboxEvent.pending(booking.id(), type.name(), payload, history.occurredAt());
        } catch (JsonProcessingException e) {
            log.error("Failed to create outbox event: bookingId={}, type={}", booking.id(), type, e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to create outbox event");
        }
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record BookingEventPayload(
            Long bookingId,
            String bookingReference,
            Long userId,
            Long showingId,
            String status,
            BigDecimal totalAmount,
            List<Long> seatIds,
            String actor,
            String occurredAt,
            Map<String, String> metadata) {
    }
}
