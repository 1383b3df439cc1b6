package personal.cinema.core.booking.domain.service;

import personal.cinema.core.booking.domain.model.BookingAction;

import java.util.Arrays;

/**
 * 예매 이벤트 타입과 Kafka 토픽 매핑
 */
public enum BookingEventType {
    BOOKING_CREATED(BookingAction.CREATED, "booking.created"),
    BOOKING_CONFIRMED(BookingAction.CONFIRMED, "booking.confirmed"),
    BOOKING_CANCELLED(BookingAction.CANCELLED, "booking.cancelled"),
    BOOKING_EXPIRED(BookingAction.EXPIRED, "booking.expired"),
    BOOKING_REFUNDED(BookingAction.REFUNDED, "booking.refunded");

    private final BookingAction action;
    private final String topic;

    BookingEventType(BookingAction action, String topic) {
        this.action = action;
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }

    public static BookingEventType of(BookingAction action) {
        return Arrays.stream(values())
                .filter(type -> type.action == action)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown booking action: " + action));
    }

    public static String topicOf(String eventType) {
        return valueOf(eventType).getTopic();
    }
}
