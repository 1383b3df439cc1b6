package personal.cinema.core.booking.application.port.out;

/**
 * Booking Event Publisher (Output Port)
 * Kafka 이벤트 발행 인터페이스
 */
public interface BookingEventPublisher {

    /**
     * Raw Event 발행 (Outbox Pattern용)
     * 이미 직렬화된 JSON Payload를 그대로 발행하고 브로커 응답까지 기다린다.
     *
     * @param topic   발행할 Kafka 토픽
     * @param key     메시지 키 (순서 보장용, bookingId)
     * @param payload 메시지 본문 (JSON String)
     */
    void publishRaw(String topic, String key, String payload);
}
