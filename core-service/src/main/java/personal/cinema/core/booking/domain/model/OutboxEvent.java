package personal.cinema.core.booking.domain.model;

import java.time.LocalDateTime;

/**
 * Outbox Event Domain Model
 * 예매 트랜잭션과 함께 저장되어 나중에 Kafka로 발행되는 이벤트 (불변)
 */
public record OutboxEvent(
        Long id,
        String aggregateType,
        Long aggregateId,
        String eventType,
        String payload,
        OutboxEventStatus status,
        LocalDateTime createdAt,
        LocalDateTime publishedAt,
        int retryCount
) {
    public static final String AGGREGATE_BOOKING = "BOOKING";

    public static OutboxEvent pending(Long bookingId, String eventType, String payload, LocalDateTime now) {
        return new OutboxEvent(null, AGGREGATE_BOOKING, bookingId, eventType, payload,
                OutboxEventStatus.PENDING, now, null, 0);
    }

    public OutboxEvent markAsPublished(LocalDateTime now) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PUBLISHED, createdAt, now, retryCount);
    }

    public OutboxEvent incrementRetryCount() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                status, createdAt, publishedAt, retryCount + 1);
    }

    public OutboxEvent markAsFailed() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.FAILED, createdAt, publishedAt, retryCount);
    }

    public enum OutboxEventStatus {
        PENDING,    // 발행 대기
        PUBLISHED,  // 발행 완료
        FAILED      // 재시도 한도 초과
    }
}
