package personal.cinema.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.cinema.core.booking.domain.model.OutboxEvent;
import personal.cinema.core.booking.domain.model.OutboxEvent.OutboxEventStatus;

import java.time.LocalDateTime;

/**
 * Outbox Event Entity
 * 예매 상태 전이와 같은 트랜잭션에서 기록되는 Kafka 발행 대기 이벤트
 */
@Entity
@Table(name = "outbox_events",
        indexes = {
                @Index(name = "idx_outbox_status_created", columnList = "status, created_at"),
                @Index(name = "idx_outbox_aggregate", columnList = "aggregate_type, aggregate_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private Long aggregateId;

    // BOOKING_CREATED, BOOKING_CONFIRMED, BOOKING_CANCELLED, BOOKING_EXPIRED
    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    // 예매 스냅샷 JSON (Kafka 메시지 본문)
    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OutboxEventStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    public static OutboxEventEntity fromDomain(OutboxEvent domain) {
        OutboxEventEntity entity = new OutboxEventEntity();
        entity.id = domain.id();
        entity.aggregateType = domain.aggregateType();
        entity.aggregateId = domain.aggregateId();
        entity.eventType = domain.eventType();
        entity.payload = domain.payload();
        entity.status = domain.status();
        entity.createdAt = domain.createdAt();
        entity.publishedAt = domain.publishedAt();
        entity.retryCount = domain.retryCount();
        return entity;
    }

    public OutboxEvent toDomain() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                status, createdAt, publishedAt, retryCount);
    }
}
