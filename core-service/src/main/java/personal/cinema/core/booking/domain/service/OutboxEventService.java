package personal.cinema.core.booking.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.cinema.core.booking.application.port.in.PublishPendingEventsUseCase;
import personal.cinema.core.booking.application.port.out.BookingEventPublisher;
import personal.cinema.core.booking.application.port.out.OutboxEventRepository;
import personal.cinema.core.booking.domain.model.OutboxEvent;
import personal.cinema.core.config.BookingProperties;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Outbox Event Service
 * 대기 중인 예매 이벤트를 Kafka로 발행하는 도메인 서비스
 * 실패한 이벤트는 재시도 횟수를 올리고, 한도에 도달하면 FAILED로 남긴다.
 */
@Slf4j
@Service
public class OutboxEventService implements PublishPendingEventsUseCase {

    private final OutboxEventRepository outboxEventRepository;
    private final BookingEventPublisher eventPublisher;
    private final Clock clock;
    private final int maxRetryCount;

    public OutboxEventService(OutboxEventRepository outboxEventRepository,
                              BookingEventPublisher eventPublisher,
                              Clock clock,
                              BookingProperties properties) {
        this.outboxEventRepository = outboxEventRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxRetryCount = properties.getOutbox().getMaxRetryCount();
    }

    @Override
    @Transactional
    public int publishPendingEvents() {
        List<OutboxEvent> pendingEvents = outboxEventRepository.findPendingEvents(maxRetryCount);
        int publishedCount = 0;

        for (OutboxEvent event : pendingEvents) {
            try {
                String topic = BookingEventType.topicOf(event.eventType());

                // Key: bookingId (같은 예매의 이벤트 순서 보장)
                String key = String.valueOf(event.aggregateId());

                log.debug("Publishing event: id={}, type={}, topic={}", event.id(), event.eventType(), topic);
                eventPublisher.publishRaw(topic, key, event.payload());

                outboxEventRepository.save(event.markAsPublished(LocalDateTime.now(clock)));
                publishedCount++;

            } catch (Exception e) {
                log.error("Failed to publish event: id={}, retryCount={}", event.id(), event.retryCount(), e);

                OutboxEvent retriedEvent = event.incrementRetryCount();
                if (retriedEvent.retryCount() >= maxRetryCount) {
                    retriedEvent = retriedEvent.markAsFailed();
                    log.warn("Outbox event marked as failed: id={}", event.id());
                }
                outboxEventRepository.save(retriedEvent);
            }
        }
        return publishedCount;
    }
}
