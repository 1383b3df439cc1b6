package personal.cinema.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.cinema.core.booking.application.port.out.OutboxEventRepository;
import personal.cinema.core.booking.domain.model.OutboxEvent;
import personal.cinema.core.booking.domain.model.OutboxEvent.OutboxEventStatus;

import java.util.List;

/**
 * Outbox Event Persistence Adapter
 * 예매 이벤트는 aggregate_type=BOOKING, aggregate_id=bookingId로 저장된다.
 */
@Component
@RequiredArgsConstructor
public class OutboxEventPersistenceAdapter implements OutboxEventRepository {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;

    @Override
    public OutboxEvent save(OutboxEvent outboxEvent) {
        OutboxEventEntity saved = jpaOutboxEventRepository.save(OutboxEventEntity.fromDomain(outboxEvent));
        return saved.toDomain();
    }

    @Override
    public List<OutboxEvent> findPendingEvents(int maxRetryCount) {
        return jpaOutboxEventRepository.findByStatusAndRetryCountLessThanOrderByCreatedAtAscIdAsc(
                        OutboxEventStatus.PENDING,
                        maxRetryCount)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Override
    public List<OutboxEvent> findByBookingId(Long bookingId) {
        return jpaOutboxEventRepository
                .findByAggregateTypeAndAggregateIdOrderByIdAsc(OutboxEvent.AGGREGATE_BOOKING, bookingId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }
}
