package personal.cinema.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import personal.cinema.core.booking.domain.model.OutboxEvent.OutboxEventStatus;

import java.util.List;

/**
 * Spring Data JPA Repository for OutboxEvent
 */
public interface JpaOutboxEventRepository extends JpaRepository<OutboxEventEntity, Long> {

    /**
     * 예매 한 건의 이벤트 이력 (idx_outbox_aggregate)
     */
    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderByIdAsc(String aggregateType, Long aggregateId);

    /**
     * 발행 대상: PENDING이고 재시도 한도 미만, 같은 예매의 이벤트 순서를 지키도록 생성순
     */
    List<OutboxEventEntity> findByStatusAndRetryCountLessThanOrderByCreatedAtAscIdAsc(
            OutboxEventStatus status,
            int maxRetryCount
    );
}
