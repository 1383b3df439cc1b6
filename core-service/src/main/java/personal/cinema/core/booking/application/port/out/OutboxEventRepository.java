package personal.cinema.core.booking.application.port.out;

import personal.cinema.core.booking.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Repository (Output Port)
 * Transactional Outbox Pattern을 위한 이벤트 저장소 인터페이스
 */
public interface OutboxEventRepository {

    OutboxEvent save(OutboxEvent outboxEvent);

    /**
     * 발행 대기 중인 이벤트 조회 (생성순)
     *
     * @param maxRetryCount 이 횟수 이상 실패한 이벤트는 제외
     * @return PENDING 상태의 이벤트 목록
     */
    List<OutboxEvent> findPendingEvents(int maxRetryCount);

    /**
     * 한 예매에 대해 기록된 이벤트 (기록순)
     */
    List<OutboxEvent> findByBookingId(Long bookingId);
}
