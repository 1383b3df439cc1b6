package personal.cinema.core.booking.application.port.in;

/**
 * Publish Pending Events UseCase (Input Port)
 * 예매 생성/확정/취소/만료 이벤트를 outbox 기록 순서대로 Kafka에 발행한다.
 */
public interface PublishPendingEventsUseCase {

    /**
     * PENDING 이벤트 발행. 실패한 이벤트는 재시도 횟수를 올리고 한도에 도달하면 FAILED로 남긴다.
     *
     * @return 이번 실행에서 발행에 성공한 이벤트 수
     */
    int publishPendingEvents();
}
