package personal.cinema.core.booking.application.port.out;

/**
 * Seat Lock Repository (Output Port)
 * DB 트랜잭션 이전의 fail-fast 좌석 선점 인터페이스
 *
 * 구현체:
 * - NoSeatLockAdapter: 항상 통과 (DB 락과 유니크 제약만 사용)
 * - RedisSeatLockAdapter: Redis SETNX 기반 선점
 */
public interface SeatLockRepository {

    /**
     * 좌석 선점 시도
     * 선점 실패 시 대기하지 않고 즉시 false 반환
     *
     * @param showingId 상영 ID
     * @param seatId    좌석 ID
     * @param userId    사용자 ID (락 소유자)
     * @return true: 선점 성공, false: 다른 요청이 처리 중
     */
    boolean tryLock(Long showingId, Long seatId, Long userId);

    /**
     * 좌석 선점 해제 (소유자 검증 후 삭제)
     */
    void unlock(Long showingId, Long seatId, Long userId);
}
