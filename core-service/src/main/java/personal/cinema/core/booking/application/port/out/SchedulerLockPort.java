package personal.cinema.core.booking.application.port.out;

/**
 * 스케줄러 락 Port
 * 여러 인스턴스에서 같은 스윕 작업이 동시에 돌지 않도록 실행을 제어한다.
 *
 * 구현체:
 * - NoLockAdapter: 락 없이 항상 실행 (로컬 개발용)
 * - RedisLockAdapter: Redis SETNX 분산 락 (운영용)
 */
public interface SchedulerLockPort {

    /**
     * 스케줄러 실행 전 락 획득 시도
     *
     * @param schedulerName 스케줄러 이름 (예: "sweep")
     * @param jobKey        작업 구분 키 (예: "holds", "bookings")
     * @return true: 실행 가능, false: 스킵 (다른 인스턴스가 처리 중)
     */
    boolean tryAcquire(String schedulerName, String jobKey);

    void release(String schedulerName, String jobKey);

    /**
     * 전략 이름 반환 (로깅/모니터링용)
     */
    String getStrategyName();
}
