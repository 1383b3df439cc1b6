package personal.cinema.core.booking.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.cinema.core.booking.application.port.out.SchedulerLockPort;

/**
 * NoLock Adapter
 * 락 없이 항상 실행을 허용한다.
 *
 * 사용 환경:
 * - 로컬 개발 (단일 인스턴스)
 * - 테스트
 *
 * 다중 인스턴스에서도 스윕은 멱등하지만 중복 실행된다.
 */
@Slf4j
public class NoLockAdapter implements SchedulerLockPort {

    @Override
    public boolean tryAcquire(String schedulerName, String jobKey) {
        log.debug("[NoLock] Always allow: scheduler={}, jobKey={}", schedulerName, jobKey);
        return true;
    }

    @Override
    public void release(String schedulerName, String jobKey) {
        // No-op
    }

    @Override
    public String getStrategyName() {
        return "none";
    }
}
