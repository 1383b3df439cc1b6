package personal.cinema.core.booking.adapter.out.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.cinema.core.booking.application.port.out.SchedulerLockPort;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Redis Lock Adapter
 * 여러 인스턴스 중 하나만 스윕 작업을 실행하도록 하는 분산 락
 *
 * 사용 환경:
 * - 운영 환경 (다중 인스턴스)
 */
@Slf4j
@RequiredArgsConstructor
public class RedisLockAdapter implements SchedulerLockPort {

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> releaseLockScript;
    private final Duration lockTtl;
    private final String keyPrefix;

    // 인스턴스 고유 ID (락 소유자 식별용)
    private final String instanceId = UUID.randomUUID().toString();

    @Override
    public boolean tryAcquire(String schedulerName, String jobKey) {
        String lockKey = buildLockKey(schedulerName, jobKey);

        try {
            boolean acquired = Boolean.TRUE.equals(
                    redisTemplate.opsForValue().setIfAbsent(lockKey, instanceId, lockTtl));

            if (acquired) {
                log.debug("[RedisLock] Lock acquired: key={}, instanceId={}", lockKey, instanceId);
            } else {
                log.debug("[RedisLock] Lock not acquired (already held): key={}", lockKey);
            }
            return acquired;

        } catch (Exception e) {
            log.error("[RedisLock] Failed to acquire lock: key={}", lockKey, e);
            return false;
        }
    }

    @Override
    public void release(String schedulerName, String jobKey) {
        String lockKey = buildLockKey(schedulerName, jobKey);

        try {
            Long released = redisTemplate.execute(releaseLockScript, List.of(lockKey), instanceId);

            if (released != null && released > 0) {
                log.debug("[RedisLock] Lock released: key={}", lockKey);
            } else {
                log.debug("[RedisLock] Lock not released (not owner or expired): key={}", lockKey);
            }
        } catch (Exception e) {
            // TTL에 의해 자동 해제된다.
            log.error("[RedisLock] Failed to release lock: key={}", lockKey, e);
        }
    }

    @Override
    public String getStrategyName() {
        return "redis";
    }

    private String buildLockKey(String schedulerName, String jobKey) {
        return String.format("%s:%s:%s", keyPrefix, schedulerName, jobKey);
    }
}
