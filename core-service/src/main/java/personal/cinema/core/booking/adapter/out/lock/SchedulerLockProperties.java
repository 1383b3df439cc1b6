package personal.cinema.core.booking.adapter.out.lock;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Scheduler Lock 설정 Properties
 *
 * 설정 예시:
 * scheduler:
 *   lock:
 *     strategy: redis # none | redis
 *     ttl-seconds: 30
 *     key-prefix: cinema:scheduler:lock
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "scheduler.lock")
public class SchedulerLockProperties {

    /**
     * 락 전략
     * - none: 락 사용 안 함 (로컬 개발)
     * - redis: Redis SETNX 분산 락 (운영)
     */
    private String strategy = "none";

    /**
     * 락 TTL (초), 스윕 최대 실행 시간보다 길게 잡는다.
     */
    private int ttlSeconds = 30;

    /**
     * 락 키 접두사, 같은 Redis를 쓰는 다른 서비스와 구분한다.
     */
    private String keyPrefix = "cinema:scheduler:lock";
}
