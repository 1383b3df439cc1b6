package personal.cinema.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 좌석 홀드/예매 설정 Properties
 *
 * 설정 예시:
 * booking:
 *   hold:
 *     ttl-minutes: 15
 *     default-extension-minutes: 15
 *   pending-ttl-minutes: 15
 *   sweep:
 *     enabled: true
 *     interval-ms: 30000
 *   seat-lock:
 *     strategy: none # none | redis
 *     ttl-seconds: 5
 *   outbox:
 *     enabled: true
 *     max-retry-count: 3
 *     interval-ms: 500
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "booking")
public class BookingProperties {

    private Hold hold = new Hold();

    /**
     * PENDING 예매의 결제 대기 시간 (분)
     */
    private int pendingTtlMinutes = 15;

    private Sweep sweep = new Sweep();

    private SeatLock seatLock = new SeatLock();

    private Outbox outbox = new Outbox();

    public Duration holdTtl() {
        return Duration.ofMinutes(hold.getTtlMinutes());
    }

    public Duration pendingTtl() {
        return Duration.ofMinutes(pendingTtlMinutes);
    }

    @Getter
    @Setter
    public static class Hold {
        private int ttlMinutes = 15;
        private int defaultExtensionMinutes = 15;
    }

    @Getter
    @Setter
    public static class Sweep {
        private boolean enabled = true;
        private long intervalMs = 30000;
    }

    @Getter
    @Setter
    public static class SeatLock {
        /**
         * - none: DB 락과 유니크 제약만 사용
         * - redis: Redis SETNX로 먼저 걸러냄
         */
        private String strategy = "none";

        /**
         * 선점 락 TTL (초), 홀드 트랜잭션 최대 시간보다 길어야 한다.
         */
        private int ttlSeconds = 5;
    }

    @Getter
    @Setter
    public static class Outbox {
        private boolean enabled = true;
        private int maxRetryCount = 3;

        /**
         * 발행 주기 (ms, 이전 실행 종료 기준)
         */
        private long intervalMs = 500;
    }
}
