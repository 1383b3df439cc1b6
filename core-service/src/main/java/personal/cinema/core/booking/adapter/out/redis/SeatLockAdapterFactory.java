package personal.cinema.core.booking.adapter.out.redis;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.cinema.core.booking.application.port.out.SeatLockRepository;
import personal.cinema.core.config.BookingProperties;

import java.time.Duration;

/**
 * Seat Lock Adapter Factory
 * 설정에 따라 SeatLockRepository 구현체를 생성
 *
 * 설정:
 * - booking.seat-lock.strategy=none → NoSeatLockAdapter (기본값)
 * - booking.seat-lock.strategy=redis → RedisSeatLockAdapter
 */
@Slf4j
@Configuration
public class SeatLockAdapterFactory {

    @Bean
    @ConditionalOnProperty(name = "booking.seat-lock.strategy", havingValue = "none", matchIfMissing = true)
    public SeatLockRepository noSeatLockAdapter() {
        log.info("Creating NoSeatLockAdapter - seat contention resolved by database locks only");
        return new NoSeatLockAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = "booking.seat-lock.strategy", havingValue = "redis")
    public SeatLockRepository redisSeatLockAdapter(
            StringRedisTemplate redisTemplate,
            RedisScript<Long> releaseLockScript,
            BookingProperties properties) {

        int ttlSeconds = properties.getSeatLock().getTtlSeconds();
        log.info("Creating RedisSeatLockAdapter - TTL: {}s", ttlSeconds);
        return new RedisSeatLockAdapter(redisTemplate, releaseLockScript, Duration.ofSeconds(ttlSeconds));
    }
}
