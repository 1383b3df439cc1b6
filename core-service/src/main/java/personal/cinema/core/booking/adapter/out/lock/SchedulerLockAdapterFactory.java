package personal.cinema.core.booking.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.cinema.core.booking.application.port.out.SchedulerLockPort;

import java.time.Duration;

/**
 * Scheduler Lock Adapter Factory
 * 설정에 따라 적절한 SchedulerLockPort 구현체를 생성
 *
 * 설정:
 * - scheduler.lock.strategy=none → NoLockAdapter (로컬 개발)
 * - scheduler.lock.strategy=redis → RedisLockAdapter (운영)
 */
@Slf4j
@Configuration
public class SchedulerLockAdapterFactory {

    @Bean
    @ConditionalOnProperty(name = "scheduler.lock.strategy", havingValue = "none", matchIfMissing = true)
    public SchedulerLockPort noLockAdapter() {
        log.info("Creating NoLockAdapter - No distributed lock will be used");
        return new NoLockAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = "scheduler.lock.strategy", havingValue = "redis")
    public SchedulerLockPort redisLockAdapter(
            StringRedisTemplate redisTemplate,
            RedisScript<Long> releaseLockScript,
            SchedulerLockProperties properties) {

        log.info("Creating RedisLockAdapter - TTL: {}s, prefix: {}",
                properties.getTtlSeconds(), properties.getKeyPrefix());
        return new RedisLockAdapter(redisTemplate, releaseLockScript,
                Duration.ofSeconds(properties.getTtlSeconds()), properties.getKeyPrefix());
    }
}
