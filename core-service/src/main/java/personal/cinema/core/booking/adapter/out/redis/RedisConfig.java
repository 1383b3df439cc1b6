package personal.cinema.core.booking.adapter.out.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis Configuration
 * 락 해제용 Lua Script (소유자 확인 후 삭제)
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisScript<Long> releaseLockScript() {
        return RedisScript.of(new ClassPathResource("scripts/release_lock.lua"), Long.class);
    }
}
