package personal.cinema.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Clock Configuration
 * 모든 만료 판정은 이 Clock 기준으로 수행한다. (테스트에서 교체 가능)
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
