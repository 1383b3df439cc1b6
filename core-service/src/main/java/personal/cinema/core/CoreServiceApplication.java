package personal.cinema.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Core Service Application
 * 좌석 홀드/예매 코어 서비스
 */
@EnableScheduling  // Expiry Sweep, Outbox Scheduler 활성화
@SpringBootApplication(
    scanBasePackages = {
        "personal.cinema.core",
        "personal.cinema.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class CoreServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CoreServiceApplication.class, args);
    }
}
