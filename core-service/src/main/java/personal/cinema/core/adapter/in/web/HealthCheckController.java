package personal.cinema.core.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.cinema.common.dto.ApiResponse;
import personal.cinema.common.dto.HealthCheckResponse;
import personal.cinema.common.health.HealthCheckService;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 데이터베이스, Redis, Kafka 연결 상태를 확인하는 엔드포인트
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;

    /**
     * GET /api/v1/health
     * 일부 구성 요소가 DOWN이어도 200을 반환하고, result 필드로 구분한다.
     */
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        HealthCheckResponse data = new HealthCheckResponse(
                healthCheckService.checkDatabase(dataSource),
                healthCheckService.checkRedis(),
                healthCheckService.checkKafka()
        );

        if (data.isHealthy()) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }
}
