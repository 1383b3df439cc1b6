package personal.cinema.common.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.TimeUnit;

/**
 * Health Check 공통 유틸리티 서비스
 * 각 인프라 컴포넌트의 상태를 확인한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    private static final String UP = "UP";
    private static final String DOWN = "DOWN";

    private final StringRedisTemplate redisTemplate;
    private final KafkaAdmin kafkaAdmin;

    /**
     * Redis 연결 상태 확인
     *
     * @return "UP" if Redis answers PING, "DOWN" otherwise
     */
    public String checkRedis() {
        try {
            String response = redisTemplate.execute((RedisConnection connection) -> connection.ping());
            return "PONG".equals(response) ? UP : DOWN;
        } catch (Exception e) {
            log.error("Redis health check failed", e);
            return DOWN;
        }
    }

    /**
     * Kafka 연결 상태 확인
     *
     * @return "UP" if the cluster reports at least one node, "DOWN" otherwise
     */
    public String checkKafka() {
        try (AdminClient adminClient = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            var nodes = adminClient.describeCluster().nodes().get(5, TimeUnit.SECONDS);
            return (nodes != null && !nodes.isEmpty()) ? UP : DOWN;
        } catch (Exception e) {
            log.error("Kafka health check failed", e);
            return DOWN;
        }
    }

    /**
     * 데이터베이스 연결 상태 확인
     *
     * @param dataSource the DataSource to check
     * @return "UP" if a valid connection can be obtained, "DOWN" otherwise
     */
    public String checkDatabase(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(1) ? UP : DOWN;
        } catch (Exception e) {
            log.error("Database health check failed", e);
            return DOWN;
        }
    }
}
