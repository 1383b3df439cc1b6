package personal.cinema.core.booking.adapter.out.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;
import personal.cinema.core.booking.application.port.out.BookingEventPublisher;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Booking Kafka Publisher (Adapter Layer)
 * Kafka를 통한 예매 이벤트 발행 구현체
 * Outbox Service에 의해 호출되며, 브로커 응답을 기다려 실패를 재시도 카운트에 반영한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingKafkaPublisher implements BookingEventPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 5;

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Override
    public void publishRaw(String topic, String key, String payload) {
        log.debug("Publishing raw event: topic={}, key={}", topic, key);
        try {
            kafkaTemplate.send(topic, key, payload).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Raw event published: topic={}, key={}", topic, key);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Kafka publish interrupted: topic=" + topic);

        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to publish raw event: topic={}, key={}", topic, key, e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Kafka publish failed: topic=" + topic);
        }
    }
}
