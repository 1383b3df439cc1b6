package personal.cinema.core.booking.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.cinema.core.booking.application.port.in.PublishPendingEventsUseCase;

/**
 * Outbox Event Scheduler (Driving Adapter)
 * 주기적으로 PENDING 상태의 예매 이벤트를 발행
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "booking.outbox.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxEventScheduler {

    private final PublishPendingEventsUseCase publishPendingEventsUseCase;

    @Scheduled(fixedDelayString = "${booking.outbox.interval-ms:500}")
    public void schedulePublishing() {
        try {
            int publishedCount = publishPendingEventsUseCase.publishPendingEvents();
            if (publishedCount > 0) {
                log.debug("Scheduled publishing completed. Count: {}", publishedCount);
            }
        } catch (Exception e) {
            log.error("Outbox publishing failed", e);
        }
    }
}
