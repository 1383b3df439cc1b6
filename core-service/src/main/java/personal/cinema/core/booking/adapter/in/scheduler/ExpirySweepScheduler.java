package personal.cinema.core.booking.adapter.in.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.cinema.core.booking.application.port.in.SweepExpiredUseCase;
import personal.cinema.core.booking.application.port.out.SchedulerLockPort;

import java.util.function.IntSupplier;

/**
 * Expiry Sweep Scheduler
 * 만료된 홀드 삭제와 만료된 PENDING 예매의 EXPIRED 전환을 주기적으로 실행
 *
 * 읽기 경로는 스윕 여부와 무관하게 만료를 반영하므로, 스윕이 늦어져도 정합성에는 영향이 없다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "booking.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class ExpirySweepScheduler {

    private static final String SWEEP_SCHEDULER = "sweep";
    private static final String HOLDS_JOB = "holds";
    private static final String BOOKINGS_JOB = "bookings";

    private final SweepExpiredUseCase sweepExpiredUseCase;
    private final SchedulerLockPort schedulerLockPort;
    private final MeterRegistry meterRegistry;

    /**
     * 주기: booking.sweep.interval-ms (기본 30초)
     */
    @Scheduled(fixedDelayString = "${booking.sweep.interval-ms:30000}")
    public void sweep() {
        log.debug("Starting expiry sweep with strategy: {}", schedulerLockPort.getStrategyName());

        runJob(HOLDS_JOB, sweepExpiredUseCase::sweepExpiredHolds);
        runJob(BOOKINGS_JOB, sweepExpiredUseCase::sweepExpiredBookings);
    }

    private void runJob(String jobKey, IntSupplier job) {
        if (!schedulerLockPort.tryAcquire(SWEEP_SCHEDULER, jobKey)) {
            Counter.builder("scheduler.lock.acquire.failures")
                    .tag("scheduler_type", SWEEP_SCHEDULER)
                    .tag("job", jobKey)
                    .description("Number of lock acquisition failures (another instance processing)")
                    .register(meterRegistry)
                    .increment();

            log.debug("Skipping sweep job={} (another instance is processing)", jobKey);
            return;
        }

        try {
            Timer.Sample sample = Timer.start(meterRegistry);
            int swept = job.getAsInt();
            sample.stop(Timer.builder("scheduler.sweep.duration")
                    .tag("job", jobKey)
                    .description("Time taken by one expiry sweep job")
                    .register(meterRegistry));

            Counter.builder("scheduler.sweep.expired")
                    .tag("job", jobKey)
                    .description("Number of expired holds removed or bookings expired")
                    .register(meterRegistry)
                    .increment(swept);

        } catch (Exception e) {
            log.error("Expiry sweep failed: job={}", jobKey, e);
        } finally {
            schedulerLockPort.release(SWEEP_SCHEDULER, jobKey);
        }
    }
}
