package personal.expert.core.booking.adapter.in.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.expert.core.booking.application.port.in.SweepExpiredBookingsUseCase;
import personal.expert.core.booking.application.port.in.SweepResult;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Booking Reaper Scheduler
 * 기한이 지난 홀드/승인 대기 예약 취소, 중단된 결제 선점 재진행, 종료된 세션 완료 처리를 주기적으로 실행
 *
 * 여러 인스턴스가 동시에 돌아도 예약 단위 CAS(@Version)로 한 번만 반영된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "booking.reaper", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BookingReaperScheduler {

    private final SweepExpiredBookingsUseCase sweepExpiredBookingsUseCase;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${booking.reaper.fixed-delay-ms:60000}")
    public void reap() {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            SweepResult result = sweepExpiredBookingsUseCase.sweep(LocalDateTime.now(clock));

            count("cancelled", result.cancelledCount());
            count("completed", result.completedCount());
            count("recovered", result.recoveredCount());

            if (!result.isEmpty()) {
                log.info("Reaper completed: cancelled={}, completed={}, recovered={}",
                        result.cancelledCount(), result.completedCount(), result.recoveredCount());
            }
        } catch (Exception e) {
            log.error("Reaper run failed", e);
        } finally {
            sample.stop(Timer.builder("booking.reaper.duration")
                    .description("Time taken by one reaper run")
                    .register(meterRegistry));
        }
    }

    private void count(String outcome, int amount) {
        if (amount <= 0) {
            return;
        }
        Counter.builder("booking.reaper.bookings")
                .tag("outcome", outcome)
                .description("Number of bookings transitioned by the reaper")
                .register(meterRegistry)
                .increment(amount);
    }
}
