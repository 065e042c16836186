package personal.expert.core.booking.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import personal.expert.core.booking.domain.model.CancellationPolicy;

import java.time.Duration;

/**
 * Booking 설정 Properties
 * application.yml의 booking.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "booking")
public record BookingProperties(
        Reservation reservation,
        Approval approval,
        Reaper reaper,
        Cancellation cancellation,
        Sweep sweep,
        Outbox outbox
) {
    /**
     * @param holdGrace   신규 예약의 결제 홀드 대기 시간 (held_until)
     * @param minLeadTime 세션 시작까지 최소 남은 시간
     * @param maxAdvance  예약 가능한 최대 선행 기간
     */
    public record Reservation(
            Duration holdGrace,
            Duration minLeadTime,
            Duration maxAdvance
    ) {}

    /**
     * @param window 홀드 확인 후 전문가 승인 기한
     */
    public record Approval(
            Duration window
    ) {}

    /**
     * @param claimTimeout 이 시간보다 오래된 선점은 sweep이 다시 진행한다
     */
    public record Reaper(
            boolean enabled,
            long fixedDelayMs,
            int batchSize,
            Duration claimTimeout
    ) {}

    public record Cancellation(
            Duration fullRefundBefore,
            Duration partialRefundBefore,
            int partialRefundPercent
    ) {
        public CancellationPolicy toPolicy() {
            return new CancellationPolicy(fullRefundBefore, partialRefundBefore, partialRefundPercent);
        }
    }

    /**
     * @param secret 내부 sweep 트리거 Bearer 자격 증명
     */
    public record Sweep(
            String secret
    ) {}

    public record Outbox(
            boolean enabled,
            long fixedDelayMs
    ) {}
}
