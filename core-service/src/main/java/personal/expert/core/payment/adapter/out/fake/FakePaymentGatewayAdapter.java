package personal.expert.core.payment.adapter.out.fake;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import personal.expert.core.payment.application.port.out.PaymentGateway;
import personal.expert.core.payment.domain.model.CaptureResult;
import personal.expert.core.payment.domain.model.HoldCancellation;
import personal.expert.core.payment.domain.model.HoldRequest;
import personal.expert.core.payment.domain.model.HoldStatus;
import personal.expert.core.payment.domain.model.PaymentHold;
import personal.expert.core.payment.domain.model.RefundResult;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fake Payment Gateway (로컬/테스트용)
 * 외부 결제사 없이 홀드 상태를 메모리에 보관한다.
 * 홀드는 구매자 확정 대기 상태로 생성되며, 승인은 Webhook으로 반영된다.
 * payment.gateway=fake 일 때만 활성화
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "payment.gateway", havingValue = "fake")
public class FakePaymentGatewayAdapter implements PaymentGateway {

    private final Map<String, FakeHold> holds = new ConcurrentHashMap<>();

    @Override
    public PaymentHold createHold(HoldRequest request) {
        String reference = "pi_fake_" + request.bookingId();
        holds.putIfAbsent(reference, new FakeHold(request.amount(), FakeHoldState.HELD, 0L, 0L));

        log.info("[FAKE] Hold created: bookingId={}, reference={}, amount={} {}",
                request.bookingId(), reference, request.amount(), request.currency());
        return new PaymentHold(reference, reference + "_secret_fake", HoldStatus.REQUIRES_CONFIRMATION);
    }

    @Override
    public CaptureResult capture(String holdReference, Long amountToCapture, String idempotencyKey) {
        FakeHold captured = holds.compute(holdReference, (ref, hold) -> {
            FakeHold current = hold != null ? hold : FakeHold.unknown();
            if (current.state() == FakeHoldState.CAPTURED) {
                return current;
            }
            long amount = amountToCapture != null ? amountToCapture : current.amount();
            return new FakeHold(current.amount(), FakeHoldState.CAPTURED, amount, 0L);
        });

        log.info("[FAKE] Hold captured: reference={}, amount={}", holdReference, captured.captured());
        return new CaptureResult(captured.captured());
    }

    @Override
    public HoldCancellation cancelHold(String holdReference, String idempotencyKey) {
        FakeHold hold = holds.get(holdReference);
        if (hold != null && hold.state() == FakeHoldState.CAPTURED) {
            log.info("[FAKE] Hold already captured: reference={}", holdReference);
            return HoldCancellation.captured(hold.captured());
        }

        holds.compute(holdReference, (ref, current) -> new FakeHold(
                current != null ? current.amount() : 0L, FakeHoldState.CANCELLED, 0L, 0L));
        log.info("[FAKE] Hold cancelled: reference={}", holdReference);
        return HoldCancellation.cancelled();
    }

    @Override
    public RefundResult refund(String holdReference, long amount, String idempotencyKey) {
        holds.computeIfPresent(holdReference, (ref, hold) ->
                new FakeHold(hold.amount(), FakeHoldState.REFUNDED, hold.captured(), amount));

        log.info("[FAKE] Refund issued: reference={}, amount={}", holdReference, amount);
        return new RefundResult("re_fake_" + holdReference, amount);
    }

    private enum FakeHoldState {
        HELD, CAPTURED, CANCELLED, REFUNDED
    }

    private record FakeHold(long amount, FakeHoldState state, long captured, long refunded) {
        static FakeHold unknown() {
            return new FakeHold(0L, FakeHoldState.HELD, 0L, 0L);
        }
    }
}
