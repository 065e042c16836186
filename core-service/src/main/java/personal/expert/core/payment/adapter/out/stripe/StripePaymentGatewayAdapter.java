package personal.expert.core.payment.adapter.out.stripe;

import com.stripe.Stripe;
import com.stripe.exception.CardException;
import com.stripe.exception.IdempotencyException;
import com.stripe.exception.InvalidRequestException;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.model.Refund;
import com.stripe.net.RequestOptions;
import com.stripe.param.PaymentIntentCancelParams;
import com.stripe.param.PaymentIntentCaptureParams;
import com.stripe.param.PaymentIntentCreateParams;
import com.stripe.param.RefundCreateParams;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import personal.expert.core.payment.application.config.PaymentProperties;
import personal.expert.core.payment.application.port.out.PaymentGateway;
import personal.expert.core.payment.domain.exception.ExternalProcessorException;
import personal.expert.core.payment.domain.exception.PaymentDeclinedException;
import personal.expert.core.payment.domain.exception.PaymentProcessorUnavailableException;
import personal.expert.core.payment.domain.model.CaptureResult;
import personal.expert.core.payment.domain.model.HoldCancellation;
import personal.expert.core.payment.domain.model.HoldRequest;
import personal.expert.core.payment.domain.model.HoldStatus;
import personal.expert.core.payment.domain.model.PaymentHold;
import personal.expert.core.payment.domain.model.RefundResult;

/**
 * Stripe Payment Gateway Adapter
 * PaymentIntent(capture_method=manual)로 홀드 후 매입을 구현한다.
 * <p>
 * - Circuit Breaker: 결제사 장애 시 Fail-Fast (Circuit Open -> 503)
 * - 4xx 성격 오류(CardException, InvalidRequestException): PaymentDeclinedException -> ignoreExceptions
 * - 그 외 StripeException(네트워크, 5xx, Rate limit): PaymentProcessorUnavailableException -> Circuit 실패로 카운트
 * - 모든 변경 요청에 Idempotency-Key 전달
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "payment.gateway", havingValue = "stripe", matchIfMissing = true)
public class StripePaymentGatewayAdapter implements PaymentGateway {

    private static final String STATUS_REQUIRES_CAPTURE = "requires_capture";
    private static final String STATUS_SUCCEEDED = "succeeded";
    private static final String STATUS_CANCELED = "canceled";
    private static final String METADATA_BOOKING_ID = "bookingId";

    private final PaymentProperties paymentProperties;

    @PostConstruct
    void configureApiBase() {
        String apiBase = paymentProperties.stripe().apiBase();
        if (StringUtils.hasText(apiBase)) {
            Stripe.overrideApiBase(apiBase);
            log.info("Stripe API base overridden: {}", apiBase);
        }
    }

    @Override
    @CircuitBreaker(name = "stripe", fallbackMethod = "createHoldFallback")
    public PaymentHold createHold(HoldRequest request) {
        log.debug("Creating Stripe hold: bookingId={}, amount={} {}",
                request.bookingId(), request.amount(), request.currency());

        PaymentIntentCreateParams params = PaymentIntentCreateParams.builder()
                .setAmount(request.amount())
                .setCurrency(request.currency())
                .setCaptureMethod(PaymentIntentCreateParams.CaptureMethod.MANUAL)
                .setAutomaticPaymentMethods(PaymentIntentCreateParams.AutomaticPaymentMethods.builder()
                        .setEnabled(true)
                        .build())
                .putMetadata(METADATA_BOOKING_ID, String.valueOf(request.bookingId()))
                .build();

        try {
            PaymentIntent intent = PaymentIntent.create(params, options(request.idempotencyKey()));
            HoldStatus status = STATUS_REQUIRES_CAPTURE.equals(intent.getStatus())
                    ? HoldStatus.AUTHORIZED
                    : HoldStatus.REQUIRES_CONFIRMATION;

            log.info("Stripe hold created: bookingId={}, paymentIntent={}, status={}",
                    request.bookingId(), intent.getId(), intent.getStatus());
            return new PaymentHold(intent.getId(), intent.getClientSecret(), status);

        } catch (StripeException e) {
            throw translate("create hold", "booking-" + request.bookingId(), e);
        }
    }

    @Override
    @CircuitBreaker(name = "stripe", fallbackMethod = "captureFallback")
    public CaptureResult capture(String holdReference, Long amountToCapture, String idempotencyKey) {
        RequestOptions options = options(idempotencyKey);
        try {
            PaymentIntent intent = PaymentIntent.retrieve(holdReference, options(null));
            if (STATUS_SUCCEEDED.equals(intent.getStatus())) {
                log.info("Stripe hold already captured: paymentIntent={}", holdReference);
                return new CaptureResult(intent.getAmountReceived());
            }

            PaymentIntentCaptureParams.Builder params = PaymentIntentCaptureParams.builder();
            if (amountToCapture != null) {
                params.setAmountToCapture(amountToCapture);
            }
            PaymentIntent captured = intent.capture(params.build(), options);

            log.info("Stripe hold captured: paymentIntent={}, amount={}", holdReference, captured.getAmountReceived());
            return new CaptureResult(captured.getAmountReceived());

        } catch (StripeException e) {
            throw translate("capture", holdReference, e);
        }
    }

    @Override
    @CircuitBreaker(name = "stripe", fallbackMethod = "cancelHoldFallback")
    public HoldCancellation cancelHold(String holdReference, String idempotencyKey) {
        try {
            PaymentIntent intent = PaymentIntent.retrieve(holdReference, options(null));
            if (STATUS_SUCCEEDED.equals(intent.getStatus())) {
                log.warn("Stripe hold already captured, cannot cancel: paymentIntent={}", holdReference);
                return HoldCancellation.captured(intent.getAmountReceived());
            }
            if (STATUS_CANCELED.equals(intent.getStatus())) {
                log.info("Stripe hold already cancelled: paymentIntent={}", holdReference);
                return HoldCancellation.cancelled();
            }

            PaymentIntentCancelParams.CancellationReason reason = STATUS_REQUIRES_CAPTURE.equals(intent.getStatus())
                    ? PaymentIntentCancelParams.CancellationReason.REQUESTED_BY_CUSTOMER
                    : PaymentIntentCancelParams.CancellationReason.ABANDONED;
            intent.cancel(PaymentIntentCancelParams.builder().setCancellationReason(reason).build(),
                    options(idempotencyKey));

            log.info("Stripe hold cancelled: paymentIntent={}, reason={}", holdReference, reason);
            return HoldCancellation.cancelled();

        } catch (StripeException e) {
            throw translate("cancel hold", holdReference, e);
        }
    }

    @Override
    @CircuitBreaker(name = "stripe", fallbackMethod = "refundFallback")
    public RefundResult refund(String holdReference, long amount, String idempotencyKey) {
        RefundCreateParams params = RefundCreateParams.builder()
                .setPaymentIntent(holdReference)
                .setAmount(amount)
                .setReason(RefundCreateParams.Reason.REQUESTED_BY_CUSTOMER)
                .build();
        try {
            Refund refund = Refund.create(params, options(idempotencyKey));
            log.info("Stripe refund created: paymentIntent={}, refund={}, amount={}",
                    holdReference, refund.getId(), refund.getAmount());
            return new RefundResult(refund.getId(), refund.getAmount());

        } catch (StripeException e) {
            throw translate("refund", holdReference, e);
        }
    }

    private RequestOptions options(String idempotencyKey) {
        RequestOptions.RequestOptionsBuilder builder = RequestOptions.builder()
                .setApiKey(paymentProperties.stripe().apiKey());
        if (idempotencyKey != null) {
            builder.setIdempotencyKey(idempotencyKey);
        }
        return builder.build();
    }

    private ExternalProcessorException translate(String operation, String reference, StripeException e) {
        if (e instanceof CardException || e instanceof InvalidRequestException || e instanceof IdempotencyException) {
            log.warn("Stripe rejected {}: reference={}, code={}, requestId={}",
                    operation, reference, e.getCode(), e.getRequestId());
            return new PaymentDeclinedException(operation, reference, e);
        }
        log.error("Stripe {} failed: reference={}, status={}, requestId={}",
                operation, reference, e.getStatusCode(), e.getRequestId(), e);
        return new PaymentProcessorUnavailableException(operation, reference, e);
    }

    // ========== Fallback (Circuit Open) ==========

    private PaymentHold createHoldFallback(HoldRequest request, CallNotPermittedException e) {
        log.error("Stripe circuit open, hold rejected: bookingId={}", request.bookingId());
        throw new PaymentProcessorUnavailableException("create hold", "booking-" + request.bookingId(), e);
    }

    private CaptureResult captureFallback(String holdReference, Long amountToCapture, String idempotencyKey,
                                          CallNotPermittedException e) {
        log.error("Stripe circuit open, capture rejected: paymentIntent={}", holdReference);
        throw new PaymentProcessorUnavailableException("capture", holdReference, e);
    }

    private HoldCancellation cancelHoldFallback(String holdReference, String idempotencyKey,
                                                CallNotPermittedException e) {
        log.error("Stripe circuit open, cancel rejected: paymentIntent={}", holdReference);
        throw new PaymentProcessorUnavailableException("cancel hold", holdReference, e);
    }

    private RefundResult refundFallback(String holdReference, long amount, String idempotencyKey,
                                        CallNotPermittedException e) {
        log.error("Stripe circuit open, refund rejected: paymentIntent={}", holdReference);
        throw new PaymentProcessorUnavailableException("refund", holdReference, e);
    }
}
