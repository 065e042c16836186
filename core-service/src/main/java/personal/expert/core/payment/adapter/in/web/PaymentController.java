package personal.expert.core.payment.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.expert.core.payment.adapter.in.web.dto.AuthorizePaymentRequest;
import personal.expert.core.payment.adapter.in.web.dto.PaymentHoldResponse;
import personal.expert.core.payment.application.port.in.AuthorizePaymentUseCase;
import personal.expert.core.payment.domain.model.PaymentHold;

/**
 * Payment API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final AuthorizePaymentUseCase authorizePaymentUseCase;

    /**
     * 결제 홀드 생성
     * POST /api/v1/payments/holds
     */
    @PostMapping("/holds")
    public ResponseEntity<PaymentHoldResponse> authorize(
            @Valid @RequestBody AuthorizePaymentRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Authorize payment: bookingId={}, learnerId={}, amount={} {}",
                request.bookingId(), userId, request.amount(), request.currency());

        PaymentHold hold = authorizePaymentUseCase.authorize(request.toCommand(userId));

        return ResponseEntity.ok(PaymentHoldResponse.from(hold));
    }
}
