package personal.expert.core.payment.application.port.in;

import personal.expert.core.payment.domain.model.PaymentHold;

/**
 * Authorize Payment Use Case
 * 결제 홀드를 요청하고 홀드 참조를 예약에 저장한다.
 */
public interface AuthorizePaymentUseCase {

    PaymentHold authorize(AuthorizePaymentCommand command);
}
