package personal.expert.core.payment.application.port.out;

import personal.expert.core.payment.domain.exception.ExternalProcessorException;
import personal.expert.core.payment.domain.model.CaptureResult;
import personal.expert.core.payment.domain.model.HoldCancellation;
import personal.expert.core.payment.domain.model.HoldRequest;
import personal.expert.core.payment.domain.model.PaymentHold;
import personal.expert.core.payment.domain.model.RefundResult;

/**
 * Payment Gateway Port
 * 외부 결제사와의 2단계 결제(홀드 후 매입) 연동.
 * 모든 변경 호출은 멱등 키를 전달하며, 실패는 ExternalProcessorException으로 보고한다.
 */
public interface PaymentGateway {

    /**
     * 수동 매입 방식의 결제 홀드 생성
     */
    PaymentHold createHold(HoldRequest request) throws ExternalProcessorException;

    /**
     * 홀드 매입. 이미 매입된 홀드는 매입 금액을 그대로 반환한다.
     *
     * @param amountToCapture 부분 매입 금액 (null이면 전액)
     */
    CaptureResult capture(String holdReference, Long amountToCapture, String idempotencyKey)
            throws ExternalProcessorException;

    /**
     * 홀드 해제. 이미 해제된 홀드는 성공으로, 이미 매입된 홀드는 {@link HoldCancellation#alreadyCaptured()}로 보고한다.
     */
    HoldCancellation cancelHold(String holdReference, String idempotencyKey) throws ExternalProcessorException;

    /**
     * 매입된 결제 환불
     */
    RefundResult refund(String holdReference, long amount, String idempotencyKey) throws ExternalProcessorException;
}
