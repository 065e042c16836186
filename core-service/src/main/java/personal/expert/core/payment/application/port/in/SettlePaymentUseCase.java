package personal.expert.core.payment.application.port.in;

import personal.expert.core.payment.domain.model.Receipt;

import java.time.LocalDateTime;

/**
 * Settle Payment Use Case (Payment Orchestrator)
 * 홀드 매입/해제/환불을 결제사에 요청하고 예약 상태를 함께 종결한다.
 * 모든 연산은 예약 단위 선점과 결제사 멱등 키로 재시도에 안전하다.
 */
public interface SettlePaymentUseCase {

    /**
     * 홀드 매입 (AUTHORIZED + PENDING_APPROVAL 에서만). 이미 매입된 예약은 그대로 성공 처리한다.
     */
    Receipt capture(CaptureCommand command);

    /**
     * 매입 전 홀드 해제
     */
    Receipt cancelHold(ReleaseCommand command);

    /**
     * 매입 후 환불
     */
    Receipt refund(ReleaseCommand command);

    /**
     * 현재 결제 상태에 따라 홀드 해제 또는 환불로 종결
     */
    Receipt release(ReleaseCommand command);

    /**
     * 중단된 선점(결제사 호출 후 반영 전 실패)을 이어서 처리
     */
    Receipt resume(Long bookingId, LocalDateTime now);
}
