package personal.expert.core.booking.application.port.in;

/**
 * 만료 정리 결과
 *
 * @param cancelledCount 만료되어 취소된 예약 수
 * @param completedCount 세션 종료로 완료 처리된 예약 수
 * @param recoveredCount 중단된 선점을 마무리한 예약 수
 */
public record SweepResult(
        int cancelledCount,
        int completedCount,
        int recoveredCount
) {
    public boolean isEmpty() {
        return cancelledCount == 0 && completedCount == 0 && recoveredCount == 0;
    }
}
