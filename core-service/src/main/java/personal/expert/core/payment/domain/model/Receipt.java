package personal.expert.core.payment.domain.model;

import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.model.PaymentStatus;

/**
 * 결제 처리 결과 영수증
 */
public record Receipt(
        Long bookingId,
        String holdReference,
        PaymentStatus paymentStatus,
        long amountCaptured,
        long amountRefunded,
        String currency) {

    public static Receipt from(Booking booking) {
        return new Receipt(
                booking.id(),
                booking.holdReference(),
                booking.paymentStatus(),
                booking.amountCaptured(),
                booking.amountRefunded(),
                booking.currency());
    }
}
