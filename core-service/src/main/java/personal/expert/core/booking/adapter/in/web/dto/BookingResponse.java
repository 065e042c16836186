package personal.expert.core.booking.adapter.in.web.dto;

import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.model.BookingStatus;
import personal.expert.core.booking.domain.model.CancelledBy;
import personal.expert.core.booking.domain.model.PaymentStatus;

import java.time.LocalDateTime;

/**
 * 예약 조회/생성 응답 DTO
 */
public record BookingResponse(
        Long bookingId,
        Long learnerId,
        Long expertId,
        Long slotId,
        Long sessionId,
        LocalDateTime startAt,
        LocalDateTime endAt,
        long amount,
        String currency,
        BookingStatus status,
        PaymentStatus paymentStatus,
        LocalDateTime heldUntil,
        long amountCaptured,
        long amountRefunded,
        String learnerNotes,
        String expertNotes,
        String declineReason,
        String cancellationReason,
        CancelledBy cancelledBy,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.id(),
                booking.learnerId(),
                booking.expertId(),
                booking.slotId(),
                booking.sessionId(),
                booking.startAt(),
                booking.endAt(),
                booking.amount(),
                booking.currency(),
                booking.status(),
                booking.paymentStatus(),
                booking.heldUntil(),
                booking.amountCaptured(),
                booking.amountRefunded(),
                booking.learnerNotes(),
                booking.expertNotes(),
                booking.declineReason(),
                booking.cancellationReason(),
                booking.cancelledBy(),
                booking.createdAt(),
                booking.updatedAt()
        );
    }
}
