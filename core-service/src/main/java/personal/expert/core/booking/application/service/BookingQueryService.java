package personal.expert.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.expert.core.booking.application.port.in.GetBookingUseCase;
import personal.expert.core.booking.application.port.out.BookingRepository;
import personal.expert.core.booking.domain.exception.BookingNotFoundException;
import personal.expert.core.booking.domain.model.Booking;

import java.util.List;

/**
 * Booking Query Service
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BookingQueryService implements GetBookingUseCase {

    private final BookingRepository bookingRepository;

    @Override
    public Booking getBooking(Long bookingId, Long userId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        booking.ensureParticipant(userId);
        return booking;
    }

    @Override
    public List<Booking> getPendingApprovals(Long expertId) {
        return bookingRepository.findPendingApprovals(expertId);
    }
}
