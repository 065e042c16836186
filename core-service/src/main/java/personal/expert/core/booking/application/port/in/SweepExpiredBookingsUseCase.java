package personal.expert.core.booking.application.port.in;

import java.time.LocalDateTime;

/**
 * Sweep Expired Bookings Use Case (Timeout Reaper)
 */
public interface SweepExpiredBookingsUseCase {

    SweepResult sweep(LocalDateTime now);
}
