package personal.expert.core.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.expert.core.booking.adapter.in.web.dto.BookingResponse;
import personal.expert.core.booking.adapter.in.web.dto.CancelBookingRequest;
import personal.expert.core.booking.adapter.in.web.dto.CancellationResponse;
import personal.expert.core.booking.adapter.in.web.dto.ReserveSlotRequest;
import personal.expert.core.booking.adapter.in.web.dto.ResolveBookingRequest;
import personal.expert.core.booking.adapter.in.web.dto.SlotResponse;
import personal.expert.core.booking.application.port.in.CancelBookingUseCase;
import personal.expert.core.booking.application.port.in.CancellationResult;
import personal.expert.core.booking.application.port.in.GetAvailableSlotsUseCase;
import personal.expert.core.booking.application.port.in.GetBookingUseCase;
import personal.expert.core.booking.application.port.in.ReserveSlotUseCase;
import personal.expert.core.booking.application.port.in.ResolveBookingUseCase;
import personal.expert.core.booking.domain.model.Booking;

import java.util.List;

/**
 * Booking API Controller
 * 슬롯 조회, 예약 생성/조회, 승인/거절, 취소 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class BookingController {

    private final ReserveSlotUseCase reserveSlotUseCase;
    private final GetAvailableSlotsUseCase getAvailableSlotsUseCase;
    private final GetBookingUseCase getBookingUseCase;
    private final ResolveBookingUseCase resolveBookingUseCase;
    private final CancelBookingUseCase cancelBookingUseCase;

    /**
     * 예약 가능한 슬롯 목록 조회
     * GET /api/v1/sessions/{sessionId}/slots
     */
    @GetMapping("/sessions/{sessionId}/slots")
    public ResponseEntity<List<SlotResponse>> getAvailableSlots(@PathVariable Long sessionId) {
        log.info("Get available slots: sessionId={}", sessionId);

        List<SlotResponse> response = getAvailableSlotsUseCase.getAvailableSlots(sessionId).stream()
                .map(SlotResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }

    /**
     * 슬롯 예약 생성
     * POST /api/v1/bookings
     */
    @PostMapping("/bookings")
    public ResponseEntity<BookingResponse> reserve(
            @Valid @RequestBody ReserveSlotRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Reserve slot: learnerId={}, slotId={}, sessionId={}", userId, request.slotId(), request.sessionId());

        Booking booking = reserveSlotUseCase.reserve(request.toCommand(userId));

        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(booking));
    }

    /**
     * 예약 조회 (학습자 또는 담당 전문가)
     * GET /api/v1/bookings/{bookingId}
     */
    @GetMapping("/bookings/{bookingId}")
    public ResponseEntity<BookingResponse> getBooking(
            @PathVariable Long bookingId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Get booking: bookingId={}, userId={}", bookingId, userId);

        Booking booking = getBookingUseCase.getBooking(bookingId, userId);

        return ResponseEntity.ok(BookingResponse.from(booking));
    }

    /**
     * 전문가 승인/거절
     * POST /api/v1/bookings/{bookingId}/resolve
     */
    @PostMapping("/bookings/{bookingId}/resolve")
    public ResponseEntity<BookingResponse> resolve(
            @PathVariable Long bookingId,
            @Valid @RequestBody ResolveBookingRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Resolve booking: bookingId={}, expertId={}, action={}", bookingId, userId, request.action());

        Booking booking = resolveBookingUseCase.resolve(request.toCommand(bookingId, userId));

        return ResponseEntity.ok(BookingResponse.from(booking));
    }

    /**
     * 예약 취소 (학습자 또는 전문가)
     * POST /api/v1/bookings/{bookingId}/cancel
     */
    @PostMapping("/bookings/{bookingId}/cancel")
    public ResponseEntity<CancellationResponse> cancel(
            @PathVariable Long bookingId,
            @Valid @RequestBody CancelBookingRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Cancel booking: bookingId={}, actorId={}", bookingId, userId);

        CancellationResult result = cancelBookingUseCase.cancel(request.toCommand(bookingId, userId));

        return ResponseEntity.ok(CancellationResponse.from(result));
    }

    /**
     * 승인 대기 예약 목록 (전문가 본인)
     * GET /api/v1/experts/me/pending-approvals
     */
    @GetMapping("/experts/me/pending-approvals")
    public ResponseEntity<List<BookingResponse>> getPendingApprovals(@RequestHeader("X-User-Id") Long userId) {
        log.info("Get pending approvals: expertId={}", userId);

        List<BookingResponse> response = getBookingUseCase.getPendingApprovals(userId).stream()
                .map(BookingResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }
}
