package personal.expert.core.booking.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.expert.core.booking.application.port.in.CancelBookingCommand;
import personal.expert.core.booking.application.port.in.CancelBookingUseCase;
import personal.expert.core.booking.application.port.in.CancellationResult;
import personal.expert.core.booking.application.port.in.GetAvailableSlotsUseCase;
import personal.expert.core.booking.application.port.in.GetBookingUseCase;
import personal.expert.core.booking.application.port.in.ReserveSlotCommand;
import personal.expert.core.booking.application.port.in.ReserveSlotUseCase;
import personal.expert.core.booking.application.port.in.ResolveBookingCommand;
import personal.expert.core.booking.application.port.in.ResolveBookingUseCase;
import personal.expert.core.booking.domain.exception.BookingAccessDeniedException;
import personal.expert.core.booking.domain.exception.BookingAlreadyResolvedException;
import personal.expert.core.booking.domain.exception.SlotUnavailableException;
import personal.expert.core.booking.domain.model.BookingAction;
import personal.expert.core.booking.domain.model.BookingStatus;
import personal.expert.core.booking.domain.model.CancelledBy;
import personal.expert.core.booking.domain.model.PaymentStatus;
import personal.expert.core.booking.domain.model.Slot;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static personal.expert.core.support.BookingFixtures.*;

@WebMvcTest(BookingController.class)
@DisplayName("Booking API 단위 테스트")
class BookingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReserveSlotUseCase reserveSlotUseCase;
    @MockBean
    private GetAvailableSlotsUseCase getAvailableSlotsUseCase;
    @MockBean
    private GetBookingUseCase getBookingUseCase;
    @MockBean
    private ResolveBookingUseCase resolveBookingUseCase;
    @MockBean
    private CancelBookingUseCase cancelBookingUseCase;

    @Test
    @DisplayName("예약 생성 성공 시 201과 예약 정보를 반환한다")
    void reserve_Created() throws Exception {
        // given
        given(reserveSlotUseCase.reserve(new ReserveSlotCommand(LEARNER_ID, SLOT_ID, SESSION_ID, "hi")))
                .willReturn(pending());

        // when & then
        mockMvc.perform(post("/api/v1/bookings")
                        .header("X-User-Id", LEARNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotId\":1,\"sessionId\":2,\"notes\":\"hi\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.bookingId").value(BOOKING_ID))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.paymentStatus").value("PENDING"))
                .andExpect(jsonPath("$.amount").value(AMOUNT))
                .andExpect(jsonPath("$.currency").value(CURRENCY));
    }

    @Test
    @DisplayName("슬롯 경쟁에서 지면 409와 사용자 메시지를 반환한다")
    void reserve_Conflict() throws Exception {
        // given
        given(reserveSlotUseCase.reserve(any())).willThrow(new SlotUnavailableException(SLOT_ID));

        // when & then
        mockMvc.perform(post("/api/v1/bookings")
                        .header("X-User-Id", LEARNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotId\":1,\"sessionId\":2}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("B004"))
                .andExpect(jsonPath("$.message").value("this slot is no longer available"));
    }

    @Test
    @DisplayName("필수 값이 없으면 400")
    void reserve_ValidationError() throws Exception {
        // when & then
        mockMvc.perform(post("/api/v1/bookings")
                        .header("X-User-Id", LEARNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
        verifyNoInteractions(reserveSlotUseCase);
    }

    @Test
    @DisplayName("사용자 헤더가 없으면 400")
    void reserve_MissingUserHeader() throws Exception {
        // when & then
        mockMvc.perform(post("/api/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"slotId\":1,\"sessionId\":2}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("전문가 승인 시 확정된 예약을 반환한다")
    void resolve_Confirm() throws Exception {
        // given
        given(resolveBookingUseCase.resolve(new ResolveBookingCommand(
                BOOKING_ID, EXPERT_ID, ResolveBookingCommand.Decision.CONFIRM, "welcome", null)))
                .willReturn(confirmed());

        // when & then
        mockMvc.perform(post("/api/v1/bookings/{id}/resolve", BOOKING_ID)
                        .header("X-User-Id", EXPERT_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"CONFIRM\",\"notes\":\"welcome\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CONFIRMED"))
                .andExpect(jsonPath("$.paymentStatus").value("CAPTURED"));
    }

    @Test
    @DisplayName("이미 종결된 예약 승인 시 409와 안내 메시지")
    void resolve_AlreadyResolved() throws Exception {
        // given
        given(resolveBookingUseCase.resolve(any()))
                .willThrow(new BookingAlreadyResolvedException(BOOKING_ID, BookingStatus.CANCELLED, BookingAction.CONFIRM));

        // when & then
        mockMvc.perform(post("/api/v1/bookings/{id}/resolve", BOOKING_ID)
                        .header("X-User-Id", EXPERT_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"CONFIRM\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("this booking has already been resolved"));
    }

    @Test
    @DisplayName("담당 전문가가 아니면 403")
    void resolve_Forbidden() throws Exception {
        // given
        given(resolveBookingUseCase.resolve(any())).willThrow(new BookingAccessDeniedException(BOOKING_ID, 999L));

        // when & then
        mockMvc.perform(post("/api/v1/bookings/{id}/resolve", BOOKING_ID)
                        .header("X-User-Id", 999L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"DECLINE\",\"reason\":\"busy\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("재시도 후에도 남은 동시 수정 충돌은 409 C005")
    void resolve_ConcurrentModification() throws Exception {
        // given
        given(resolveBookingUseCase.resolve(any()))
                .willThrow(new OptimisticLockingFailureException("version mismatch"));

        // when & then
        mockMvc.perform(post("/api/v1/bookings/{id}/resolve", BOOKING_ID)
                        .header("X-User-Id", EXPERT_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"CONFIRM\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("C005"));
    }

    @Test
    @DisplayName("알 수 없는 action은 400")
    void resolve_UnknownAction() throws Exception {
        // when & then
        mockMvc.perform(post("/api/v1/bookings/{id}/resolve", BOOKING_ID)
                        .header("X-User-Id", EXPERT_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"MAYBE\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(resolveBookingUseCase);
    }

    @Test
    @DisplayName("취소 시 예약과 환불 금액을 반환한다")
    void cancel_ReturnsRefund() throws Exception {
        // given
        var cancelled = confirmed()
                .claim(BookingAction.CANCEL, CancelledBy.LEARNER, "sick", null, NOW)
                .completeRelease(PaymentStatus.REFUNDED, AMOUNT, NOW);
        given(cancelBookingUseCase.cancel(new CancelBookingCommand(BOOKING_ID, LEARNER_ID, "sick")))
                .willReturn(new CancellationResult(cancelled, AMOUNT));

        // when & then
        mockMvc.perform(post("/api/v1/bookings/{id}/cancel", BOOKING_ID)
                        .header("X-User-Id", LEARNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"sick\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.booking.status").value("CANCELLED"))
                .andExpect(jsonPath("$.booking.cancelledBy").value("LEARNER"))
                .andExpect(jsonPath("$.refundAmount").value(AMOUNT));
    }

    @Test
    @DisplayName("예약 조회")
    void getBooking() throws Exception {
        // given
        given(getBookingUseCase.getBooking(BOOKING_ID, LEARNER_ID)).willReturn(awaitingApproval());

        // when & then
        mockMvc.perform(get("/api/v1/bookings/{id}", BOOKING_ID).header("X-User-Id", LEARNER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING_APPROVAL"))
                .andExpect(jsonPath("$.paymentStatus").value("AUTHORIZED"));
    }

    @Test
    @DisplayName("승인 대기 목록 조회")
    void getPendingApprovals() throws Exception {
        // given
        given(getBookingUseCase.getPendingApprovals(EXPERT_ID)).willReturn(List.of(awaitingApproval()));

        // when & then
        mockMvc.perform(get("/api/v1/experts/me/pending-approvals").header("X-User-Id", EXPERT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].bookingId").value(BOOKING_ID));
    }

    @Test
    @DisplayName("세션의 예약 가능 슬롯 조회")
    void getAvailableSlots() throws Exception {
        // given
        Slot slot = new Slot(SLOT_ID, EXPERT_ID, SESSION_ID, NOW.plusDays(3), NOW.plusDays(3).plusHours(1), 2, 1, true);
        given(getAvailableSlotsUseCase.getAvailableSlots(SESSION_ID)).willReturn(List.of(slot));

        // when & then
        mockMvc.perform(get("/api/v1/sessions/{sessionId}/slots", SESSION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].slotId").value(SLOT_ID))
                .andExpect(jsonPath("$[0].remainingCapacity").value(1));
    }
}
