package personal.expert.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 사용자 노출 메시지를 함께 관리
 * 메시지는 클라이언트에 그대로 노출되므로 내부 정보(결제사 오류 상세 등)를 담지 않는다.
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "invalid request"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "C002", "authentication required"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "C003", "you do not have access to this resource"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "resource not found"),
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT, "C005", "the resource was modified concurrently, please retry"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "internal server error"),

    // Booking Domain (Bxxx)
    SLOT_NOT_FOUND(HttpStatus.NOT_FOUND, "B001", "slot not found"),
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND, "B002", "session not found"),
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, "B003", "booking not found"),
    SLOT_UNAVAILABLE(HttpStatus.CONFLICT, "B004", "this slot is no longer available"),
    SLOT_NOT_BOOKABLE(HttpStatus.BAD_REQUEST, "B005", "this slot cannot be booked"),
    DUPLICATE_BOOKING(HttpStatus.CONFLICT, "B006", "you already have a booking for this slot"),
    CONCURRENT_RESERVATION(HttpStatus.CONFLICT, "B007", "this slot is no longer available"),
    INVALID_BOOKING_STATE(HttpStatus.BAD_REQUEST, "B008", "the booking is not in a state that allows this action"),
    BOOKING_ALREADY_RESOLVED(HttpStatus.CONFLICT, "B009", "this booking has already been resolved"),
    CANCELLATION_WINDOW_CLOSED(HttpStatus.BAD_REQUEST, "B010", "this booking can no longer be cancelled"),

    // Payment Domain (Pxxx)
    INVALID_PAYMENT_STATE(HttpStatus.BAD_REQUEST, "P001", "the payment is not in a state that allows this action"),
    AMOUNT_MISMATCH(HttpStatus.BAD_REQUEST, "P002", "the payment amount does not match the booking"),
    UNSUPPORTED_CURRENCY(HttpStatus.BAD_REQUEST, "P003", "unsupported currency"),
    PAYMENT_DECLINED(HttpStatus.BAD_REQUEST, "P004", "payment could not be processed"),
    PAYMENT_PROCESSOR_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "P005", "payment could not be processed"),
    INVALID_WEBHOOK_SIGNATURE(HttpStatus.BAD_REQUEST, "P006", "invalid signature");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
