package personal.expert.core.booking.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Slot Not Bookable Exception
 * 예약 가능 시간 범위를 벗어나거나 세션이 일치하지 않는 슬롯
 */
public class SlotNotBookableException extends BusinessException {
    public SlotNotBookableException(Long slotId, String reason) {
        super(ErrorCode.SLOT_NOT_BOOKABLE,
                String.format("Slot is not bookable: slotId=%d, reason=%s", slotId, reason));
    }
}
