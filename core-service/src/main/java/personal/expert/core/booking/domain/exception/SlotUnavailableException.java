package personal.expert.core.booking.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Slot Unavailable Exception
 * 잔여 수량이 없거나 닫힌 슬롯 (선점 경쟁에서 패배한 경우 포함)
 */
public class SlotUnavailableException extends BusinessException {
    public SlotUnavailableException(Long slotId) {
        super(ErrorCode.SLOT_UNAVAILABLE,
                String.format("Slot has no remaining capacity or is closed: slotId=%d", slotId));
    }
}
