package personal.expert.core.booking.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Slot Not Found Exception
 * 슬롯을 찾을 수 없을 때 발생
 */
public class SlotNotFoundException extends BusinessException {
    public SlotNotFoundException(Long slotId) {
        super(ErrorCode.SLOT_NOT_FOUND,
                String.format("Slot not found: slotId=%d", slotId));
    }
}
