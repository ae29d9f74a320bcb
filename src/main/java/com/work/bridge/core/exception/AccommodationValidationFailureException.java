package com.work.bridge.core.exception;

import com.work.bridge.core.model.ValidationStatus;

/**
 * guard 拒绝了批次中的某一条 accommodation，整个批次回滚。
 */
public class AccommodationValidationFailureException extends BridgeException {

    private final int index;
    private final ValidationStatus validationStatus;

    public AccommodationValidationFailureException(long chainId, int index, ValidationStatus validationStatus) {
        super(BridgeErrorCode.ACCOMMODATION_VALIDATION_FAILURE,
                "accommodation 未通过 guard 校验: chainId=" + chainId + ", index=" + index + ", status=" + validationStatus);
        this.index = index;
        this.validationStatus = validationStatus;
    }

    public int getIndex() {
        return index;
    }

    public ValidationStatus getValidationStatus() {
        return validationStatus;
    }
}
