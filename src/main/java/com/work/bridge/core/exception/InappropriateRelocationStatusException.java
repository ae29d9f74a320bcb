package com.work.bridge.core.exception;

import com.work.bridge.core.model.RelocationStatus;

/**
 * relocation 当前状态不允许执行请求的状态迁移。
 */
public class InappropriateRelocationStatusException extends BridgeException {

    private final RelocationStatus currentStatus;

    public InappropriateRelocationStatusException(long chainId, long nonce, RelocationStatus currentStatus) {
        super(BridgeErrorCode.INAPPROPRIATE_RELOCATION_STATUS,
                "relocation 状态不允许该操作: chainId=" + chainId + ", nonce=" + nonce + ", status=" + currentStatus);
        this.currentStatus = currentStatus;
    }

    public RelocationStatus getCurrentStatus() {
        return currentStatus;
    }
}
