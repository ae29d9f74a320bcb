package com.work.bridge.core.exception;

/**
 * 组件内部的统一异常类型，便于业务侧捕获或转换为 RPC 错误码。
 * <p>
 * 所有错误都是 fail-fast 且不可重试的：调用方需修正参数或等待状态变化后重新提交。
 */
public class BridgeException extends RuntimeException {

    private final BridgeErrorCode code;

    public BridgeException(BridgeErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BridgeException(BridgeErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public BridgeErrorCode getCode() {
        return code;
    }
}
