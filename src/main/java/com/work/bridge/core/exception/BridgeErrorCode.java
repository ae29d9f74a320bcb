package com.work.bridge.core.exception;

/**
 * 对外可识别的错误码，一个错误码对应一种失败条件。
 * <p>
 * {@link #isStateError()} 区分“参数错误”和“状态冲突”，REST 层据此映射 400 / 409。
 */
public enum BridgeErrorCode {

    // relocation 参数
    ZERO_RELOCATION_TOKEN(false),
    ZERO_RELOCATION_AMOUNT(false),
    UNSUPPORTED_RELOCATION(false),
    ZERO_RELOCATION_COUNT(false),
    EMPTY_NONCE_ARRAY(false),

    // relocation 状态
    LACK_OF_PENDING_RELOCATIONS(true),
    INAPPROPRIATE_RELOCATION_STATUS(true),

    // accommodation
    ZERO_ACCOMMODATION_NONCE(false),
    ACCOMMODATION_NONCE_MISMATCH(true),
    EMPTY_ACCOMMODATION_ARRAY(false),
    UNSUPPORTED_ACCOMMODATION(false),
    ZERO_ACCOMMODATION_ACCOUNT(false),
    ZERO_ACCOMMODATION_AMOUNT(false),
    ACCOMMODATION_VALIDATION_FAILURE(true),

    // token gateway
    TOKEN_BURNING_FAILURE(true),
    TOKEN_MINTING_FAILURE(true),
    TOKEN_TRANSFER_FAILURE(true),
    NON_BRIDGEABLE_TOKEN(false),

    // 配置
    RELOCATION_MODE_IS_IMMUTABLE(true),
    ACCOMMODATION_MODE_IS_IMMUTABLE(true),
    UNCHANGED_RELOCATION_MODE(true),
    UNCHANGED_ACCOMMODATION_MODE(true),
    UNCHANGED_FEE_ORACLE(true),
    UNCHANGED_FEE_COLLECTOR(true),
    UNKNOWN_FEE_ORACLE(true),

    // guard
    ZERO_CHAIN_ID(false),
    ZERO_TOKEN_ADDRESS(false),
    ZERO_TIME_FRAME(false),
    ZERO_VOLUME_LIMIT(false),
    ZERO_BRIDGE_ADDRESS(false),
    NOT_BRIDGE(true),

    // 访问控制 / 暂停
    ACCESS_DENIED(true),
    PAUSED(true),
    NOT_PAUSED(true);

    private final boolean stateError;

    BridgeErrorCode(boolean stateError) {
        this.stateError = stateError;
    }

    public boolean isStateError() {
        return stateError;
    }
}
