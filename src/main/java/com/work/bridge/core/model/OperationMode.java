package com.work.bridge.core.model;

/**
 * (chainId, token) 上 relocation / accommodation 的处理方式。
 */
public enum OperationMode {
    /**
     * 未开通，相关请求直接拒绝。
     */
    UNSUPPORTED,
    /**
     * relocation 时销毁，accommodation 时增发。要求 token 支持 bridge 操作。
     */
    BURN_OR_MINT,
    /**
     * relocation 时锁定在托管账户，accommodation 时从托管账户转出。
     */
    LOCK_OR_TRANSFER
}
