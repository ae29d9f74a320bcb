package com.work.bridge.core.event;

import com.work.bridge.core.access.BridgeRole;
import com.work.bridge.core.model.OperationMode;
import com.work.bridge.core.model.RelocationStatus;

import java.math.BigInteger;

/**
 * 事件端口（对应原合约的 event）。
 *
 * 设计目标：
 * - 核心路径只调用接口，不绑定具体实现（日志、消息队列、审计表均可）
 * - 只在事务提交后回调，回滚的操作不会产生任何事件
 */
public interface BridgeEventListener {

    default void onRequestRelocation(long chainId, String token, String account, BigInteger amount,
                                     long nonce, BigInteger fee) {
    }

    default void onChangeRelocationStatus(long chainId, String token, String account, BigInteger amount,
                                          long nonce, RelocationStatus newStatus, RelocationStatus oldStatus) {
    }

    default void onContinueRelocation(long chainId, long oldNonce, long newNonce) {
    }

    default void onRelocate(long chainId, String token, String account, BigInteger amount, long nonce,
                            BigInteger fee, OperationMode mode) {
    }

    default void onAccommodate(long chainId, String token, String account, BigInteger amount, long nonce,
                               OperationMode mode) {
    }

    default void onSetRelocationMode(long chainId, String token, OperationMode oldMode, OperationMode newMode) {
    }

    default void onSetAccommodationMode(long chainId, String token, OperationMode oldMode, OperationMode newMode) {
    }

    default void onSetFeeOracle(String oldFeeOracle, String newFeeOracle) {
    }

    default void onSetFeeCollector(String oldFeeCollector, String newFeeCollector) {
    }

    default void onConfigureAccommodationGuard(long chainId, String token, long timeFrame, BigInteger volumeLimit) {
    }

    default void onResetAccommodationGuard(long chainId, String token) {
    }

    default void onSetBridge(String oldBridge, String newBridge) {
    }

    default void onPaused(String account) {
    }

    default void onUnpaused(String account) {
    }

    default void onRoleGranted(BridgeRole role, String account, String sender) {
    }

    default void onRoleRevoked(BridgeRole role, String account, String sender) {
    }
}
