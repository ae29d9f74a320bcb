package com.work.bridge.core.event;

import com.work.bridge.core.access.BridgeRole;
import com.work.bridge.core.model.OperationMode;
import com.work.bridge.core.model.RelocationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * 默认实现：把所有已提交的事件写入日志，便于审计与排查。
 */
public class LoggingBridgeEventListener implements BridgeEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingBridgeEventListener.class);

    @Override
    public void onRequestRelocation(long chainId, String token, String account, BigInteger amount, long nonce, BigInteger fee) {
        log.info("RequestRelocation chainId={} token={} account={} amount={} nonce={} fee={}",
                chainId, token, account, amount, nonce, fee);
    }

    @Override
    public void onChangeRelocationStatus(long chainId, String token, String account, BigInteger amount, long nonce,
                                         RelocationStatus newStatus, RelocationStatus oldStatus) {
        log.info("ChangeRelocationStatus chainId={} nonce={} token={} account={} amount={} {} -> {}",
                chainId, nonce, token, account, amount, oldStatus, newStatus);
    }

    @Override
    public void onContinueRelocation(long chainId, long oldNonce, long newNonce) {
        log.info("ContinueRelocation chainId={} oldNonce={} newNonce={}", chainId, oldNonce, newNonce);
    }

    @Override
    public void onRelocate(long chainId, String token, String account, BigInteger amount, long nonce,
                           BigInteger fee, OperationMode mode) {
        log.info("Relocate chainId={} token={} account={} amount={} nonce={} fee={} mode={}",
                chainId, token, account, amount, nonce, fee, mode);
    }

    @Override
    public void onAccommodate(long chainId, String token, String account, BigInteger amount, long nonce, OperationMode mode) {
        log.info("Accommodate chainId={} token={} account={} amount={} nonce={} mode={}",
                chainId, token, account, amount, nonce, mode);
    }

    @Override
    public void onSetRelocationMode(long chainId, String token, OperationMode oldMode, OperationMode newMode) {
        log.info("SetRelocationMode chainId={} token={} {} -> {}", chainId, token, oldMode, newMode);
    }

    @Override
    public void onSetAccommodationMode(long chainId, String token, OperationMode oldMode, OperationMode newMode) {
        log.info("SetAccommodationMode chainId={} token={} {} -> {}", chainId, token, oldMode, newMode);
    }

    @Override
    public void onSetFeeOracle(String oldFeeOracle, String newFeeOracle) {
        log.info("SetFeeOracle {} -> {}", oldFeeOracle, newFeeOracle);
    }

    @Override
    public void onSetFeeCollector(String oldFeeCollector, String newFeeCollector) {
        log.info("SetFeeCollector {} -> {}", oldFeeCollector, newFeeCollector);
    }

    @Override
    public void onConfigureAccommodationGuard(long chainId, String token, long timeFrame, BigInteger volumeLimit) {
        log.info("ConfigureAccommodationGuard chainId={} token={} timeFrame={} volumeLimit={}",
                chainId, token, timeFrame, volumeLimit);
    }

    @Override
    public void onResetAccommodationGuard(long chainId, String token) {
        log.info("ResetAccommodationGuard chainId={} token={}", chainId, token);
    }

    @Override
    public void onSetBridge(String oldBridge, String newBridge) {
        log.info("SetBridge {} -> {}", oldBridge, newBridge);
    }

    @Override
    public void onPaused(String account) {
        log.info("Paused account={}", account);
    }

    @Override
    public void onUnpaused(String account) {
        log.info("Unpaused account={}", account);
    }

    @Override
    public void onRoleGranted(BridgeRole role, String account, String sender) {
        log.info("RoleGranted role={} account={} sender={}", role, account, sender);
    }

    @Override
    public void onRoleRevoked(BridgeRole role, String account, String sender) {
        log.info("RoleRevoked role={} account={} sender={}", role, account, sender);
    }
}
