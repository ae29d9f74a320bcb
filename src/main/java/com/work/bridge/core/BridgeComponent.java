package com.work.bridge.core;

import com.work.bridge.core.access.AccessControl;
import com.work.bridge.core.access.BridgeRole;
import com.work.bridge.core.access.PauseControl;
import com.work.bridge.core.exception.BridgeAccessDeniedException;
import com.work.bridge.core.execution.ChainExecutor;
import com.work.bridge.core.guard.AccommodationGuardService;
import com.work.bridge.core.model.Accommodation;
import com.work.bridge.core.model.ChainLedgerState;
import com.work.bridge.core.model.FeeRefundMode;
import com.work.bridge.core.model.GuardConfig;
import com.work.bridge.core.model.OperationMode;
import com.work.bridge.core.model.Relocation;
import com.work.bridge.core.service.BridgeLedgerService;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.work.bridge.core.support.ValidationUtils.normalizeAddress;

/**
 * 门面（Facade）层，对业务侧暴露最少的调用面。
 * <p>
 * 每个写操作依次完成：角色校验 → 暂停校验 → 路由到对应链的 lane 串行执行 → 交给 Service 在事务内处理。
 * 读操作不经过 lane，直接读取已提交的状态。
 */
public class BridgeComponent {

    private final BridgeLedgerService ledger;
    private final AccommodationGuardService guard;
    private final AccessControl accessControl;
    private final PauseControl pauseControl;
    private final ChainExecutor chainExecutor;

    public BridgeComponent(BridgeLedgerService ledger,
                           AccommodationGuardService guard,
                           AccessControl accessControl,
                           PauseControl pauseControl,
                           ChainExecutor chainExecutor) {
        this.ledger = ledger;
        this.guard = guard;
        this.accessControl = accessControl;
        this.pauseControl = pauseControl;
        this.chainExecutor = chainExecutor;
    }

    // ---------------------------------------------------------------- relocation

    /**
     * 任何账户都可以发起 relocation，资金从 caller 拉入托管。
     */
    public long requestRelocation(String caller, long chainId, String token, BigInteger amount) {
        pauseControl.requireNotPaused();
        return chainExecutor.execute(chainId, () -> ledger.requestRelocation(caller, chainId, token, amount));
    }

    /**
     * 单笔取消：BRIDGER 或 relocation 的发起账户本人都可以调用。
     */
    public void cancelRelocation(String caller, long chainId, long nonce, FeeRefundMode feeRefundMode) {
        pauseControl.requireNotPaused();
        if (!accessControl.hasRole(BridgeRole.BRIDGER, caller) && !isRelocationAccount(caller, chainId, nonce)) {
            throw new BridgeAccessDeniedException(caller, BridgeRole.BRIDGER);
        }
        chainExecutor.execute(chainId, () -> ledger.cancelRelocation(chainId, nonce, feeRefundMode));
    }

    public void cancelRelocations(String caller, long chainId, List<Long> nonces, FeeRefundMode feeRefundMode) {
        requireBridger(caller);
        chainExecutor.execute(chainId, () -> ledger.cancelRelocations(chainId, nonces, feeRefundMode));
    }

    public void rejectRelocation(String caller, long chainId, long nonce, FeeRefundMode feeRefundMode) {
        requireBridger(caller);
        chainExecutor.execute(chainId, () -> ledger.rejectRelocation(chainId, nonce, feeRefundMode));
    }

    public void rejectRelocations(String caller, long chainId, List<Long> nonces, FeeRefundMode feeRefundMode) {
        requireBridger(caller);
        chainExecutor.execute(chainId, () -> ledger.rejectRelocations(chainId, nonces, feeRefundMode));
    }

    public void abortRelocation(String caller, long chainId, long nonce) {
        requireBridger(caller);
        chainExecutor.execute(chainId, () -> ledger.abortRelocation(chainId, nonce));
    }

    public void postponeRelocation(String caller, long chainId, long nonce) {
        requireBridger(caller);
        chainExecutor.execute(chainId, () -> ledger.postponeRelocation(chainId, nonce));
    }

    public long continueRelocation(String caller, long chainId, long nonce) {
        requireBridger(caller);
        return chainExecutor.execute(chainId, () -> ledger.continueRelocation(chainId, nonce));
    }

    public int relocate(String caller, long chainId, int count) {
        requireBridger(caller);
        return chainExecutor.execute(chainId, () -> ledger.relocate(chainId, count));
    }

    // ---------------------------------------------------------------- accommodation

    public void accommodate(String caller, long chainId, long firstNonce, List<Accommodation> entries) {
        requireBridger(caller);
        chainExecutor.execute(chainId, () -> ledger.accommodate(chainId, firstNonce, entries));
    }

    // ---------------------------------------------------------------- configuration（OWNER）

    public void setRelocationMode(String caller, long chainId, String token, OperationMode mode) {
        accessControl.checkRole(BridgeRole.OWNER, caller);
        chainExecutor.execute(chainId, () -> ledger.setRelocationMode(chainId, token, mode));
    }

    public void setAccommodationMode(String caller, long chainId, String token, OperationMode mode) {
        accessControl.checkRole(BridgeRole.OWNER, caller);
        chainExecutor.execute(chainId, () -> ledger.setAccommodationMode(chainId, token, mode));
    }

    public void setFeeOracle(String caller, String feeOracle) {
        accessControl.checkRole(BridgeRole.OWNER, caller);
        chainExecutor.execute(ChainExecutor.GLOBAL_LANE, () -> ledger.setFeeOracle(feeOracle));
    }

    public void setFeeCollector(String caller, String feeCollector) {
        accessControl.checkRole(BridgeRole.OWNER, caller);
        chainExecutor.execute(ChainExecutor.GLOBAL_LANE, () -> ledger.setFeeCollector(feeCollector));
    }

    public void configureGuard(String caller, long chainId, String token, long timeFrame, BigInteger volumeLimit) {
        accessControl.checkRole(BridgeRole.OWNER, caller);
        chainExecutor.execute(chainId, () -> guard.configure(chainId, token, timeFrame, volumeLimit));
    }

    public void resetGuard(String caller, long chainId, String token) {
        accessControl.checkRole(BridgeRole.OWNER, caller);
        chainExecutor.execute(chainId, () -> guard.reset(chainId, token));
    }

    public void setGuardBridge(String caller, String bridge) {
        accessControl.checkRole(BridgeRole.OWNER, caller);
        chainExecutor.execute(ChainExecutor.GLOBAL_LANE, () -> guard.setBridge(bridge));
    }

    public void grantRole(String caller, BridgeRole role, String account) {
        chainExecutor.execute(ChainExecutor.GLOBAL_LANE, () -> accessControl.grantRole(role, account, caller));
    }

    public void revokeRole(String caller, BridgeRole role, String account) {
        chainExecutor.execute(ChainExecutor.GLOBAL_LANE, () -> accessControl.revokeRole(role, account, caller));
    }

    public void pause(String caller) {
        accessControl.checkRole(BridgeRole.PAUSER, caller);
        pauseControl.pause(caller);
    }

    public void unpause(String caller) {
        accessControl.checkRole(BridgeRole.PAUSER, caller);
        pauseControl.unpause(caller);
    }

    // ---------------------------------------------------------------- read API

    public ChainLedgerState getChainState(long chainId) {
        return ledger.getChainState(chainId);
    }

    public long getPendingRelocationCount(long chainId) {
        return ledger.getPendingRelocationCount(chainId);
    }

    public long getLastProcessedRelocationNonce(long chainId) {
        return ledger.getLastProcessedRelocationNonce(chainId);
    }

    public long getLastAccommodationNonce(long chainId) {
        return ledger.getLastAccommodationNonce(chainId);
    }

    public Optional<Relocation> getRelocation(long chainId, long nonce) {
        return ledger.getRelocation(chainId, nonce);
    }

    public List<Relocation> getRelocations(long chainId, long fromNonce, int count) {
        return ledger.getRelocations(chainId, fromNonce, count);
    }

    public OperationMode getRelocationMode(long chainId, String token) {
        return ledger.getRelocationMode(chainId, token);
    }

    public OperationMode getAccommodationMode(long chainId, String token) {
        return ledger.getAccommodationMode(chainId, token);
    }

    public String getFeeOracle() {
        return ledger.getFeeOracle();
    }

    public String getFeeCollector() {
        return ledger.getFeeCollector();
    }

    public boolean isFeeTaken() {
        return ledger.isFeeTaken();
    }

    public GuardConfig getGuardConfig(long chainId, String token) {
        return guard.getConfig(chainId, token);
    }

    public String getGuardBridge() {
        return guard.getBridge();
    }

    public boolean paused() {
        return pauseControl.paused();
    }

    public boolean hasRole(BridgeRole role, String account) {
        return accessControl.hasRole(role, account);
    }

    public Set<String> roleMembers(BridgeRole role) {
        return accessControl.members(role);
    }

    private void requireBridger(String caller) {
        accessControl.checkRole(BridgeRole.BRIDGER, caller);
        pauseControl.requireNotPaused();
    }

    private boolean isRelocationAccount(String caller, long chainId, long nonce) {
        String normalized = normalizeAddress(caller);
        return normalized != null && ledger.getRelocation(chainId, nonce)
                .map(r -> normalized.equals(r.getAccount()))
                .orElse(false);
    }
}
