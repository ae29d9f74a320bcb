package com.work.bridge.core.service;

import com.work.bridge.core.config.BridgeConfig;
import com.work.bridge.core.event.BridgeEventPublisher;
import com.work.bridge.core.exception.AccommodationValidationFailureException;
import com.work.bridge.core.exception.BridgeErrorCode;
import com.work.bridge.core.exception.BridgeException;
import com.work.bridge.core.exception.InappropriateRelocationStatusException;
import com.work.bridge.core.gateway.FeeOracle;
import com.work.bridge.core.gateway.FeeOracleResolver;
import com.work.bridge.core.gateway.TokenGateway;
import com.work.bridge.core.guard.AccommodationGuardService;
import com.work.bridge.core.model.Accommodation;
import com.work.bridge.core.model.ChainLedgerState;
import com.work.bridge.core.model.FeeRefundMode;
import com.work.bridge.core.model.FeeSettings;
import com.work.bridge.core.model.OperationMode;
import com.work.bridge.core.model.Relocation;
import com.work.bridge.core.model.RelocationStatus;
import com.work.bridge.core.model.ValidationStatus;
import com.work.bridge.core.repository.BridgeLedgerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.work.bridge.core.support.ValidationUtils.isZeroAddress;
import static com.work.bridge.core.support.ValidationUtils.isZeroAmount;
import static com.work.bridge.core.support.ValidationUtils.normalizeAddress;
import static com.work.bridge.core.support.ValidationUtils.requireAddress;
import static com.work.bridge.core.support.ValidationUtils.requireNonNull;

/**
 * 负责"每条目标链上的 relocation / accommodation 账本"。
 * <p>
 * 出站：requestRelocation 登记并锁入资金 → relayer 调用 relocate 批量处理（销毁或继续锁定）；
 * 处理前可 cancel / reject（退款）、abort（罚没）、postpone → continue（换新 nonce 重新排队）。
 * 入站：relayer 按源链 nonce 顺序提交 accommodate 批次，PROCESSED 条目经 guard 校验后增发或从托管转出。
 * <p>
 * 事务边界：每个公开写操作都是一个完整事务，任何异常都会回滚账本、guard 以及（内存模式下的）代币余额，
 * 不存在部分生效的中间状态。同一条链的串行化由外层 ChainExecutor 保证。
 */
public class BridgeLedgerService {

    private static final Logger log = LoggerFactory.getLogger(BridgeLedgerService.class);

    private static final int TRANSACTION_TIMEOUT_SECONDS = 30;

    private final BridgeLedgerRepository repository;
    private final TokenGateway tokenGateway;
    private final FeeOracleResolver feeOracleResolver;
    private final AccommodationGuardService guard;
    private final BridgeEventPublisher events;
    private final BridgeConfig config;
    private final Clock clock;
    private final TransactionTemplate txTemplate;

    public BridgeLedgerService(BridgeLedgerRepository repository,
                               TokenGateway tokenGateway,
                               FeeOracleResolver feeOracleResolver,
                               AccommodationGuardService guard,
                               BridgeEventPublisher events,
                               BridgeConfig config,
                               Clock clock,
                               @NonNull PlatformTransactionManager transactionManager) {
        this.repository = requireNonNull(repository, "repository");
        this.tokenGateway = requireNonNull(tokenGateway, "tokenGateway");
        this.feeOracleResolver = requireNonNull(feeOracleResolver, "feeOracleResolver");
        this.guard = requireNonNull(guard, "guard");
        this.events = requireNonNull(events, "events");
        this.config = requireNonNull(config, "config");
        this.clock = requireNonNull(clock, "clock");
        requireNonNull(transactionManager, "transactionManager");
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setTimeout(TRANSACTION_TIMEOUT_SECONDS);
        this.txTemplate = template;
    }

    // ------------------------------------------------------------------ relocation

    /**
     * 登记一笔出站 relocation，并从 account 拉取 amount + fee 进入托管。
     *
     * @return 分配到的 nonce
     */
    public long requestRelocation(String account, long chainId, String token, BigInteger amount) {
        String normalizedAccount = requireNonNull(normalizeAddress(account), "account");
        String normalizedToken = requireAddress(token, BridgeErrorCode.ZERO_RELOCATION_TOKEN);
        if (isZeroAmount(amount)) {
            throw new BridgeException(BridgeErrorCode.ZERO_RELOCATION_AMOUNT, "relocation amount 必须大于0: " + amount);
        }

        Relocation relocation = txTemplate.execute(status -> {
            ChainLedgerState state = repository.lockAndLoadChainState(chainId);
            if (repository.findRelocationMode(chainId, normalizedToken) == OperationMode.UNSUPPORTED) {
                throw new BridgeException(BridgeErrorCode.UNSUPPORTED_RELOCATION,
                        "relocation 未开通: chainId=" + chainId + ", token=" + normalizedToken);
            }
            BigInteger fee = defineFee(chainId, normalizedToken, normalizedAccount, amount);

            long nonce = state.allocateRelocationNonce();
            state.setUpdatedAt(now());
            repository.updateChainState(state);

            Relocation created = Relocation.pending(chainId, nonce, normalizedToken, normalizedAccount, amount, fee, 0L, now());
            repository.insertRelocation(created);
            tokenGateway.transferIn(normalizedToken, normalizedAccount, amount.add(fee));

            events.publish(l -> l.onRequestRelocation(chainId, normalizedToken, normalizedAccount, amount, nonce, fee));
            return created;
        });
        log.info("relocation requested chainId={} nonce={} token={} account={} amount={} fee={}",
                chainId, relocation.getNonce(), normalizedToken, normalizedAccount, amount, relocation.getFee());
        return relocation.getNonce();
    }

    public void cancelRelocation(long chainId, long nonce, FeeRefundMode feeRefundMode) {
        refuseInTransaction(chainId, Collections.singletonList(nonce), RelocationStatus.CANCELED, feeRefundMode);
    }

    public void cancelRelocations(long chainId, List<Long> nonces, FeeRefundMode feeRefundMode) {
        requireNonEmptyNonces(nonces);
        refuseInTransaction(chainId, nonces, RelocationStatus.CANCELED, feeRefundMode);
    }

    public void rejectRelocation(long chainId, long nonce, FeeRefundMode feeRefundMode) {
        refuseInTransaction(chainId, Collections.singletonList(nonce), RelocationStatus.REJECTED, feeRefundMode);
    }

    public void rejectRelocations(long chainId, List<Long> nonces, FeeRefundMode feeRefundMode) {
        requireNonEmptyNonces(nonces);
        refuseInTransaction(chainId, nonces, RelocationStatus.REJECTED, feeRefundMode);
    }

    /**
     * 罚没：本金和手续费永久留在托管账户，不退款。
     */
    public void abortRelocation(long chainId, long nonce) {
        txTemplate.executeWithoutResult(status -> {
            repository.lockAndLoadChainState(chainId);
            Relocation relocation = loadRelocation(chainId, nonce);
            if (!relocation.getStatus().isRefusable()) {
                throw new InappropriateRelocationStatusException(chainId, nonce, relocation.getStatus());
            }
            changeStatus(relocation, RelocationStatus.ABORTED);
        });
        log.info("relocation aborted chainId={} nonce={}", chainId, nonce);
    }

    /**
     * 暂缓处理：资金保持锁定，relocate 会跳过该 nonce，等待 continue / cancel / reject / abort。
     */
    public void postponeRelocation(long chainId, long nonce) {
        txTemplate.executeWithoutResult(status -> {
            repository.lockAndLoadChainState(chainId);
            Relocation relocation = loadRelocation(chainId, nonce);
            if (relocation.getStatus() != RelocationStatus.PENDING) {
                throw new InappropriateRelocationStatusException(chainId, nonce, relocation.getStatus());
            }
            changeStatus(relocation, RelocationStatus.POSTPONED);
        });
        log.info("relocation postponed chainId={} nonce={}", chainId, nonce);
    }

    /**
     * 为已暂缓的 relocation 分配新 nonce 重新排队；原记录标记为 CONTINUED 并通过 newNonce / oldNonce 互相关联。
     *
     * @return 新的 nonce
     */
    public long continueRelocation(long chainId, long nonce) {
        Long newNonce = txTemplate.execute(status -> {
            ChainLedgerState state = repository.lockAndLoadChainState(chainId);
            Relocation original = loadRelocation(chainId, nonce);
            if (original.getStatus() != RelocationStatus.POSTPONED) {
                throw new InappropriateRelocationStatusException(chainId, nonce, original.getStatus());
            }
            long allocated = state.allocateRelocationNonce();
            state.setUpdatedAt(now());
            repository.updateChainState(state);

            repository.insertRelocation(Relocation.pending(chainId, allocated, original.getToken(), original.getAccount(),
                    original.getAmount(), original.getFee(), nonce, now()));
            original.setNewNonce(allocated);
            changeStatus(original, RelocationStatus.CONTINUED);

            events.publish(l -> l.onContinueRelocation(chainId, nonce, allocated));
            return allocated;
        });
        log.info("relocation continued chainId={} oldNonce={} newNonce={}", chainId, nonce, newNonce);
        return newNonce;
    }

    /**
     * 批量处理接下来的 count 个 nonce。计数器先整体推进，再逐条处理：
     * 仍为 PENDING 的条目变为 PROCESSED，BurnOrMint 模式下销毁本金，手续费转给 fee collector；
     * 其余状态的条目直接跳过。
     *
     * @return 实际处理（状态变为 PROCESSED）的条数
     */
    public int relocate(long chainId, int count) {
        if (count <= 0) {
            throw new BridgeException(BridgeErrorCode.ZERO_RELOCATION_COUNT, "relocation count 必须大于0: " + count);
        }
        Integer processed = txTemplate.execute(status -> {
            ChainLedgerState state = repository.lockAndLoadChainState(chainId);
            if (count > state.getPendingRelocationCount()) {
                throw new BridgeException(BridgeErrorCode.LACK_OF_PENDING_RELOCATIONS,
                        "pending relocation 不足: chainId=" + chainId + ", count=" + count
                                + ", pending=" + state.getPendingRelocationCount());
            }
            long firstNonce = state.advanceProcessed(count);
            state.setUpdatedAt(now());
            repository.updateChainState(state);

            String feeCollector = repository.loadFeeSettings().getFeeCollector();
            int transitioned = 0;
            for (Relocation relocation : repository.findRelocations(chainId, firstNonce, count)) {
                if (relocation.getStatus() != RelocationStatus.PENDING) {
                    continue;
                }
                OperationMode mode = repository.findRelocationMode(chainId, relocation.getToken());
                relocation.setStatus(RelocationStatus.PROCESSED);
                relocation.setUpdatedAt(now());
                repository.updateRelocation(relocation);

                if (mode == OperationMode.BURN_OR_MINT
                        && !tokenGateway.burn(relocation.getToken(), config.getCustodyAccount(), relocation.getAmount())) {
                    throw new BridgeException(BridgeErrorCode.TOKEN_BURNING_FAILURE,
                            "burn 失败: chainId=" + chainId + ", nonce=" + relocation.getNonce() + ", token=" + relocation.getToken());
                }
                if (relocation.hasFee()) {
                    forwardFee(relocation, feeCollector);
                }
                events.publish(l -> l.onRelocate(chainId, relocation.getToken(), relocation.getAccount(),
                        relocation.getAmount(), relocation.getNonce(), relocation.getFee(), mode));
                transitioned++;
            }
            return transitioned;
        });
        log.info("relocate chainId={} count={} processed={}", chainId, count, processed);
        return processed;
    }

    // ------------------------------------------------------------------ accommodation

    /**
     * 按源链 nonce 顺序入账一个批次。firstNonce 必须等于 lastAccommodationNonce + 1。
     * <p>
     * 只有声明为 PROCESSED 的条目会产生资金流动，且先全部通过 guard 校验再执行转账；
     * 任一条目校验失败则整个批次回滚。无论实际入账几条，lastAccommodationNonce 都前进 entries.size()。
     */
    public void accommodate(long chainId, long firstNonce, List<Accommodation> entries) {
        if (firstNonce <= 0) {
            throw new BridgeException(BridgeErrorCode.ZERO_ACCOMMODATION_NONCE, "accommodation nonce 必须大于0: " + firstNonce);
        }
        txTemplate.executeWithoutResult(status -> {
            ChainLedgerState state = repository.lockAndLoadChainState(chainId);
            if (firstNonce != state.getLastAccommodationNonce() + 1) {
                throw new BridgeException(BridgeErrorCode.ACCOMMODATION_NONCE_MISMATCH,
                        "accommodation nonce 不连续: chainId=" + chainId + ", nonce=" + firstNonce
                                + ", expected=" + (state.getLastAccommodationNonce() + 1));
            }
            if (entries == null || entries.isEmpty()) {
                throw new BridgeException(BridgeErrorCode.EMPTY_ACCOMMODATION_ARRAY, "accommodation 批次不能为空");
            }

            List<AccommodationItem> items = new ArrayList<>(entries.size());
            for (int i = 0; i < entries.size(); i++) {
                items.add(checkAccommodation(chainId, entries.get(i), firstNonce + i));
            }

            if (config.isGuardEnabled()) {
                for (int i = 0; i < items.size(); i++) {
                    AccommodationItem item = items.get(i);
                    if (!item.processed) {
                        continue;
                    }
                    ValidationStatus result = guard.validate(config.getLedgerAddress(), chainId, item.token, item.account, item.amount);
                    if (result != ValidationStatus.NO_ERROR) {
                        throw new AccommodationValidationFailureException(chainId, i, result);
                    }
                }
            }

            for (AccommodationItem item : items) {
                if (!item.processed) {
                    continue;
                }
                if (item.mode == OperationMode.BURN_OR_MINT) {
                    if (!tokenGateway.mint(item.token, item.account, item.amount)) {
                        throw new BridgeException(BridgeErrorCode.TOKEN_MINTING_FAILURE,
                                "mint 失败: chainId=" + chainId + ", nonce=" + item.nonce + ", token=" + item.token);
                    }
                } else {
                    tokenGateway.transferOut(item.token, item.account, item.amount);
                }
                events.publish(l -> l.onAccommodate(chainId, item.token, item.account, item.amount, item.nonce, item.mode));
            }

            state.advanceAccommodation(entries.size());
            state.setUpdatedAt(now());
            repository.updateChainState(state);
        });
        log.info("accommodate chainId={} firstNonce={} size={}", chainId, firstNonce, entries.size());
    }

    private AccommodationItem checkAccommodation(long chainId, Accommodation entry, long nonce) {
        requireNonNull(entry, "accommodation");
        String token = normalizeAddress(entry.getToken());
        OperationMode mode = token == null
                ? OperationMode.UNSUPPORTED
                : repository.findAccommodationMode(chainId, token);
        if (mode == OperationMode.UNSUPPORTED) {
            throw new BridgeException(BridgeErrorCode.UNSUPPORTED_ACCOMMODATION,
                    "accommodation 未开通: chainId=" + chainId + ", token=" + entry.getToken());
        }
        if (isZeroAddress(entry.getAccount())) {
            throw new BridgeException(BridgeErrorCode.ZERO_ACCOMMODATION_ACCOUNT, "accommodation account 不能为零地址: nonce=" + nonce);
        }
        if (isZeroAmount(entry.getAmount())) {
            throw new BridgeException(BridgeErrorCode.ZERO_ACCOMMODATION_AMOUNT, "accommodation amount 必须大于0: nonce=" + nonce);
        }
        return new AccommodationItem(nonce, token, normalizeAddress(entry.getAccount()), entry.getAmount(), mode, entry.isProcessed());
    }

    // ------------------------------------------------------------------ configuration

    public void setRelocationMode(long chainId, String token, OperationMode newMode) {
        String normalizedToken = requireAddress(token, BridgeErrorCode.ZERO_TOKEN_ADDRESS);
        requireNonNull(newMode, "newMode");
        txTemplate.executeWithoutResult(status -> {
            repository.lockAndLoadChainState(chainId);
            OperationMode oldMode = repository.findRelocationMode(chainId, normalizedToken);
            if (oldMode == newMode) {
                throw new BridgeException(BridgeErrorCode.UNCHANGED_RELOCATION_MODE, "relocation mode 未变化: " + newMode);
            }
            if (config.isModeImmutable() && oldMode != OperationMode.UNSUPPORTED) {
                throw new BridgeException(BridgeErrorCode.RELOCATION_MODE_IS_IMMUTABLE,
                        "relocation mode 已设置且不可修改: chainId=" + chainId + ", token=" + normalizedToken + ", mode=" + oldMode);
            }
            requireBridgeable(normalizedToken, newMode);
            repository.saveRelocationMode(chainId, normalizedToken, newMode);
            events.publish(l -> l.onSetRelocationMode(chainId, normalizedToken, oldMode, newMode));
        });
    }

    public void setAccommodationMode(long chainId, String token, OperationMode newMode) {
        String normalizedToken = requireAddress(token, BridgeErrorCode.ZERO_TOKEN_ADDRESS);
        requireNonNull(newMode, "newMode");
        txTemplate.executeWithoutResult(status -> {
            repository.lockAndLoadChainState(chainId);
            OperationMode oldMode = repository.findAccommodationMode(chainId, normalizedToken);
            if (oldMode == newMode) {
                throw new BridgeException(BridgeErrorCode.UNCHANGED_ACCOMMODATION_MODE, "accommodation mode 未变化: " + newMode);
            }
            if (config.isModeImmutable() && oldMode != OperationMode.UNSUPPORTED) {
                throw new BridgeException(BridgeErrorCode.ACCOMMODATION_MODE_IS_IMMUTABLE,
                        "accommodation mode 已设置且不可修改: chainId=" + chainId + ", token=" + normalizedToken + ", mode=" + oldMode);
            }
            requireBridgeable(normalizedToken, newMode);
            repository.saveAccommodationMode(chainId, normalizedToken, newMode);
            events.publish(l -> l.onSetAccommodationMode(chainId, normalizedToken, oldMode, newMode));
        });
    }

    /**
     * 设置 fee oracle 地址；传入零地址表示关闭。
     */
    public void setFeeOracle(String newFeeOracle) {
        String normalized = normalizeAddress(newFeeOracle);
        txTemplate.executeWithoutResult(status -> {
            FeeSettings settings = repository.lockAndLoadFeeSettings();
            String oldFeeOracle = settings.getFeeOracle();
            if (Objects.equals(oldFeeOracle, normalized)) {
                throw new BridgeException(BridgeErrorCode.UNCHANGED_FEE_ORACLE, "fee oracle 未变化: " + normalized);
            }
            repository.saveFeeSettings(settings.withFeeOracle(normalized));
            events.publish(l -> l.onSetFeeOracle(oldFeeOracle, normalized));
        });
    }

    /**
     * 设置 fee collector 地址；传入零地址表示关闭。
     */
    public void setFeeCollector(String newFeeCollector) {
        String normalized = normalizeAddress(newFeeCollector);
        txTemplate.executeWithoutResult(status -> {
            FeeSettings settings = repository.lockAndLoadFeeSettings();
            String oldFeeCollector = settings.getFeeCollector();
            if (Objects.equals(oldFeeCollector, normalized)) {
                throw new BridgeException(BridgeErrorCode.UNCHANGED_FEE_COLLECTOR, "fee collector 未变化: " + normalized);
            }
            repository.saveFeeSettings(settings.withFeeCollector(normalized));
            events.publish(l -> l.onSetFeeCollector(oldFeeCollector, normalized));
        });
    }

    // ------------------------------------------------------------------ read API

    public ChainLedgerState getChainState(long chainId) {
        return repository.findChainState(chainId);
    }

    public long getPendingRelocationCount(long chainId) {
        return repository.findChainState(chainId).getPendingRelocationCount();
    }

    public long getLastProcessedRelocationNonce(long chainId) {
        return repository.findChainState(chainId).getLastProcessedRelocationNonce();
    }

    public long getLastAccommodationNonce(long chainId) {
        return repository.findChainState(chainId).getLastAccommodationNonce();
    }

    public Optional<Relocation> getRelocation(long chainId, long nonce) {
        return repository.findRelocation(chainId, nonce);
    }

    public List<Relocation> getRelocations(long chainId, long fromNonce, int count) {
        return repository.findRelocations(chainId, fromNonce, count);
    }

    public OperationMode getRelocationMode(long chainId, String token) {
        String normalized = normalizeAddress(token);
        return normalized == null ? OperationMode.UNSUPPORTED : repository.findRelocationMode(chainId, normalized);
    }

    public OperationMode getAccommodationMode(long chainId, String token) {
        String normalized = normalizeAddress(token);
        return normalized == null ? OperationMode.UNSUPPORTED : repository.findAccommodationMode(chainId, normalized);
    }

    public String getFeeOracle() {
        return repository.loadFeeSettings().getFeeOracle();
    }

    public String getFeeCollector() {
        return repository.loadFeeSettings().getFeeCollector();
    }

    public boolean isFeeTaken() {
        return repository.loadFeeSettings().isFeeTaken();
    }

    // ------------------------------------------------------------------ internals

    private void refuseInTransaction(long chainId, List<Long> nonces, RelocationStatus target, FeeRefundMode feeRefundMode) {
        requireNonNull(feeRefundMode, "feeRefundMode");
        txTemplate.executeWithoutResult(status -> {
            repository.lockAndLoadChainState(chainId);
            String feeCollector = repository.loadFeeSettings().getFeeCollector();
            for (Long nonce : nonces) {
                refuse(chainId, requireNonNull(nonce, "nonce"), target, feeRefundMode, feeCollector);
            }
        });
        log.info("relocations refused chainId={} nonces={} status={} feeRefundMode={}", chainId, nonces, target, feeRefundMode);
    }

    private void refuse(long chainId, long nonce, RelocationStatus target, FeeRefundMode feeRefundMode, String feeCollector) {
        Relocation relocation = loadRelocation(chainId, nonce);
        if (!relocation.getStatus().isRefusable()) {
            throw new InappropriateRelocationStatusException(chainId, nonce, relocation.getStatus());
        }
        changeStatus(relocation, target);

        BigInteger refund = relocation.getAmount();
        if (relocation.hasFee()) {
            if (feeRefundMode == FeeRefundMode.FULL) {
                refund = refund.add(relocation.getFee());
            } else {
                forwardFee(relocation, feeCollector);
            }
        }
        tokenGateway.transferOut(relocation.getToken(), relocation.getAccount(), refund);
    }

    private void changeStatus(Relocation relocation, RelocationStatus newStatus) {
        RelocationStatus oldStatus = relocation.getStatus();
        relocation.setStatus(newStatus);
        relocation.setUpdatedAt(now());
        repository.updateRelocation(relocation);
        events.publish(l -> l.onChangeRelocationStatus(relocation.getChainId(), relocation.getToken(),
                relocation.getAccount(), relocation.getAmount(), relocation.getNonce(), newStatus, oldStatus));
    }

    /**
     * 没有配置 fee collector 时手续费留在托管账户。
     */
    private void forwardFee(Relocation relocation, String feeCollector) {
        if (feeCollector == null) {
            log.warn("fee collector not set, fee stays in custody chainId={} nonce={} fee={}",
                    relocation.getChainId(), relocation.getNonce(), relocation.getFee());
            return;
        }
        tokenGateway.transferOut(relocation.getToken(), feeCollector, relocation.getFee());
    }

    private Relocation loadRelocation(long chainId, long nonce) {
        return repository.findRelocation(chainId, nonce)
                .orElseThrow(() -> new InappropriateRelocationStatusException(chainId, nonce, RelocationStatus.NONEXISTENT));
    }

    private BigInteger defineFee(long chainId, String token, String account, BigInteger amount) {
        FeeSettings settings = repository.loadFeeSettings();
        if (!settings.isFeeTaken()) {
            return BigInteger.ZERO;
        }
        FeeOracle oracle = feeOracleResolver.resolve(settings.getFeeOracle())
                .orElseThrow(() -> new BridgeException(BridgeErrorCode.UNKNOWN_FEE_ORACLE,
                        "无法解析 fee oracle: " + settings.getFeeOracle()));
        BigInteger fee = oracle.defineFee(chainId, token, account, amount);
        if (fee == null) {
            return BigInteger.ZERO;
        }
        if (fee.signum() < 0) {
            throw new IllegalStateException("fee oracle 返回了负数手续费: " + fee);
        }
        return fee;
    }

    private void requireBridgeable(String token, OperationMode newMode) {
        if (newMode == OperationMode.BURN_OR_MINT && !tokenGateway.supportsBridge(token)) {
            throw new BridgeException(BridgeErrorCode.NON_BRIDGEABLE_TOKEN, "token 不支持 bridge 操作: " + token);
        }
    }

    private static void requireNonEmptyNonces(List<Long> nonces) {
        if (nonces == null || nonces.isEmpty()) {
            throw new BridgeException(BridgeErrorCode.EMPTY_NONCE_ARRAY, "nonce 列表不能为空");
        }
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private static final class AccommodationItem {
        private final long nonce;
        private final String token;
        private final String account;
        private final BigInteger amount;
        private final OperationMode mode;
        private final boolean processed;

        private AccommodationItem(long nonce, String token, String account, BigInteger amount,
                                  OperationMode mode, boolean processed) {
            this.nonce = nonce;
            this.token = token;
            this.account = account;
            this.amount = amount;
            this.mode = mode;
            this.processed = processed;
        }
    }
}
