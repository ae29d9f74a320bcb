package com.work.bridge.core.repository.impl;

import com.work.bridge.core.model.ChainLedgerState;
import com.work.bridge.core.model.FeeSettings;
import com.work.bridge.core.model.OperationMode;
import com.work.bridge.core.model.Relocation;
import com.work.bridge.core.model.RelocationStatus;
import com.work.bridge.core.repository.BridgeLedgerRepository;
import com.work.bridge.core.repository.entity.BridgeSettingEntity;
import com.work.bridge.core.repository.entity.ChainLedgerStateEntity;
import com.work.bridge.core.repository.entity.RelocationEntity;
import com.work.bridge.core.repository.entity.TokenModeEntity;
import com.work.bridge.core.repository.mapper.BridgeSettingMapper;
import com.work.bridge.core.repository.mapper.ChainLedgerStateMapper;
import com.work.bridge.core.repository.mapper.RelocationMapper;
import com.work.bridge.core.repository.mapper.TokenModeMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.work.bridge.core.support.ValidationUtils.requireNonEmpty;
import static com.work.bridge.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 BridgeLedgerRepository 实现。
 * <p>
 * 注意：
 * 1. 所有方法都必须在事务中调用，事务边界由 Service 层统一管理
 * 2. 计数器行通过 SELECT FOR UPDATE 加锁，同一条链的写操作在数据库层串行
 * 3. fee 配置以 fee_oracle 行作为锁行，oracle / collector 的修改同样串行
 */
public class PostgresBridgeLedgerRepository implements BridgeLedgerRepository {

    static final String FEE_ORACLE_KEY = "fee_oracle";
    static final String FEE_COLLECTOR_KEY = "fee_collector";

    private final ChainLedgerStateMapper stateMapper;
    private final RelocationMapper relocationMapper;
    private final TokenModeMapper tokenModeMapper;
    private final BridgeSettingMapper settingMapper;

    public PostgresBridgeLedgerRepository(ChainLedgerStateMapper stateMapper,
                                          RelocationMapper relocationMapper,
                                          TokenModeMapper tokenModeMapper,
                                          BridgeSettingMapper settingMapper) {
        this.stateMapper = stateMapper;
        this.relocationMapper = relocationMapper;
        this.tokenModeMapper = tokenModeMapper;
        this.settingMapper = settingMapper;
    }

    @Override
    public ChainLedgerState lockAndLoadChainState(long chainId) {
        ChainLedgerStateEntity entity = stateMapper.lockAndLoad(chainId);
        if (entity == null) {
            // 不存在则初始化，并发初始化由 ON CONFLICT 吸收，随后重新加锁读取
            stateMapper.insertIfNotExists(chainId, Instant.now());
            entity = stateMapper.lockAndLoad(chainId);
        }
        if (entity == null) {
            throw new IllegalStateException("初始化链状态失败: chainId=" + chainId);
        }
        return toState(entity);
    }

    @Override
    public ChainLedgerState findChainState(long chainId) {
        ChainLedgerStateEntity entity = stateMapper.selectByChainId(chainId);
        return entity == null ? ChainLedgerState.init(chainId) : toState(entity);
    }

    @Override
    public void updateChainState(ChainLedgerState state) {
        requireNonNull(state, "state");
        ChainLedgerStateEntity entity = new ChainLedgerStateEntity();
        entity.setChainId(state.getChainId());
        entity.setPendingRelocationCount(state.getPendingRelocationCount());
        entity.setLastProcessedRelocationNonce(state.getLastProcessedRelocationNonce());
        entity.setLastAccommodationNonce(state.getLastAccommodationNonce());
        entity.setUpdatedAt(state.getUpdatedAt());
        if (stateMapper.updateCounters(entity) == 0) {
            throw new IllegalStateException("更新链状态失败，记录不存在: chainId=" + state.getChainId());
        }
    }

    @Override
    public Optional<Relocation> findRelocation(long chainId, long nonce) {
        return Optional.ofNullable(relocationMapper.selectByChainAndNonce(chainId, nonce)).map(this::toRelocation);
    }

    @Override
    public List<Relocation> findRelocations(long chainId, long fromNonce, int count) {
        List<Relocation> result = new ArrayList<>();
        if (count <= 0) {
            return result;
        }
        for (RelocationEntity entity : relocationMapper.selectRange(chainId, fromNonce, fromNonce + count)) {
            result.add(toRelocation(entity));
        }
        return result;
    }

    @Override
    public void insertRelocation(Relocation relocation) {
        requireNonNull(relocation, "relocation");
        RelocationEntity entity = toEntity(relocation);
        entity.setCreatedAt(relocation.getUpdatedAt());
        relocationMapper.insert(entity);
    }

    @Override
    public void updateRelocation(Relocation relocation) {
        requireNonNull(relocation, "relocation");
        if (relocationMapper.updateStatus(toEntity(relocation)) == 0) {
            throw new IllegalStateException("更新 relocation 失败，记录不存在: chainId="
                    + relocation.getChainId() + ", nonce=" + relocation.getNonce());
        }
    }

    @Override
    public OperationMode findRelocationMode(long chainId, String token) {
        TokenModeEntity entity = tokenModeMapper.selectByChainAndToken(chainId, requireNonEmpty(token, "token"));
        return entity == null ? OperationMode.UNSUPPORTED : OperationMode.valueOf(entity.getRelocationMode());
    }

    @Override
    public void saveRelocationMode(long chainId, String token, OperationMode mode) {
        tokenModeMapper.upsertRelocationMode(chainId, requireNonEmpty(token, "token"), requireNonNull(mode, "mode").name());
    }

    @Override
    public OperationMode findAccommodationMode(long chainId, String token) {
        TokenModeEntity entity = tokenModeMapper.selectByChainAndToken(chainId, requireNonEmpty(token, "token"));
        return entity == null ? OperationMode.UNSUPPORTED : OperationMode.valueOf(entity.getAccommodationMode());
    }

    @Override
    public void saveAccommodationMode(long chainId, String token, OperationMode mode) {
        tokenModeMapper.upsertAccommodationMode(chainId, requireNonEmpty(token, "token"), requireNonNull(mode, "mode").name());
    }

    @Override
    public FeeSettings loadFeeSettings() {
        return new FeeSettings(settingValue(FEE_ORACLE_KEY), settingValue(FEE_COLLECTOR_KEY));
    }

    @Override
    public FeeSettings lockAndLoadFeeSettings() {
        if (settingMapper.lockAndLoad(FEE_ORACLE_KEY) == null) {
            settingMapper.insertIfNotExists(FEE_ORACLE_KEY, Instant.now());
            if (settingMapper.lockAndLoad(FEE_ORACLE_KEY) == null) {
                throw new IllegalStateException("初始化 fee 配置行失败: key=" + FEE_ORACLE_KEY);
            }
        }
        return loadFeeSettings();
    }

    @Override
    public void saveFeeSettings(FeeSettings settings) {
        requireNonNull(settings, "settings");
        Instant now = Instant.now();
        settingMapper.upsert(FEE_ORACLE_KEY, settings.getFeeOracle(), now);
        settingMapper.upsert(FEE_COLLECTOR_KEY, settings.getFeeCollector(), now);
    }

    private String settingValue(String key) {
        BridgeSettingEntity entity = settingMapper.selectById(key);
        return entity == null ? null : entity.getSettingValue();
    }

    private ChainLedgerState toState(ChainLedgerStateEntity entity) {
        return new ChainLedgerState(
                entity.getChainId(),
                entity.getPendingRelocationCount(),
                entity.getLastProcessedRelocationNonce(),
                entity.getLastAccommodationNonce(),
                entity.getUpdatedAt());
    }

    private Relocation toRelocation(RelocationEntity entity) {
        return new Relocation(
                entity.getChainId(),
                entity.getNonce(),
                entity.getToken(),
                entity.getAccount(),
                entity.getAmount(),
                entity.getFee(),
                RelocationStatus.valueOf(entity.getStatus()),
                entity.getOldNonce() == null ? 0L : entity.getOldNonce(),
                entity.getNewNonce() == null ? 0L : entity.getNewNonce(),
                entity.getUpdatedAt());
    }

    private RelocationEntity toEntity(Relocation relocation) {
        RelocationEntity entity = new RelocationEntity();
        entity.setChainId(relocation.getChainId());
        entity.setNonce(relocation.getNonce());
        entity.setToken(relocation.getToken());
        entity.setAccount(relocation.getAccount());
        entity.setAmount(relocation.getAmount());
        entity.setFee(relocation.getFee());
        entity.setStatus(relocation.getStatus().name());
        entity.setOldNonce(relocation.getOldNonce());
        entity.setNewNonce(relocation.getNewNonce());
        entity.setUpdatedAt(relocation.getUpdatedAt());
        return entity;
    }
}
