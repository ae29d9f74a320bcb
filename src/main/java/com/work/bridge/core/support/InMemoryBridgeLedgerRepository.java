package com.work.bridge.core.support;

import com.work.bridge.core.model.ChainLedgerState;
import com.work.bridge.core.model.FeeSettings;
import com.work.bridge.core.model.OperationMode;
import com.work.bridge.core.model.Relocation;
import com.work.bridge.core.repository.BridgeLedgerRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 纯内存实现，方便在没有 Postgres 的环境下演示组件行为。
 * <p>
 * 存取都使用副本；每次写入都向 {@link UndoLog} 登记逆操作，配合事务管理器获得回滚语义。
 * lockAndLoad 系列方法通过 {@link TransactionBoundLocks} 持有链级 / 全局配置锁直到事务结束，
 * 对应 Postgres 实现里的 {@code SELECT ... FOR UPDATE}。未加锁的读可能看到其他事务尚未提交的写入。
 * 注意：该实现不具备跨进程一致性。
 */
public class InMemoryBridgeLedgerRepository implements BridgeLedgerRepository {

    private final Map<Long, ChainLedgerState> stateTable = new ConcurrentHashMap<>();
    private final Map<Long, ConcurrentSkipListMap<Long, Relocation>> relocationTable = new ConcurrentHashMap<>();
    private final Map<String, OperationMode> relocationModes = new ConcurrentHashMap<>();
    private final Map<String, OperationMode> accommodationModes = new ConcurrentHashMap<>();
    private final AtomicReference<FeeSettings> feeSettings = new AtomicReference<>(FeeSettings.none());
    private final TransactionBoundLocks<Long> chainLocks = new TransactionBoundLocks<>("链状态");
    private final TransactionBoundLocks<String> settingLocks = new TransactionBoundLocks<>("全局配置");

    private static String modeKey(long chainId, String token) {
        return chainId + "#" + token;
    }

    private ConcurrentSkipListMap<Long, Relocation> relocations(long chainId) {
        return relocationTable.computeIfAbsent(chainId, key -> new ConcurrentSkipListMap<>());
    }

    @Override
    public ChainLedgerState lockAndLoadChainState(long chainId) {
        chainLocks.lockUntilCompletion(chainId);
        ChainLedgerState state = stateTable.get(chainId);
        if (state == null) {
            state = ChainLedgerState.init(chainId);
            stateTable.put(chainId, state);
            UndoLog.record(() -> stateTable.remove(chainId));
        }
        return state.copy();
    }

    @Override
    public ChainLedgerState findChainState(long chainId) {
        ChainLedgerState state = stateTable.get(chainId);
        return state == null ? ChainLedgerState.init(chainId) : state.copy();
    }

    @Override
    public void updateChainState(ChainLedgerState state) {
        ChainLedgerState previous = stateTable.put(state.getChainId(), state.copy());
        UndoLog.record(() -> restore(stateTable, state.getChainId(), previous));
    }

    @Override
    public Optional<Relocation> findRelocation(long chainId, long nonce) {
        Relocation relocation = relocations(chainId).get(nonce);
        return relocation == null ? Optional.empty() : Optional.of(relocation.copy());
    }

    @Override
    public List<Relocation> findRelocations(long chainId, long fromNonce, int count) {
        List<Relocation> result = new ArrayList<>();
        if (count <= 0) {
            return result;
        }
        relocations(chainId).subMap(fromNonce, true, fromNonce + count, false)
                .values()
                .forEach(r -> result.add(r.copy()));
        return result;
    }

    @Override
    public void insertRelocation(Relocation relocation) {
        ConcurrentSkipListMap<Long, Relocation> table = relocations(relocation.getChainId());
        Relocation previous = table.putIfAbsent(relocation.getNonce(), relocation.copy());
        if (previous != null) {
            throw new IllegalStateException("relocation 已存在: " + relocation.getChainId() + "#" + relocation.getNonce());
        }
        UndoLog.record(() -> table.remove(relocation.getNonce()));
    }

    @Override
    public void updateRelocation(Relocation relocation) {
        ConcurrentSkipListMap<Long, Relocation> table = relocations(relocation.getChainId());
        Relocation previous = table.get(relocation.getNonce());
        if (previous == null) {
            throw new IllegalStateException("未找到 relocation: " + relocation.getChainId() + "#" + relocation.getNonce());
        }
        table.put(relocation.getNonce(), relocation.copy());
        UndoLog.record(() -> table.put(relocation.getNonce(), previous));
    }

    @Override
    public OperationMode findRelocationMode(long chainId, String token) {
        return relocationModes.getOrDefault(modeKey(chainId, token), OperationMode.UNSUPPORTED);
    }

    @Override
    public void saveRelocationMode(long chainId, String token, OperationMode mode) {
        String key = modeKey(chainId, token);
        OperationMode previous = relocationModes.put(key, mode);
        UndoLog.record(() -> restore(relocationModes, key, previous));
    }

    @Override
    public OperationMode findAccommodationMode(long chainId, String token) {
        return accommodationModes.getOrDefault(modeKey(chainId, token), OperationMode.UNSUPPORTED);
    }

    @Override
    public void saveAccommodationMode(long chainId, String token, OperationMode mode) {
        String key = modeKey(chainId, token);
        OperationMode previous = accommodationModes.put(key, mode);
        UndoLog.record(() -> restore(accommodationModes, key, previous));
    }

    @Override
    public FeeSettings loadFeeSettings() {
        return feeSettings.get();
    }

    @Override
    public FeeSettings lockAndLoadFeeSettings() {
        settingLocks.lockUntilCompletion("fee");
        return feeSettings.get();
    }

    @Override
    public void saveFeeSettings(FeeSettings settings) {
        FeeSettings previous = feeSettings.getAndSet(settings);
        UndoLog.record(() -> feeSettings.set(previous));
    }

    private static <K, V> void restore(Map<K, V> table, K key, V previous) {
        if (previous == null) {
            table.remove(key);
        } else {
            table.put(key, previous);
        }
    }
}
