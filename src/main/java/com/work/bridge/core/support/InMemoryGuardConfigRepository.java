package com.work.bridge.core.support;

import com.work.bridge.core.model.GuardConfig;
import com.work.bridge.core.repository.GuardConfigRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * guard 配置的内存实现，写入同样登记到 {@link UndoLog}；lockAndLoad 按 (chainId, token) 加锁直到事务结束。
 */
public class InMemoryGuardConfigRepository implements GuardConfigRepository {

    private final Map<String, GuardConfig> configTable = new ConcurrentHashMap<>();
    private final AtomicReference<String> bridge = new AtomicReference<>();
    private final TransactionBoundLocks<String> configLocks = new TransactionBoundLocks<>("guard 配置");

    private static String key(long chainId, String token) {
        return chainId + "#" + token;
    }

    @Override
    public Optional<GuardConfig> lockAndLoad(long chainId, String token) {
        configLocks.lockUntilCompletion(key(chainId, token));
        return find(chainId, token);
    }

    @Override
    public Optional<GuardConfig> find(long chainId, String token) {
        GuardConfig config = configTable.get(key(chainId, token));
        return config == null ? Optional.empty() : Optional.of(config.copy());
    }

    @Override
    public void save(GuardConfig config) {
        String key = key(config.getChainId(), config.getToken());
        GuardConfig previous = configTable.put(key, config.copy());
        UndoLog.record(() -> {
            if (previous == null) {
                configTable.remove(key);
            } else {
                configTable.put(key, previous);
            }
        });
    }

    @Override
    public void delete(long chainId, String token) {
        String key = key(chainId, token);
        GuardConfig previous = configTable.remove(key);
        if (previous != null) {
            UndoLog.record(() -> configTable.put(key, previous));
        }
    }

    @Override
    public Optional<String> findBridge() {
        return Optional.ofNullable(bridge.get());
    }

    @Override
    public void saveBridge(String newBridge) {
        String previous = bridge.getAndSet(newBridge);
        UndoLog.record(() -> bridge.set(previous));
    }
}
