package com.work.bridge.core.repository;

import com.work.bridge.core.model.GuardConfig;

import java.util.Optional;

/**
 * accommodation guard 配置的持久化端口。
 */
public interface GuardConfigRepository {

    /**
     * 以加锁语义读取配置，未配置返回 empty。
     */
    Optional<GuardConfig> lockAndLoad(long chainId, String token);

    Optional<GuardConfig> find(long chainId, String token);

    void save(GuardConfig config);

    void delete(long chainId, String token);

    /**
     * guard 允许调用 validate 的唯一 bridge 地址。
     */
    Optional<String> findBridge();

    void saveBridge(String bridge);
}
