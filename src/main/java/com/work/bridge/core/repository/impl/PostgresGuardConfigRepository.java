package com.work.bridge.core.repository.impl;

import com.work.bridge.core.model.GuardConfig;
import com.work.bridge.core.repository.GuardConfigRepository;
import com.work.bridge.core.repository.entity.BridgeSettingEntity;
import com.work.bridge.core.repository.entity.GuardConfigEntity;
import com.work.bridge.core.repository.mapper.BridgeSettingMapper;
import com.work.bridge.core.repository.mapper.GuardConfigMapper;

import java.time.Instant;
import java.util.Optional;

import static com.work.bridge.core.support.ValidationUtils.requireNonEmpty;
import static com.work.bridge.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL 的 guard 配置存储；bridge 地址与账本全局配置共用 bridge_setting 表。
 */
public class PostgresGuardConfigRepository implements GuardConfigRepository {

    static final String GUARD_BRIDGE_KEY = "guard_bridge";

    private final GuardConfigMapper guardConfigMapper;
    private final BridgeSettingMapper settingMapper;

    public PostgresGuardConfigRepository(GuardConfigMapper guardConfigMapper, BridgeSettingMapper settingMapper) {
        this.guardConfigMapper = guardConfigMapper;
        this.settingMapper = settingMapper;
    }

    @Override
    public Optional<GuardConfig> lockAndLoad(long chainId, String token) {
        return Optional.ofNullable(guardConfigMapper.lockAndLoad(chainId, requireNonEmpty(token, "token"))).map(this::toConfig);
    }

    @Override
    public Optional<GuardConfig> find(long chainId, String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(guardConfigMapper.selectByChainAndToken(chainId, token)).map(this::toConfig);
    }

    @Override
    public void save(GuardConfig config) {
        requireNonNull(config, "config");
        GuardConfigEntity entity = new GuardConfigEntity();
        entity.setChainId(config.getChainId());
        entity.setToken(requireNonEmpty(config.getToken(), "config.token"));
        entity.setTimeFrame(config.getTimeFrame());
        entity.setVolumeLimit(config.getVolumeLimit());
        entity.setCurrentVolume(config.getCurrentVolume());
        entity.setLastResetTime(config.getLastResetTime());
        guardConfigMapper.upsert(entity);
    }

    @Override
    public void delete(long chainId, String token) {
        guardConfigMapper.deleteByChainAndToken(chainId, requireNonEmpty(token, "token"));
    }

    @Override
    public Optional<String> findBridge() {
        BridgeSettingEntity entity = settingMapper.selectById(GUARD_BRIDGE_KEY);
        return entity == null ? Optional.empty() : Optional.ofNullable(entity.getSettingValue());
    }

    @Override
    public void saveBridge(String bridge) {
        settingMapper.upsert(GUARD_BRIDGE_KEY, requireNonEmpty(bridge, "bridge"), Instant.now());
    }

    private GuardConfig toConfig(GuardConfigEntity entity) {
        return new GuardConfig(
                entity.getChainId(),
                entity.getToken(),
                entity.getTimeFrame(),
                entity.getVolumeLimit(),
                entity.getCurrentVolume(),
                entity.getLastResetTime());
    }
}
