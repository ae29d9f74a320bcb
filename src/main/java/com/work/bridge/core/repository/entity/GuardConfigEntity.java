package com.work.bridge.core.repository.entity;

import com.baomidou.mybatisplus.annotation.TableName;

import java.math.BigInteger;

/**
 * accommodation guard 配置表实体类，主键 (chain_id, token)。
 */
@TableName("bridge_guard_config")
public class GuardConfigEntity {

    private Long chainId;

    private String token;

    private Long timeFrame;

    private BigInteger volumeLimit;

    private BigInteger currentVolume;

    private Long lastResetTime;

    public GuardConfigEntity() {
    }

    public Long getChainId() {
        return chainId;
    }

    public void setChainId(Long chainId) {
        this.chainId = chainId;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public Long getTimeFrame() {
        return timeFrame;
    }

    public void setTimeFrame(Long timeFrame) {
        this.timeFrame = timeFrame;
    }

    public BigInteger getVolumeLimit() {
        return volumeLimit;
    }

    public void setVolumeLimit(BigInteger volumeLimit) {
        this.volumeLimit = volumeLimit;
    }

    public BigInteger getCurrentVolume() {
        return currentVolume;
    }

    public void setCurrentVolume(BigInteger currentVolume) {
        this.currentVolume = currentVolume;
    }

    public Long getLastResetTime() {
        return lastResetTime;
    }

    public void setLastResetTime(Long lastResetTime) {
        this.lastResetTime = lastResetTime;
    }
}
