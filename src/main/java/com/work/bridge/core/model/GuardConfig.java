package com.work.bridge.core.model;

import java.math.BigInteger;

/**
 * (chainId, token) 维度的 accommodation 限额配置与窗口进度。
 * timeFrame / lastResetTime 单位为秒；timeFrame 为 0 表示未配置。
 */
public class GuardConfig {

    private final long chainId;
    private final String token;
    private long timeFrame;
    private BigInteger volumeLimit;
    private BigInteger currentVolume;
    private long lastResetTime;

    public GuardConfig(long chainId,
                       String token,
                       long timeFrame,
                       BigInteger volumeLimit,
                       BigInteger currentVolume,
                       long lastResetTime) {
        this.chainId = chainId;
        this.token = token;
        this.timeFrame = timeFrame;
        this.volumeLimit = volumeLimit == null ? BigInteger.ZERO : volumeLimit;
        this.currentVolume = currentVolume == null ? BigInteger.ZERO : currentVolume;
        this.lastResetTime = lastResetTime;
    }

    /**
     * 未配置时的零值（与重置后的状态一致）。
     */
    public static GuardConfig empty(long chainId, String token) {
        return new GuardConfig(chainId, token, 0L, BigInteger.ZERO, BigInteger.ZERO, 0L);
    }

    public GuardConfig copy() {
        return new GuardConfig(chainId, token, timeFrame, volumeLimit, currentVolume, lastResetTime);
    }

    public boolean isConfigured() {
        return timeFrame != 0L;
    }

    public long getChainId() {
        return chainId;
    }

    public String getToken() {
        return token;
    }

    public long getTimeFrame() {
        return timeFrame;
    }

    public void setTimeFrame(long timeFrame) {
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

    public long getLastResetTime() {
        return lastResetTime;
    }

    public void setLastResetTime(long lastResetTime) {
        this.lastResetTime = lastResetTime;
    }

    @Override
    public String toString() {
        return "GuardConfig{" +
                "chainId=" + chainId +
                ", token='" + token + '\'' +
                ", timeFrame=" + timeFrame +
                ", volumeLimit=" + volumeLimit +
                ", currentVolume=" + currentVolume +
                ", lastResetTime=" + lastResetTime +
                '}';
    }
}
