package com.work.bridge.demo.web.dto;

import com.work.bridge.core.model.GuardConfig;

import java.math.BigInteger;

public class GuardConfigView {

    private final long chainId;
    private final String token;
    private final long timeFrame;
    private final BigInteger volumeLimit;
    private final BigInteger currentVolume;
    private final long lastResetTime;

    public GuardConfigView(GuardConfig config) {
        this.chainId = config.getChainId();
        this.token = config.getToken();
        this.timeFrame = config.getTimeFrame();
        this.volumeLimit = config.getVolumeLimit();
        this.currentVolume = config.getCurrentVolume();
        this.lastResetTime = config.getLastResetTime();
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

    public BigInteger getVolumeLimit() {
        return volumeLimit;
    }

    public BigInteger getCurrentVolume() {
        return currentVolume;
    }

    public long getLastResetTime() {
        return lastResetTime;
    }
}
