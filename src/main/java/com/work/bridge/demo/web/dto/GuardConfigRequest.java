package com.work.bridge.demo.web.dto;

import java.math.BigInteger;

/**
 * guard 配置请求体，timeFrame 单位为秒。
 */
public class GuardConfigRequest {

    private long timeFrame;

    private BigInteger volumeLimit;

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
}
