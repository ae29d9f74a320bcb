package com.work.bridge.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 内置 fee oracle 配置。只有当账本的 fee oracle 被设置为 {@link #oracleAddress} 时才会使用它。
 */
@ConfigurationProperties(prefix = "fee")
public class FeeProperties {

    /**
     * 内置 oracle 的地址标识
     */
    private String oracleAddress = "0x00000000000000000000000000000000000fee01";

    /**
     * 手续费费率，单位为万分之一
     */
    private int basisPoints = 10;

    /**
     * 费率上限（万分之一），0 表示不设上限
     */
    private int maxBasisPoints = 0;

    public String getOracleAddress() {
        return oracleAddress;
    }

    public void setOracleAddress(String oracleAddress) {
        this.oracleAddress = oracleAddress;
    }

    public int getBasisPoints() {
        return basisPoints;
    }

    public void setBasisPoints(int basisPoints) {
        this.basisPoints = basisPoints;
    }

    public int getMaxBasisPoints() {
        return maxBasisPoints;
    }

    public void setMaxBasisPoints(int maxBasisPoints) {
        this.maxBasisPoints = maxBasisPoints;
    }
}
