package com.work.bridge.core.model;

/**
 * 全局手续费配置。oracle 与 collector 同时配置时才收取手续费。
 */
public final class FeeSettings {

    private static final FeeSettings NONE = new FeeSettings(null, null);

    private final String feeOracle;
    private final String feeCollector;

    public FeeSettings(String feeOracle, String feeCollector) {
        this.feeOracle = feeOracle;
        this.feeCollector = feeCollector;
    }

    public static FeeSettings none() {
        return NONE;
    }

    public FeeSettings withFeeOracle(String newFeeOracle) {
        return new FeeSettings(newFeeOracle, feeCollector);
    }

    public FeeSettings withFeeCollector(String newFeeCollector) {
        return new FeeSettings(feeOracle, newFeeCollector);
    }

    public boolean isFeeTaken() {
        return feeOracle != null && feeCollector != null;
    }

    public String getFeeOracle() {
        return feeOracle;
    }

    public String getFeeCollector() {
        return feeCollector;
    }

    @Override
    public String toString() {
        return "FeeSettings{feeOracle='" + feeOracle + "', feeCollector='" + feeCollector + "'}";
    }
}
