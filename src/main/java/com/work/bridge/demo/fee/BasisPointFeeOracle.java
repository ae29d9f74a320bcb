package com.work.bridge.demo.fee;

import com.work.bridge.core.gateway.FeeOracle;

import java.math.BigInteger;

/**
 * 按固定费率（万分之一为单位）计算手续费，向下取整。
 */
public class BasisPointFeeOracle implements FeeOracle {

    private static final BigInteger BASIS_POINT_DENOMINATOR = BigInteger.valueOf(10_000L);

    private final int basisPoints;

    /**
     * @param basisPoints    费率
     * @param maxBasisPoints 费率上限，0 表示不设上限
     */
    public BasisPointFeeOracle(int basisPoints, int maxBasisPoints) {
        if (basisPoints < 0) {
            throw new IllegalArgumentException("basisPoints 不能为负数");
        }
        if (maxBasisPoints < 0) {
            throw new IllegalArgumentException("maxBasisPoints 不能为负数");
        }
        this.basisPoints = maxBasisPoints > 0 ? Math.min(basisPoints, maxBasisPoints) : basisPoints;
    }

    @Override
    public BigInteger defineFee(long chainId, String token, String account, BigInteger amount) {
        return amount.multiply(BigInteger.valueOf(basisPoints)).divide(BASIS_POINT_DENOMINATOR);
    }

    public int getBasisPoints() {
        return basisPoints;
    }
}
