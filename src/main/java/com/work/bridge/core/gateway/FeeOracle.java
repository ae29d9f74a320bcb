package com.work.bridge.core.gateway;

import java.math.BigInteger;

/**
 * 手续费预言机：为一次 relocation 计算需要额外扣取的手续费。
 */
public interface FeeOracle {

    BigInteger defineFee(long chainId, String token, String account, BigInteger amount);
}
