package com.work.bridge.core.gateway;

import java.util.Optional;

/**
 * 将配置里的 fee oracle 地址解析为可调用的 {@link FeeOracle}。
 */
public interface FeeOracleResolver {

    Optional<FeeOracle> resolve(String feeOracleAddress);
}
