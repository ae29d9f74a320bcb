package com.work.bridge.demo.fee;

import com.work.bridge.core.gateway.FeeOracle;
import com.work.bridge.core.gateway.FeeOracleResolver;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import static com.work.bridge.core.support.ValidationUtils.normalizeAddress;
import static com.work.bridge.core.support.ValidationUtils.requireNonNull;

/**
 * 地址 → oracle 的注册表；未注册的地址交给可选的 fallback（例如按地址构造链上 oracle）。
 */
public class StaticFeeOracleResolver implements FeeOracleResolver {

    private final Map<String, FeeOracle> oracles = new ConcurrentHashMap<>();
    private final Function<String, FeeOracle> fallback;

    public StaticFeeOracleResolver() {
        this(null);
    }

    public StaticFeeOracleResolver(Function<String, FeeOracle> fallback) {
        this.fallback = fallback;
    }

    public StaticFeeOracleResolver register(String address, FeeOracle oracle) {
        oracles.put(requireNonNull(normalizeAddress(address), "address"), requireNonNull(oracle, "oracle"));
        return this;
    }

    @Override
    public Optional<FeeOracle> resolve(String feeOracleAddress) {
        String normalized = normalizeAddress(feeOracleAddress);
        if (normalized == null) {
            return Optional.empty();
        }
        FeeOracle registered = oracles.get(normalized);
        if (registered != null || fallback == null) {
            return Optional.ofNullable(registered);
        }
        return Optional.ofNullable(fallback.apply(normalized));
    }
}
