package com.work.bridge.demo.fee;

import com.work.bridge.core.gateway.FeeOracle;
import com.work.bridge.core.support.ValidationUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

public class StaticFeeOracleResolverTest {

    private static final String ORACLE = "0x00000000000000000000000000000000000Fee01";

    @Test
    public void registered_oracle_resolves_case_insensitively() {
        FeeOracle oracle = mock(FeeOracle.class);
        StaticFeeOracleResolver resolver = new StaticFeeOracleResolver().register(ORACLE, oracle);

        assertSame(oracle, resolver.resolve(ORACLE.toLowerCase()).get());
        assertFalse(resolver.resolve("0x0000000000000000000000000000000000000bad").isPresent());
        assertFalse(resolver.resolve(ValidationUtils.ZERO_ADDRESS).isPresent());
    }

    @Test
    public void fallback_handles_unregistered_addresses() {
        List<String> requested = new ArrayList<>();
        FeeOracle remote = mock(FeeOracle.class);
        StaticFeeOracleResolver resolver = new StaticFeeOracleResolver(address -> {
            requested.add(address);
            return remote;
        }).register(ORACLE, mock(FeeOracle.class));

        assertTrue(resolver.resolve(ORACLE).isPresent());
        assertSame(remote, resolver.resolve("0x00000000000000000000000000000000000000AB").get());
        assertEquals(1, requested.size());
        assertEquals("0x00000000000000000000000000000000000000ab", requested.get(0));
    }
}
