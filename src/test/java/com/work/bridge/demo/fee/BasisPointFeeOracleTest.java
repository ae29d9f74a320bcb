package com.work.bridge.demo.fee;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BasisPointFeeOracleTest {

    @Test
    public void fee_is_rounded_down() {
        BasisPointFeeOracle oracle = new BasisPointFeeOracle(10, 0);

        assertEquals(BigInteger.ONE, oracle.defineFee(1L, "0xa", "0xb", BigInteger.valueOf(1999)));
        assertEquals(BigInteger.ZERO, oracle.defineFee(1L, "0xa", "0xb", BigInteger.valueOf(999)));
        assertEquals(new BigInteger("1000000000000000"),
                oracle.defineFee(1L, "0xa", "0xb", new BigInteger("1000000000000000000")));
    }

    @Test
    public void rate_is_capped_by_max() {
        assertEquals(50, new BasisPointFeeOracle(80, 50).getBasisPoints());
        assertEquals(80, new BasisPointFeeOracle(80, 0).getBasisPoints());
        assertThrows(IllegalArgumentException.class, () -> new BasisPointFeeOracle(-1, 0));
    }
}
