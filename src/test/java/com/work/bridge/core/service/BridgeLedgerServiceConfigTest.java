package com.work.bridge.core.service;

import com.work.bridge.core.config.BridgeConfig;
import com.work.bridge.core.exception.BridgeErrorCode;
import com.work.bridge.core.exception.BridgeException;
import com.work.bridge.core.gateway.FeeOracle;
import com.work.bridge.core.model.OperationMode;
import com.work.bridge.core.support.ValidationUtils;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Optional;

import static com.work.bridge.core.service.LedgerFixture.BRIDGE_TOKEN;
import static com.work.bridge.core.service.LedgerFixture.CHAIN;
import static com.work.bridge.core.service.LedgerFixture.COLLECTOR;
import static com.work.bridge.core.service.LedgerFixture.CUSTODY;
import static com.work.bridge.core.service.LedgerFixture.ORACLE;
import static com.work.bridge.core.service.LedgerFixture.TOKEN;
import static com.work.bridge.core.service.LedgerFixture.USER;
import static com.work.bridge.core.service.LedgerFixture.amount;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;

public class BridgeLedgerServiceConfigTest {

    @Test
    public void immutable_modes_can_only_be_set_once() {
        LedgerFixture f = new LedgerFixture();
        BridgeLedgerService ledger = f.ledger;

        assertCode(BridgeErrorCode.ZERO_TOKEN_ADDRESS,
                () -> ledger.setRelocationMode(CHAIN, ValidationUtils.ZERO_ADDRESS, OperationMode.LOCK_OR_TRANSFER));
        assertCode(BridgeErrorCode.UNCHANGED_RELOCATION_MODE,
                () -> ledger.setRelocationMode(CHAIN, TOKEN, OperationMode.UNSUPPORTED));

        ledger.setRelocationMode(CHAIN, TOKEN.toUpperCase().replace("0X", "0x"), OperationMode.LOCK_OR_TRANSFER);
        assertEquals(OperationMode.LOCK_OR_TRANSFER, ledger.getRelocationMode(CHAIN, TOKEN));
        verify(f.listener).onSetRelocationMode(eq(CHAIN), eq(TOKEN), eq(OperationMode.UNSUPPORTED),
                eq(OperationMode.LOCK_OR_TRANSFER));

        assertCode(BridgeErrorCode.UNCHANGED_RELOCATION_MODE,
                () -> ledger.setRelocationMode(CHAIN, TOKEN, OperationMode.LOCK_OR_TRANSFER));
        assertCode(BridgeErrorCode.RELOCATION_MODE_IS_IMMUTABLE,
                () -> ledger.setRelocationMode(CHAIN, TOKEN, OperationMode.UNSUPPORTED));

        ledger.setAccommodationMode(CHAIN, TOKEN, OperationMode.LOCK_OR_TRANSFER);
        assertCode(BridgeErrorCode.ACCOMMODATION_MODE_IS_IMMUTABLE,
                () -> ledger.setAccommodationMode(CHAIN, TOKEN, OperationMode.UNSUPPORTED));
        assertEquals(OperationMode.UNSUPPORTED, ledger.getAccommodationMode(2L, TOKEN));
    }

    @Test
    public void burn_or_mint_requires_bridgeable_token() {
        LedgerFixture f = new LedgerFixture();

        assertCode(BridgeErrorCode.NON_BRIDGEABLE_TOKEN,
                () -> f.ledger.setRelocationMode(CHAIN, BRIDGE_TOKEN, OperationMode.BURN_OR_MINT));
        assertCode(BridgeErrorCode.NON_BRIDGEABLE_TOKEN,
                () -> f.ledger.setAccommodationMode(CHAIN, BRIDGE_TOKEN, OperationMode.BURN_OR_MINT));
        assertEquals(OperationMode.UNSUPPORTED, f.ledger.getRelocationMode(CHAIN, BRIDGE_TOKEN));

        f.tokens.setBridgeSupported(BRIDGE_TOKEN, true);
        f.ledger.setRelocationMode(CHAIN, BRIDGE_TOKEN, OperationMode.BURN_OR_MINT);
        assertEquals(OperationMode.BURN_OR_MINT, f.ledger.getRelocationMode(CHAIN, BRIDGE_TOKEN));
    }

    @Test
    public void mutable_modes_can_be_switched_and_disabled() {
        LedgerFixture f = new LedgerFixture(new BridgeConfig(CUSTODY, CUSTODY, false, true));
        f.tokens.setBridgeSupported(BRIDGE_TOKEN, true);

        f.ledger.setAccommodationMode(CHAIN, BRIDGE_TOKEN, OperationMode.LOCK_OR_TRANSFER);
        f.ledger.setAccommodationMode(CHAIN, BRIDGE_TOKEN, OperationMode.BURN_OR_MINT);
        f.ledger.setAccommodationMode(CHAIN, BRIDGE_TOKEN, OperationMode.UNSUPPORTED);

        assertEquals(OperationMode.UNSUPPORTED, f.ledger.getAccommodationMode(CHAIN, BRIDGE_TOKEN));
        verify(f.listener).onSetAccommodationMode(eq(CHAIN), eq(BRIDGE_TOKEN), eq(OperationMode.LOCK_OR_TRANSFER),
                eq(OperationMode.BURN_OR_MINT));
    }

    @Test
    public void fee_settings_track_changes_and_zero_address_clears() {
        LedgerFixture f = new LedgerFixture();
        BridgeLedgerService ledger = f.ledger;
        assertFalse(ledger.isFeeTaken());

        ledger.setFeeOracle(ORACLE);
        assertFalse(ledger.isFeeTaken());
        verify(f.listener).onSetFeeOracle(isNull(), eq(ORACLE));
        assertCode(BridgeErrorCode.UNCHANGED_FEE_ORACLE, () -> ledger.setFeeOracle(ORACLE.toUpperCase().replace("0X", "0x")));

        ledger.setFeeCollector(COLLECTOR);
        assertTrue(ledger.isFeeTaken());
        assertCode(BridgeErrorCode.UNCHANGED_FEE_COLLECTOR, () -> ledger.setFeeCollector(COLLECTOR));

        ledger.setFeeOracle(ValidationUtils.ZERO_ADDRESS);
        assertNull(ledger.getFeeOracle());
        assertFalse(ledger.isFeeTaken());
        assertEquals(COLLECTOR, ledger.getFeeCollector());
        assertCode(BridgeErrorCode.UNCHANGED_FEE_ORACLE, () -> ledger.setFeeOracle(null));
    }

    @Test
    public void negative_fee_from_oracle_aborts_request() {
        LedgerFixture f = new LedgerFixture(BridgeConfig.defaultConfig(),
                address -> Optional.<FeeOracle>of((chainId, token, account, amount) -> BigInteger.valueOf(-1)));
        f.tokens.credit(TOKEN, USER, amount(100));
        f.ledger.setRelocationMode(CHAIN, TOKEN, OperationMode.LOCK_OR_TRANSFER);
        f.ledger.setFeeOracle(ORACLE);
        f.ledger.setFeeCollector(COLLECTOR);

        assertThrows(IllegalStateException.class, () -> f.ledger.requestRelocation(USER, CHAIN, TOKEN, amount(10)));
        assertEquals(0L, f.ledger.getPendingRelocationCount(CHAIN));
        assertEquals(amount(100), f.balance(TOKEN, USER));
    }

    private static void assertCode(BridgeErrorCode code, Runnable call) {
        BridgeException ex = assertThrows(BridgeException.class, call::run);
        assertEquals(code, ex.getCode());
    }
}
