package com.work.bridge.core.service;

import com.work.bridge.core.config.BridgeConfig;
import com.work.bridge.core.exception.AccommodationValidationFailureException;
import com.work.bridge.core.exception.BridgeErrorCode;
import com.work.bridge.core.exception.BridgeException;
import com.work.bridge.core.model.Accommodation;
import com.work.bridge.core.model.OperationMode;
import com.work.bridge.core.model.RelocationStatus;
import com.work.bridge.core.model.ValidationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.work.bridge.core.service.LedgerFixture.BRIDGE_TOKEN;
import static com.work.bridge.core.service.LedgerFixture.CHAIN;
import static com.work.bridge.core.service.LedgerFixture.CUSTODY;
import static com.work.bridge.core.service.LedgerFixture.OTHER_USER;
import static com.work.bridge.core.service.LedgerFixture.TOKEN;
import static com.work.bridge.core.service.LedgerFixture.USER;
import static com.work.bridge.core.service.LedgerFixture.amount;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

public class BridgeLedgerServiceAccommodationTest {

    private static final String UNGUARDED_TOKEN = "0x1000000000000000000000000000000000000003";

    private LedgerFixture f;
    private BridgeLedgerService ledger;

    @BeforeEach
    public void setUp() {
        f = new LedgerFixture();
        ledger = f.ledger;
        setUpModes(f);
        f.guard.configure(CHAIN, TOKEN, 3600, amount(1000));
        f.guard.configure(CHAIN, BRIDGE_TOKEN, 3600, amount(1000));
    }

    private static void setUpModes(LedgerFixture fixture) {
        fixture.tokens.credit(TOKEN, CUSTODY, amount(5000));
        fixture.tokens.credit(UNGUARDED_TOKEN, CUSTODY, amount(5000));
        fixture.tokens.setBridgeSupported(BRIDGE_TOKEN, true);
        fixture.ledger.setAccommodationMode(CHAIN, TOKEN, OperationMode.LOCK_OR_TRANSFER);
        fixture.ledger.setAccommodationMode(CHAIN, BRIDGE_TOKEN, OperationMode.BURN_OR_MINT);
        fixture.ledger.setAccommodationMode(CHAIN, UNGUARDED_TOKEN, OperationMode.LOCK_OR_TRANSFER);
    }

    @Test
    public void batch_pays_only_processed_entries_and_advances_by_batch_size() {
        List<Accommodation> batch = Arrays.asList(
                Accommodation.processed(TOKEN, USER, amount(300)),
                new Accommodation(TOKEN, OTHER_USER, amount(500), RelocationStatus.CANCELED),
                Accommodation.processed(BRIDGE_TOKEN, USER, amount(200)));

        ledger.accommodate(CHAIN, 1L, batch);

        assertEquals(3L, ledger.getLastAccommodationNonce(CHAIN));
        assertEquals(amount(300), f.balance(TOKEN, USER));
        assertEquals(amount(4700), f.balance(TOKEN, CUSTODY));
        assertEquals(amount(0), f.balance(TOKEN, OTHER_USER));
        assertEquals(amount(200), f.balance(BRIDGE_TOKEN, USER));
        assertEquals(amount(300), f.guard.getConfig(CHAIN, TOKEN).getCurrentVolume());
        assertEquals(amount(200), f.guard.getConfig(CHAIN, BRIDGE_TOKEN).getCurrentVolume());

        verify(f.listener).onAccommodate(eq(CHAIN), eq(TOKEN), eq(USER), eq(amount(300)), eq(1L),
                eq(OperationMode.LOCK_OR_TRANSFER));
        verify(f.listener).onAccommodate(eq(CHAIN), eq(BRIDGE_TOKEN), eq(USER), eq(amount(200)), eq(3L),
                eq(OperationMode.BURN_OR_MINT));
        verify(f.listener, never()).onAccommodate(anyLong(), anyString(), anyString(), any(BigInteger.class), eq(2L),
                any(OperationMode.class));

        ledger.accommodate(CHAIN, 4L, Collections.singletonList(Accommodation.processed(TOKEN, USER, amount(100))));
        assertEquals(4L, ledger.getLastAccommodationNonce(CHAIN));
    }

    @Test
    public void batch_nonce_must_follow_last_accommodation() {
        List<Accommodation> batch = Collections.singletonList(Accommodation.processed(TOKEN, USER, amount(1)));

        assertCode(BridgeErrorCode.ZERO_ACCOMMODATION_NONCE, () -> ledger.accommodate(CHAIN, 0L, batch));
        assertCode(BridgeErrorCode.ACCOMMODATION_NONCE_MISMATCH, () -> ledger.accommodate(CHAIN, 2L, batch));
        assertCode(BridgeErrorCode.EMPTY_ACCOMMODATION_ARRAY, () -> ledger.accommodate(CHAIN, 1L, Collections.emptyList()));
        assertEquals(0L, ledger.getLastAccommodationNonce(CHAIN));
    }

    @Test
    public void invalid_entries_are_rejected() {
        assertCode(BridgeErrorCode.UNSUPPORTED_ACCOMMODATION, () -> ledger.accommodate(2L, 1L,
                Collections.singletonList(Accommodation.processed(TOKEN, USER, amount(1)))));
        assertCode(BridgeErrorCode.ZERO_ACCOMMODATION_ACCOUNT, () -> ledger.accommodate(CHAIN, 1L,
                Collections.singletonList(Accommodation.processed(TOKEN, null, amount(1)))));
        assertCode(BridgeErrorCode.ZERO_ACCOMMODATION_AMOUNT, () -> ledger.accommodate(CHAIN, 1L,
                Collections.singletonList(Accommodation.processed(TOKEN, USER, BigInteger.ZERO))));
    }

    @Test
    public void guard_rejection_rolls_back_entire_batch() {
        reset(f.listener);
        List<Accommodation> batch = Arrays.asList(
                Accommodation.processed(TOKEN, USER, amount(600)),
                Accommodation.processed(TOKEN, OTHER_USER, amount(600)));

        AccommodationValidationFailureException ex = assertThrows(AccommodationValidationFailureException.class,
                () -> ledger.accommodate(CHAIN, 1L, batch));

        assertEquals(1, ex.getIndex());
        assertEquals(ValidationStatus.VOLUME_LIMIT_REACHED, ex.getValidationStatus());
        assertEquals(BridgeErrorCode.ACCOMMODATION_VALIDATION_FAILURE, ex.getCode());
        assertEquals(BigInteger.ZERO, f.guard.getConfig(CHAIN, TOKEN).getCurrentVolume());
        assertEquals(amount(0), f.balance(TOKEN, USER));
        assertEquals(amount(5000), f.balance(TOKEN, CUSTODY));
        assertEquals(0L, ledger.getLastAccommodationNonce(CHAIN));
        verifyNoInteractions(f.listener);
    }

    @Test
    public void unconfigured_guard_rejects_processed_entries_only() {
        AccommodationValidationFailureException ex = assertThrows(AccommodationValidationFailureException.class,
                () -> ledger.accommodate(CHAIN, 1L,
                        Collections.singletonList(Accommodation.processed(UNGUARDED_TOKEN, USER, amount(10)))));
        assertEquals(0, ex.getIndex());
        assertEquals(ValidationStatus.TIME_FRAME_NOT_SET, ex.getValidationStatus());

        ledger.accommodate(CHAIN, 1L, Collections.singletonList(
                new Accommodation(UNGUARDED_TOKEN, USER, amount(10), RelocationStatus.REJECTED)));
        assertEquals(1L, ledger.getLastAccommodationNonce(CHAIN));
        assertEquals(amount(0), f.balance(UNGUARDED_TOKEN, USER));
    }

    @Test
    public void mint_failure_rolls_back_guard_volume() {
        f.tokens.setMintFailure(true);

        assertCode(BridgeErrorCode.TOKEN_MINTING_FAILURE, () -> ledger.accommodate(CHAIN, 1L, Arrays.asList(
                Accommodation.processed(TOKEN, USER, amount(100)),
                Accommodation.processed(BRIDGE_TOKEN, USER, amount(100)))));

        assertEquals(BigInteger.ZERO, f.guard.getConfig(CHAIN, BRIDGE_TOKEN).getCurrentVolume());
        assertEquals(BigInteger.ZERO, f.guard.getConfig(CHAIN, TOKEN).getCurrentVolume());
        assertEquals(amount(0), f.balance(TOKEN, USER));
        assertEquals(0L, ledger.getLastAccommodationNonce(CHAIN));
    }

    @Test
    public void disabled_guard_skips_validation_but_custody_still_limits_transfers() {
        LedgerFixture unguarded = new LedgerFixture(new BridgeConfig(CUSTODY, CUSTODY, true, false));
        setUpModes(unguarded);

        unguarded.ledger.accommodate(CHAIN, 1L,
                Collections.singletonList(Accommodation.processed(UNGUARDED_TOKEN, USER, amount(4000))));
        assertEquals(amount(4000), unguarded.balance(UNGUARDED_TOKEN, USER));

        assertCode(BridgeErrorCode.TOKEN_TRANSFER_FAILURE, () -> unguarded.ledger.accommodate(CHAIN, 2L,
                Collections.singletonList(Accommodation.processed(UNGUARDED_TOKEN, USER, amount(4000)))));
        assertEquals(1L, unguarded.ledger.getLastAccommodationNonce(CHAIN));
    }

    private static void assertCode(BridgeErrorCode code, Runnable call) {
        BridgeException ex = assertThrows(BridgeException.class, call::run);
        assertEquals(code, ex.getCode());
    }
}
