package com.work.bridge.core;

import com.work.bridge.core.access.BridgeRole;
import com.work.bridge.core.access.InMemoryAccessControl;
import com.work.bridge.core.access.PauseControl;
import com.work.bridge.core.event.BridgeEventPublisher;
import com.work.bridge.core.exception.BridgeAccessDeniedException;
import com.work.bridge.core.exception.BridgeErrorCode;
import com.work.bridge.core.exception.BridgeException;
import com.work.bridge.core.execution.ChainExecutor;
import com.work.bridge.core.execution.DirectChainExecutor;
import com.work.bridge.core.guard.AccommodationGuardService;
import com.work.bridge.core.model.Accommodation;
import com.work.bridge.core.model.FeeRefundMode;
import com.work.bridge.core.model.OperationMode;
import com.work.bridge.core.model.Relocation;
import com.work.bridge.core.model.RelocationStatus;
import com.work.bridge.core.service.BridgeLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class BridgeComponentTest {

    private static final long CHAIN = 5L;
    private static final String OWNER = "0x00000000000000000000000000000000000000a1";
    private static final String BRIDGER = "0x00000000000000000000000000000000000000b1";
    private static final String USER = "0x00000000000000000000000000000000000000c1";
    private static final String TOKEN = "0x1000000000000000000000000000000000000001";

    private BridgeLedgerService ledger;
    private AccommodationGuardService guard;
    private InMemoryAccessControl accessControl;
    private PauseControl pauseControl;
    private ChainExecutor executor;
    private BridgeComponent component;

    @BeforeEach
    public void setUp() {
        ledger = mock(BridgeLedgerService.class);
        guard = mock(AccommodationGuardService.class);
        BridgeEventPublisher events = new BridgeEventPublisher(Collections.emptyList());
        accessControl = new InMemoryAccessControl(events);
        accessControl.setup(BridgeRole.OWNER, OWNER);
        accessControl.setup(BridgeRole.BRIDGER, BRIDGER);
        accessControl.setup(BridgeRole.PAUSER, OWNER);
        pauseControl = new PauseControl(events);
        executor = spy(new DirectChainExecutor());
        component = new BridgeComponent(ledger, guard, accessControl, pauseControl, executor);
    }

    @Test
    public void anyone_may_request_and_work_runs_on_chain_lane() {
        when(ledger.requestRelocation(USER, CHAIN, TOKEN, BigInteger.TEN)).thenReturn(3L);

        assertEquals(3L, component.requestRelocation(USER, CHAIN, TOKEN, BigInteger.TEN));
        verify(executor).execute(eq(CHAIN), any(Callable.class));
    }

    @Test
    public void relayer_operations_require_bridger() {
        BridgeAccessDeniedException ex = assertThrows(BridgeAccessDeniedException.class,
                () -> component.relocate(USER, CHAIN, 1));
        assertEquals(BridgeRole.BRIDGER, ex.getRole());
        assertEquals(USER, ex.getCaller());

        assertThrows(BridgeAccessDeniedException.class, () -> component.accommodate(USER, CHAIN, 1L,
                Collections.singletonList(Accommodation.processed(TOKEN, USER, BigInteger.ONE))));
        assertThrows(BridgeAccessDeniedException.class, () -> component.abortRelocation(USER, CHAIN, 1L));
        verifyNoInteractions(ledger);

        when(ledger.relocate(CHAIN, 2)).thenReturn(2);
        assertEquals(2, component.relocate(BRIDGER, CHAIN, 2));
    }

    @Test
    public void relocation_owner_may_cancel_own_relocation() {
        when(ledger.getRelocation(CHAIN, 1L)).thenReturn(Optional.of(new Relocation(CHAIN, 1L, TOKEN, USER,
                BigInteger.TEN, BigInteger.ZERO, RelocationStatus.PENDING, 0L, 0L, Instant.now())));

        component.cancelRelocation(USER.toUpperCase().replace("0X", "0x"), CHAIN, 1L, FeeRefundMode.NOTHING);
        verify(ledger).cancelRelocation(CHAIN, 1L, FeeRefundMode.NOTHING);

        assertThrows(BridgeAccessDeniedException.class,
                () -> component.cancelRelocation(OWNER, CHAIN, 1L, FeeRefundMode.FULL));
        when(ledger.getRelocation(CHAIN, 2L)).thenReturn(Optional.empty());
        assertThrows(BridgeAccessDeniedException.class,
                () -> component.cancelRelocation(USER, CHAIN, 2L, FeeRefundMode.FULL));

        component.cancelRelocation(BRIDGER, CHAIN, 2L, FeeRefundMode.FULL);
        verify(ledger).cancelRelocation(CHAIN, 2L, FeeRefundMode.FULL);
    }

    @Test
    public void pause_blocks_state_changes_but_not_configuration() {
        component.pause(OWNER);

        assertPaused(() -> component.requestRelocation(USER, CHAIN, TOKEN, BigInteger.ONE));
        assertPaused(() -> component.relocate(BRIDGER, CHAIN, 1));
        assertPaused(() -> component.cancelRelocation(BRIDGER, CHAIN, 1L, FeeRefundMode.NOTHING));
        List<Accommodation> entries = Collections.singletonList(Accommodation.processed(TOKEN, USER, BigInteger.ONE));
        assertPaused(() -> component.accommodate(BRIDGER, CHAIN, 1L, entries));

        component.setRelocationMode(OWNER, CHAIN, TOKEN, OperationMode.LOCK_OR_TRANSFER);
        verify(ledger).setRelocationMode(CHAIN, TOKEN, OperationMode.LOCK_OR_TRANSFER);

        BridgeException again = assertThrows(BridgeException.class, () -> component.pause(OWNER));
        assertEquals(BridgeErrorCode.PAUSED, again.getCode());

        component.unpause(OWNER);
        component.relocate(BRIDGER, CHAIN, 1);
        verify(ledger).relocate(CHAIN, 1);

        BridgeException notPaused = assertThrows(BridgeException.class, () -> component.unpause(OWNER));
        assertEquals(BridgeErrorCode.NOT_PAUSED, notPaused.getCode());
    }

    @Test
    public void pause_requires_pauser_and_configuration_requires_owner() {
        assertThrows(BridgeAccessDeniedException.class, () -> component.pause(BRIDGER));
        assertThrows(BridgeAccessDeniedException.class, () -> component.setFeeOracle(BRIDGER, TOKEN));
        assertThrows(BridgeAccessDeniedException.class,
                () -> component.configureGuard(BRIDGER, CHAIN, TOKEN, 60L, BigInteger.TEN));
        verifyNoInteractions(guard);

        component.configureGuard(OWNER, CHAIN, TOKEN, 60L, BigInteger.TEN);
        verify(guard).configure(CHAIN, TOKEN, 60L, BigInteger.TEN);

        component.setFeeCollector(OWNER, USER);
        verify(ledger).setFeeCollector(USER);
        verify(executor).execute(eq(ChainExecutor.GLOBAL_LANE), any(Runnable.class));
    }

    @Test
    public void roles_are_managed_by_owner() {
        assertThrows(BridgeAccessDeniedException.class, () -> component.grantRole(BRIDGER, BridgeRole.BRIDGER, USER));

        component.grantRole(OWNER, BridgeRole.BRIDGER, USER);
        assertEquals(2, component.roleMembers(BridgeRole.BRIDGER).size());

        component.revokeRole(OWNER, BridgeRole.BRIDGER, BRIDGER);
        assertThrows(BridgeAccessDeniedException.class, () -> component.relocate(BRIDGER, CHAIN, 1));
    }

    private static void assertPaused(Runnable call) {
        BridgeException ex = assertThrows(BridgeException.class, call::run);
        assertEquals(BridgeErrorCode.PAUSED, ex.getCode());
    }
}
