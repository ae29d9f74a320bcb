package com.work.bridge.core.guard;

import com.work.bridge.core.event.BridgeEventListener;
import com.work.bridge.core.event.BridgeEventPublisher;
import com.work.bridge.core.exception.BridgeErrorCode;
import com.work.bridge.core.exception.BridgeException;
import com.work.bridge.core.model.GuardConfig;
import com.work.bridge.core.model.ValidationStatus;
import com.work.bridge.core.support.InMemoryGuardConfigRepository;
import com.work.bridge.core.support.InMemoryTransactionManager;
import com.work.bridge.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class AccommodationGuardServiceTest {

    private static final long CHAIN = 1L;
    private static final String TOKEN = "0x1000000000000000000000000000000000000001";
    private static final String BRIDGE = "0x00000000000000000000000000000000000B41D6";
    private static final String ACCOUNT = "0x2000000000000000000000000000000000000002";

    private MutableClock clock;
    private BridgeEventListener listener;
    private AccommodationGuardService guard;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.ofEpochSecond(1_700_000_000L));
        listener = mock(BridgeEventListener.class);
        guard = new AccommodationGuardService(new InMemoryGuardConfigRepository(),
                new BridgeEventPublisher(Collections.singletonList(listener)), clock, new InMemoryTransactionManager());
        guard.setBridge(BRIDGE);
    }

    @Test
    public void window_limits_volume_and_rolls_over_after_time_frame() {
        guard.configure(CHAIN, TOKEN, 10, BigInteger.valueOf(2000));

        assertEquals(ValidationStatus.NO_ERROR, validate(1000));
        assertEquals(ValidationStatus.NO_ERROR, validate(1000));
        assertEquals(BigInteger.valueOf(2000), guard.getConfig(CHAIN, TOKEN).getCurrentVolume());

        clock.advanceSeconds(9);
        assertEquals(ValidationStatus.VOLUME_LIMIT_REACHED, validate(1000));
        assertEquals(BigInteger.valueOf(2000), guard.getConfig(CHAIN, TOKEN).getCurrentVolume());

        clock.advanceSeconds(1);
        assertEquals(ValidationStatus.NO_ERROR, validate(1000));
        GuardConfig config = guard.getConfig(CHAIN, TOKEN);
        assertEquals(BigInteger.valueOf(1000), config.getCurrentVolume());
        assertEquals(clock.epochSecond(), config.getLastResetTime());
    }

    @Test
    public void rejected_validation_does_not_persist_window_roll_over() {
        guard.configure(CHAIN, TOKEN, 10, BigInteger.valueOf(500));
        long start = clock.epochSecond();
        assertEquals(ValidationStatus.NO_ERROR, validate(400));

        clock.advanceSeconds(20);
        assertEquals(ValidationStatus.VOLUME_LIMIT_REACHED, validate(600));

        GuardConfig config = guard.getConfig(CHAIN, TOKEN);
        assertEquals(BigInteger.valueOf(400), config.getCurrentVolume());
        assertEquals(start, config.getLastResetTime());
    }

    @Test
    public void unconfigured_pair_returns_time_frame_not_set() {
        assertEquals(ValidationStatus.TIME_FRAME_NOT_SET, validate(1));
        assertFalse(guard.getConfig(CHAIN, TOKEN).isConfigured());
    }

    @Test
    public void reconfigure_keeps_current_window_progress() {
        guard.configure(CHAIN, TOKEN, 100, BigInteger.valueOf(1000));
        long start = clock.epochSecond();
        validate(700);

        clock.advanceSeconds(30);
        guard.configure(CHAIN, TOKEN, 50, BigInteger.valueOf(800));

        GuardConfig config = guard.getConfig(CHAIN, TOKEN);
        assertEquals(50, config.getTimeFrame());
        assertEquals(BigInteger.valueOf(800), config.getVolumeLimit());
        assertEquals(BigInteger.valueOf(700), config.getCurrentVolume());
        assertEquals(start, config.getLastResetTime());
        assertEquals(ValidationStatus.VOLUME_LIMIT_REACHED, validate(101));
    }

    @Test
    public void reset_clears_config() {
        guard.configure(CHAIN, TOKEN, 100, BigInteger.valueOf(1000));
        validate(10);

        guard.reset(CHAIN, TOKEN);

        GuardConfig config = guard.getConfig(CHAIN, TOKEN);
        assertEquals(0, config.getTimeFrame());
        assertEquals(BigInteger.ZERO, config.getVolumeLimit());
        assertEquals(BigInteger.ZERO, config.getCurrentVolume());
        assertEquals(ValidationStatus.TIME_FRAME_NOT_SET, validate(10));
        verify(listener).onResetAccommodationGuard(eq(CHAIN), eq(TOKEN.toLowerCase()));
    }

    @Test
    public void only_registered_bridge_may_validate() {
        guard.configure(CHAIN, TOKEN, 100, BigInteger.valueOf(1000));

        BridgeException ex = assertThrows(BridgeException.class,
                () -> guard.validate(ACCOUNT, CHAIN, TOKEN, ACCOUNT, BigInteger.ONE));

        assertEquals(BridgeErrorCode.NOT_BRIDGE, ex.getCode());
        assertEquals(BigInteger.ZERO, guard.getConfig(CHAIN, TOKEN).getCurrentVolume());
    }

    @Test
    public void configure_rejects_zero_arguments() {
        assertCode(BridgeErrorCode.ZERO_CHAIN_ID, () -> guard.configure(0, TOKEN, 10, BigInteger.TEN));
        assertCode(BridgeErrorCode.ZERO_TOKEN_ADDRESS, () -> guard.configure(CHAIN, "0x0000000000000000000000000000000000000000", 10, BigInteger.TEN));
        assertCode(BridgeErrorCode.ZERO_TIME_FRAME, () -> guard.configure(CHAIN, TOKEN, 0, BigInteger.TEN));
        assertCode(BridgeErrorCode.ZERO_VOLUME_LIMIT, () -> guard.configure(CHAIN, TOKEN, 10, BigInteger.ZERO));
        assertCode(BridgeErrorCode.ZERO_BRIDGE_ADDRESS, () -> guard.setBridge(null));
    }

    @Test
    public void set_bridge_publishes_old_and_new_address() {
        String next = "0x5000000000000000000000000000000000000005";
        guard.setBridge(next);

        assertEquals(next, guard.getBridge());
        verify(listener).onSetBridge(eq(BRIDGE.toLowerCase()), eq(next));
    }

    private ValidationStatus validate(long amount) {
        return guard.validate(BRIDGE, CHAIN, TOKEN, ACCOUNT, BigInteger.valueOf(amount));
    }

    private static void assertCode(BridgeErrorCode code, Runnable call) {
        BridgeException ex = assertThrows(BridgeException.class, call::run);
        assertEquals(code, ex.getCode());
    }
}
