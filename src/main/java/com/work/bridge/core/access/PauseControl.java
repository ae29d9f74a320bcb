package com.work.bridge.core.access;

import com.work.bridge.core.event.BridgeEventPublisher;
import com.work.bridge.core.exception.BridgeErrorCode;
import com.work.bridge.core.exception.BridgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

import static com.work.bridge.core.support.ValidationUtils.normalizeAddress;
import static com.work.bridge.core.support.ValidationUtils.requireNonNull;

/**
 * 全局暂停开关。暂停期间所有改变 relocation / accommodation 状态的入口都会被拒绝，配置类操作不受影响。
 */
public class PauseControl {

    private static final Logger log = LoggerFactory.getLogger(PauseControl.class);

    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final BridgeEventPublisher events;

    public PauseControl(BridgeEventPublisher events) {
        this.events = requireNonNull(events, "events");
    }

    public boolean paused() {
        return paused.get();
    }

    public void requireNotPaused() {
        if (paused.get()) {
            throw new BridgeException(BridgeErrorCode.PAUSED, "bridge 已暂停");
        }
    }

    public void pause(String account) {
        if (!paused.compareAndSet(false, true)) {
            throw new BridgeException(BridgeErrorCode.PAUSED, "bridge 已处于暂停状态");
        }
        String normalized = normalizeAddress(account);
        log.warn("bridge paused by account={}", normalized);
        events.publish(l -> l.onPaused(normalized));
    }

    public void unpause(String account) {
        if (!paused.compareAndSet(true, false)) {
            throw new BridgeException(BridgeErrorCode.NOT_PAUSED, "bridge 未处于暂停状态");
        }
        String normalized = normalizeAddress(account);
        log.info("bridge unpaused by account={}", normalized);
        events.publish(l -> l.onUnpaused(normalized));
    }
}
