package com.work.bridge.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * 事件分发：事务内登记，事务提交后按登记顺序回调所有 listener；没有事务时立即回调。
 * listener 抛出的异常只记录日志，不影响已提交的状态。
 */
public class BridgeEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(BridgeEventPublisher.class);

    private final List<BridgeEventListener> listeners;

    public BridgeEventPublisher(List<BridgeEventListener> listeners) {
        this.listeners = listeners == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(listeners));
    }

    public void publish(Consumer<BridgeEventListener> event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(event);
                }
            });
        } else {
            dispatch(event);
        }
    }

    private void dispatch(Consumer<BridgeEventListener> event) {
        for (BridgeEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("bridge event listener failed listener={} err={}", listener.getClass().getSimpleName(), e.toString());
            }
        }
    }
}
