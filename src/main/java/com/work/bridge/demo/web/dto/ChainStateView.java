package com.work.bridge.demo.web.dto;

import com.work.bridge.core.model.ChainLedgerState;

public class ChainStateView {

    private final long chainId;
    private final long pendingRelocationCount;
    private final long lastProcessedRelocationNonce;
    private final long lastAccommodationNonce;

    public ChainStateView(ChainLedgerState state) {
        this.chainId = state.getChainId();
        this.pendingRelocationCount = state.getPendingRelocationCount();
        this.lastProcessedRelocationNonce = state.getLastProcessedRelocationNonce();
        this.lastAccommodationNonce = state.getLastAccommodationNonce();
    }

    public long getChainId() {
        return chainId;
    }

    public long getPendingRelocationCount() {
        return pendingRelocationCount;
    }

    public long getLastProcessedRelocationNonce() {
        return lastProcessedRelocationNonce;
    }

    public long getLastAccommodationNonce() {
        return lastAccommodationNonce;
    }
}
