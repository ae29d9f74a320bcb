package com.work.bridge.core.model;

import java.time.Instant;

/**
 * 每条目标链上的计数器。
 * <p>
 * 新 relocation 的 nonce 永远是 lastProcessedRelocationNonce + pendingRelocationCount + 1，连续且单调。
 */
public class ChainLedgerState {

    private final long chainId;
    private long pendingRelocationCount;
    private long lastProcessedRelocationNonce;
    private long lastAccommodationNonce;
    private Instant updatedAt;

    public ChainLedgerState(long chainId,
                            long pendingRelocationCount,
                            long lastProcessedRelocationNonce,
                            long lastAccommodationNonce,
                            Instant updatedAt) {
        this.chainId = chainId;
        this.pendingRelocationCount = pendingRelocationCount;
        this.lastProcessedRelocationNonce = lastProcessedRelocationNonce;
        this.lastAccommodationNonce = lastAccommodationNonce;
        this.updatedAt = updatedAt;
    }

    public static ChainLedgerState init(long chainId) {
        return new ChainLedgerState(chainId, 0L, 0L, 0L, Instant.now());
    }

    public ChainLedgerState copy() {
        return new ChainLedgerState(chainId, pendingRelocationCount, lastProcessedRelocationNonce,
                lastAccommodationNonce, updatedAt);
    }

    /**
     * 分配下一个 relocation nonce，并计入 pending。
     */
    public long allocateRelocationNonce() {
        pendingRelocationCount++;
        return lastProcessedRelocationNonce + pendingRelocationCount;
    }

    /**
     * 一次性推进 count 个 nonce，返回本批第一个 nonce。
     */
    public long advanceProcessed(long count) {
        long first = lastProcessedRelocationNonce + 1;
        lastProcessedRelocationNonce += count;
        pendingRelocationCount -= count;
        return first;
    }

    public void advanceAccommodation(long count) {
        lastAccommodationNonce += count;
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

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "ChainLedgerState{" +
                "chainId=" + chainId +
                ", pendingRelocationCount=" + pendingRelocationCount +
                ", lastProcessedRelocationNonce=" + lastProcessedRelocationNonce +
                ", lastAccommodationNonce=" + lastAccommodationNonce +
                '}';
    }
}
