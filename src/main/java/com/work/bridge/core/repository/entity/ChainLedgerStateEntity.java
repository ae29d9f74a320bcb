package com.work.bridge.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * 每条链的计数器表实体类。
 */
@TableName("bridge_chain_state")
public class ChainLedgerStateEntity {

    @TableId(value = "chain_id", type = IdType.INPUT)
    private Long chainId;

    private Long pendingRelocationCount;

    private Long lastProcessedRelocationNonce;

    private Long lastAccommodationNonce;

    private Instant updatedAt;

    public ChainLedgerStateEntity() {
    }

    public Long getChainId() {
        return chainId;
    }

    public void setChainId(Long chainId) {
        this.chainId = chainId;
    }

    public Long getPendingRelocationCount() {
        return pendingRelocationCount;
    }

    public void setPendingRelocationCount(Long pendingRelocationCount) {
        this.pendingRelocationCount = pendingRelocationCount;
    }

    public Long getLastProcessedRelocationNonce() {
        return lastProcessedRelocationNonce;
    }

    public void setLastProcessedRelocationNonce(Long lastProcessedRelocationNonce) {
        this.lastProcessedRelocationNonce = lastProcessedRelocationNonce;
    }

    public Long getLastAccommodationNonce() {
        return lastAccommodationNonce;
    }

    public void setLastAccommodationNonce(Long lastAccommodationNonce) {
        this.lastAccommodationNonce = lastAccommodationNonce;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
