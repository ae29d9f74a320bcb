package com.work.bridge.core.model;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * 表示一条 chainId + nonce 的 relocation 记录。
 *
 * 注意：
 * 1. chainId、nonce、token、account、amount、fee、oldNonce 创建后不可变
 * 2. status、newNonce、updatedAt 会在状态迁移时更新
 * 3. oldNonce / newNonce 只由 postpone -> continue 产生，其余情况为 0
 */
public class Relocation {

    private final long chainId;
    private final long nonce;
    private final String token;
    private final String account;
    private final BigInteger amount;
    private final BigInteger fee;
    private final long oldNonce;
    private RelocationStatus status;
    private long newNonce;
    private Instant updatedAt;

    public Relocation(long chainId,
                      long nonce,
                      String token,
                      String account,
                      BigInteger amount,
                      BigInteger fee,
                      RelocationStatus status,
                      long oldNonce,
                      long newNonce,
                      Instant updatedAt) {
        if (nonce <= 0) {
            throw new IllegalArgumentException("nonce 必须大于0");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount 必须大于0");
        }
        if (status == null) {
            throw new IllegalArgumentException("status 不能为null");
        }
        this.chainId = chainId;
        this.nonce = nonce;
        this.token = token;
        this.account = account;
        this.amount = amount;
        this.fee = fee == null ? BigInteger.ZERO : fee;
        this.status = status;
        this.oldNonce = oldNonce;
        this.newNonce = newNonce;
        this.updatedAt = updatedAt;
    }

    /**
     * 新建一条 PENDING relocation。
     */
    public static Relocation pending(long chainId, long nonce, String token, String account,
                                     BigInteger amount, BigInteger fee, long oldNonce, Instant now) {
        return new Relocation(chainId, nonce, token, account, amount, fee, RelocationStatus.PENDING, oldNonce, 0L, now);
    }

    public Relocation copy() {
        return new Relocation(chainId, nonce, token, account, amount, fee, status, oldNonce, newNonce, updatedAt);
    }

    public long getChainId() {
        return chainId;
    }

    public long getNonce() {
        return nonce;
    }

    public String getToken() {
        return token;
    }

    public String getAccount() {
        return account;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public BigInteger getFee() {
        return fee;
    }

    public boolean hasFee() {
        return fee.signum() > 0;
    }

    public RelocationStatus getStatus() {
        return status;
    }

    public void setStatus(RelocationStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status 不能为null");
        }
        this.status = status;
    }

    public long getOldNonce() {
        return oldNonce;
    }

    public long getNewNonce() {
        return newNonce;
    }

    public void setNewNonce(long newNonce) {
        this.newNonce = newNonce;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relocation that = (Relocation) o;
        return chainId == that.chainId && nonce == that.nonce;
    }

    @Override
    public int hashCode() {
        return Objects.hash(chainId, nonce);
    }

    @Override
    public String toString() {
        return "Relocation{" +
                "chainId=" + chainId +
                ", nonce=" + nonce +
                ", token='" + token + '\'' +
                ", account='" + account + '\'' +
                ", amount=" + amount +
                ", fee=" + fee +
                ", status=" + status +
                ", oldNonce=" + oldNonce +
                ", newNonce=" + newNonce +
                '}';
    }
}
