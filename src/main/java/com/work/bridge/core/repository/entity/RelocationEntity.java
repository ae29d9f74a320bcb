package com.work.bridge.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.math.BigInteger;
import java.time.Instant;

/**
 * relocation 记录表实体类，(chain_id, nonce) 唯一。
 */
@TableName("bridge_relocation")
public class RelocationEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long chainId;

    private Long nonce;

    private String token;

    private String account;

    private BigInteger amount;

    private BigInteger fee;

    private String status;

    private Long oldNonce;

    private Long newNonce;

    private Instant updatedAt;

    private Instant createdAt;

    public RelocationEntity() {
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getChainId() {
        return chainId;
    }

    public void setChainId(Long chainId) {
        this.chainId = chainId;
    }

    public Long getNonce() {
        return nonce;
    }

    public void setNonce(Long nonce) {
        this.nonce = nonce;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getAccount() {
        return account;
    }

    public void setAccount(String account) {
        this.account = account;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }

    public BigInteger getFee() {
        return fee;
    }

    public void setFee(BigInteger fee) {
        this.fee = fee;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Long getOldNonce() {
        return oldNonce;
    }

    public void setOldNonce(Long oldNonce) {
        this.oldNonce = oldNonce;
    }

    public Long getNewNonce() {
        return newNonce;
    }

    public void setNewNonce(Long newNonce) {
        this.newNonce = newNonce;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
