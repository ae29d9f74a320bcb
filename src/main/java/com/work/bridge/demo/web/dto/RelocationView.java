package com.work.bridge.demo.web.dto;

import com.work.bridge.core.model.Relocation;

import java.math.BigInteger;
import java.time.Instant;

/**
 * relocation 的对外视图。
 */
public class RelocationView {

    private long chainId;
    private long nonce;
    private String token;
    private String account;
    private BigInteger amount;
    private BigInteger fee;
    private String status;
    private long oldNonce;
    private long newNonce;
    private Instant updatedAt;

    public static RelocationView from(Relocation relocation) {
        RelocationView view = new RelocationView();
        view.chainId = relocation.getChainId();
        view.nonce = relocation.getNonce();
        view.token = relocation.getToken();
        view.account = relocation.getAccount();
        view.amount = relocation.getAmount();
        view.fee = relocation.getFee();
        view.status = relocation.getStatus().name();
        view.oldNonce = relocation.getOldNonce();
        view.newNonce = relocation.getNewNonce();
        view.updatedAt = relocation.getUpdatedAt();
        return view;
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

    public String getStatus() {
        return status;
    }

    public long getOldNonce() {
        return oldNonce;
    }

    public long getNewNonce() {
        return newNonce;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
