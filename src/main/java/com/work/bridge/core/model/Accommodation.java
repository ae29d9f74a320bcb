package com.work.bridge.core.model;

import java.math.BigInteger;

/**
 * relayer 上报的源链 relocation 结果，仅在 accommodate 调用期间存在，不单独持久化。
 * status 为源链上该 relocation 的终态，只有 PROCESSED 会产生入账。
 */
public class Accommodation {

    private final String token;
    private final String account;
    private final BigInteger amount;
    private final RelocationStatus status;

    public Accommodation(String token, String account, BigInteger amount, RelocationStatus status) {
        this.token = token;
        this.account = account;
        this.amount = amount;
        this.status = status;
    }

    public static Accommodation processed(String token, String account, BigInteger amount) {
        return new Accommodation(token, account, amount, RelocationStatus.PROCESSED);
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

    public RelocationStatus getStatus() {
        return status;
    }

    public boolean isProcessed() {
        return status == RelocationStatus.PROCESSED;
    }

    @Override
    public String toString() {
        return "Accommodation{" +
                "token='" + token + '\'' +
                ", account='" + account + '\'' +
                ", amount=" + amount +
                ", status=" + status +
                '}';
    }
}
