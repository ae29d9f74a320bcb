package com.work.bridge.demo.web.dto;

import com.work.bridge.core.model.Accommodation;
import com.work.bridge.core.model.RelocationStatus;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * accommodate 请求体：firstNonce 之后按顺序排列的源链 relocation 结果。
 */
public class AccommodateRequest {

    private long firstNonce;

    private List<Entry> entries = new ArrayList<>();

    public long getFirstNonce() {
        return firstNonce;
    }

    public void setFirstNonce(long firstNonce) {
        this.firstNonce = firstNonce;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public void setEntries(List<Entry> entries) {
        this.entries = entries;
    }

    public List<Accommodation> toAccommodations() {
        List<Accommodation> result = new ArrayList<>();
        if (entries != null) {
            for (Entry entry : entries) {
                result.add(new Accommodation(entry.getToken(), entry.getAccount(), entry.getAmount(), entry.getStatus()));
            }
        }
        return result;
    }

    public static class Entry {

        private String token;

        private String account;

        private BigInteger amount;

        /** 源链上该 relocation 的终态，缺省为 PROCESSED。 */
        private RelocationStatus status = RelocationStatus.PROCESSED;

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

        public RelocationStatus getStatus() {
            return status;
        }

        public void setStatus(RelocationStatus status) {
            this.status = status;
        }
    }
}
