package com.work.bridge.core.repository.entity;

import com.baomidou.mybatisplus.annotation.TableName;

/**
 * (chain_id, token) 的 relocation / accommodation 模式。
 */
@TableName("bridge_token_mode")
public class TokenModeEntity {

    private Long chainId;

    private String token;

    private String relocationMode;

    private String accommodationMode;

    public TokenModeEntity() {
    }

    public Long getChainId() {
        return chainId;
    }

    public void setChainId(Long chainId) {
        this.chainId = chainId;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getRelocationMode() {
        return relocationMode;
    }

    public void setRelocationMode(String relocationMode) {
        this.relocationMode = relocationMode;
    }

    public String getAccommodationMode() {
        return accommodationMode;
    }

    public void setAccommodationMode(String accommodationMode) {
        this.accommodationMode = accommodationMode;
    }
}
