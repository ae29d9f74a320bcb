package com.work.bridge.demo.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.math.BigInteger;

/**
 * 发起 relocation 的请求体，发起账户取自请求头。
 */
public class RelocationRequest {

    @NotBlank(message = "token 不能为空")
    private String token;

    @NotNull(message = "amount 不能为空")
    private BigInteger amount;

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }
}
