package com.work.bridge.demo.web.dto;

import com.work.bridge.core.model.FeeRefundMode;

import java.util.List;

/**
 * cancel / reject 请求体。单笔接口忽略 nonces；feeRefundMode 缺省为 NOTHING。
 */
public class RefusalRequest {

    private List<Long> nonces;

    private FeeRefundMode feeRefundMode = FeeRefundMode.NOTHING;

    public List<Long> getNonces() {
        return nonces;
    }

    public void setNonces(List<Long> nonces) {
        this.nonces = nonces;
    }

    public FeeRefundMode getFeeRefundMode() {
        return feeRefundMode;
    }

    public void setFeeRefundMode(FeeRefundMode feeRefundMode) {
        this.feeRefundMode = feeRefundMode;
    }
}
