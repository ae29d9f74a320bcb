package com.work.bridge.demo.web.dto;

import com.work.bridge.core.model.OperationMode;

import javax.validation.constraints.NotNull;

public class ModeRequest {

    @NotNull(message = "mode 不能为空")
    private OperationMode mode;

    public OperationMode getMode() {
        return mode;
    }

    public void setMode(OperationMode mode) {
        this.mode = mode;
    }
}
