package com.work.bridge.core.exception;

import com.work.bridge.core.access.BridgeRole;

/**
 * 调用方缺少执行操作所需的角色。
 */
public class BridgeAccessDeniedException extends BridgeException {

    private final String caller;
    private final BridgeRole role;

    public BridgeAccessDeniedException(String caller, BridgeRole role) {
        super(BridgeErrorCode.ACCESS_DENIED, "account " + caller + " is missing role " + role);
        this.caller = caller;
        this.role = role;
    }

    public String getCaller() {
        return caller;
    }

    public BridgeRole getRole() {
        return role;
    }
}
