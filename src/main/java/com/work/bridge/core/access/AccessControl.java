package com.work.bridge.core.access;

import java.util.Set;

/**
 * 角色校验端口。账户地址在比较前统一做小写规范化。
 */
public interface AccessControl {

    boolean hasRole(BridgeRole role, String account);

    /**
     * 缺少角色时抛出 {@link com.work.bridge.core.exception.BridgeAccessDeniedException}。
     */
    void checkRole(BridgeRole role, String account);

    /**
     * 仅 OWNER 可以授予角色；重复授予不会产生事件。
     */
    void grantRole(BridgeRole role, String account, String sender);

    void revokeRole(BridgeRole role, String account, String sender);

    Set<String> members(BridgeRole role);
}
