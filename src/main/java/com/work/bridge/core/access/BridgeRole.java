package com.work.bridge.core.access;

/**
 * 组件内的角色。OWNER 负责配置与角色管理，BRIDGER 是 relayer 身份，PAUSER 可以暂停/恢复业务入口。
 */
public enum BridgeRole {
    OWNER,
    BRIDGER,
    PAUSER
}
