package com.work.bridge.core.config;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可，确保 core 包保持与业务、框架解耦。
 */
public class BridgeConfig {

    /**
     * 托管账户：LockOrTransfer 模式下锁仓资金的持有者，也是 burn 的来源账户。
     */
    private final String custodyAccount;

    /**
     * 账本自身的身份地址，调用 guard 校验时作为 caller。
     */
    private final String ledgerAddress;

    /**
     * 模式一旦离开 UNSUPPORTED 后是否禁止再修改。
     */
    private final boolean modeImmutable;

    private final boolean guardEnabled;

    public BridgeConfig(String custodyAccount,
                        String ledgerAddress,
                        boolean modeImmutable,
                        boolean guardEnabled) {
        this.custodyAccount = custodyAccount;
        this.ledgerAddress = ledgerAddress;
        this.modeImmutable = modeImmutable;
        this.guardEnabled = guardEnabled;
    }

    public static BridgeConfig defaultConfig() {
        return new BridgeConfig("0x00000000000000000000000000000000000b41d6",
                "0x00000000000000000000000000000000000b41d6", true, true);
    }

    public String getCustodyAccount() {
        return custodyAccount;
    }

    public String getLedgerAddress() {
        return ledgerAddress;
    }

    public boolean isModeImmutable() {
        return modeImmutable;
    }

    public boolean isGuardEnabled() {
        return guardEnabled;
    }
}
