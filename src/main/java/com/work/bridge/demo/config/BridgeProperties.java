package com.work.bridge.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * bridge 组件配置（demo/宿主侧）。
 */
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {

    /**
     * 托管账户：锁仓资金的持有者，也是 burn 的来源账户
     */
    private String custodyAccount = "0x00000000000000000000000000000000000b41d6";

    /**
     * 账本自身的身份地址，guard 只接受该地址发起的校验
     */
    private String ledgerAddress = "0x00000000000000000000000000000000000b41d6";

    /**
     * 模式离开 UNSUPPORTED 之后是否禁止修改
     */
    private boolean modeImmutable = true;

    /**
     * accommodate 时是否经过 guard 限额校验
     */
    private boolean guardEnabled = true;

    /**
     * 初始 OWNER
     */
    private String owner = "0x00000000000000000000000000000000000000a1";

    private List<String> bridgers = new ArrayList<>();

    private List<String> pausers = new ArrayList<>();

    /**
     * direct 或 worker-queue
     */
    private String executorMode = "direct";

    private int workerCount = 4;

    private int queueCapacity = 1024;

    private Duration dispatchTimeout = Duration.ofSeconds(10);

    /**
     * memory 或 postgres
     */
    private String store = "memory";

    public String getCustodyAccount() {
        return custodyAccount;
    }

    public void setCustodyAccount(String custodyAccount) {
        this.custodyAccount = custodyAccount;
    }

    public String getLedgerAddress() {
        return ledgerAddress;
    }

    public void setLedgerAddress(String ledgerAddress) {
        this.ledgerAddress = ledgerAddress;
    }

    public boolean isModeImmutable() {
        return modeImmutable;
    }

    public void setModeImmutable(boolean modeImmutable) {
        this.modeImmutable = modeImmutable;
    }

    public boolean isGuardEnabled() {
        return guardEnabled;
    }

    public void setGuardEnabled(boolean guardEnabled) {
        this.guardEnabled = guardEnabled;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public List<String> getBridgers() {
        return bridgers;
    }

    public void setBridgers(List<String> bridgers) {
        this.bridgers = bridgers;
    }

    public List<String> getPausers() {
        return pausers;
    }

    public void setPausers(List<String> pausers) {
        this.pausers = pausers;
    }

    public String getExecutorMode() {
        return executorMode;
    }

    public void setExecutorMode(String executorMode) {
        this.executorMode = executorMode;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public Duration getDispatchTimeout() {
        return dispatchTimeout;
    }

    public void setDispatchTimeout(Duration dispatchTimeout) {
        this.dispatchTimeout = dispatchTimeout;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }
}
