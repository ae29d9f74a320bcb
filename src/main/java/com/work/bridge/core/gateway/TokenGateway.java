package com.work.bridge.core.gateway;

import java.math.BigInteger;

/**
 * 代币操作端口。组件本身不关心具体实现（内存账本 / 链上 ERC-20），只通过该接口搬运资金。
 * <p>
 * 转账失败应直接抛出异常；burn / mint 以返回值表示成功与否，由调用方转换为显式错误。
 */
public interface TokenGateway {

    /**
     * 从 from 账户转入托管账户。
     */
    void transferIn(String token, String from, BigInteger amount);

    /**
     * 从托管账户转出到 to 账户。
     */
    void transferOut(String token, String to, BigInteger amount);

    /**
     * 销毁 from（通常是托管账户）持有的代币。
     */
    boolean burn(String token, String from, BigInteger amount);

    /**
     * 为 to 增发代币。
     */
    boolean mint(String token, String to, BigInteger amount);

    /**
     * token 是否声明支持 bridge 的 mint / burn 操作。
     */
    boolean supportsBridge(String token);
}
