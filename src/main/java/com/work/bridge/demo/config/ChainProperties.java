package com.work.bridge.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;

/**
 * 链连接配置（demo/宿主侧）。
 *
 * mode=mock: 使用 MockTokenGateway
 * mode=web3j: 使用 Web3jTokenGateway，由托管账户私钥签名发送 ERC-20 交易
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    private long chainId = 1L;

    /**
     * 托管账户私钥（hex），仅 web3j 模式使用
     */
    private String privateKey;

    private BigInteger gasPrice = BigInteger.valueOf(20_000_000_000L);

    private BigInteger gasLimit = BigInteger.valueOf(300_000L);

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public void setGasPrice(BigInteger gasPrice) {
        this.gasPrice = gasPrice;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(BigInteger gasLimit) {
        this.gasLimit = gasLimit;
    }
}
