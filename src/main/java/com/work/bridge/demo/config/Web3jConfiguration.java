package com.work.bridge.demo.config;

import com.work.bridge.core.gateway.TokenGateway;
import com.work.bridge.demo.chain.web3j.Web3jTokenGateway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;

import static com.work.bridge.core.support.ValidationUtils.requireNonEmpty;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用，托管账户私钥通过 chain.private-key 注入。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    @Bean
    public Web3j web3j(ChainProperties properties) {
        return Web3j.build(new HttpService(properties.getRpcUrl()));
    }

    @Bean
    public TransactionManager custodyTransactionManager(Web3j web3j, ChainProperties properties) {
        Credentials credentials = Credentials.create(requireNonEmpty(properties.getPrivateKey(), "chain.private-key"));
        return new RawTransactionManager(web3j, credentials, properties.getChainId());
    }

    @Bean
    public TokenGateway web3jTokenGateway(Web3j web3j, TransactionManager custodyTransactionManager, ChainProperties properties) {
        return new Web3jTokenGateway(web3j, custodyTransactionManager, properties.getGasPrice(), properties.getGasLimit());
    }
}
