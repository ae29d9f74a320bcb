package com.work.bridge.demo.chain.web3j;

import com.work.bridge.core.exception.BridgeErrorCode;
import com.work.bridge.core.exception.BridgeException;
import com.work.bridge.core.gateway.TokenGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.tx.TransactionManager;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 基于 Web3j 的代币网关：托管账户签名发送 ERC-20 交易。
 * <ul>
 *     <li>transferIn: token.transferFrom(from, custody, amount)，要求 from 事先 approve</li>
 *     <li>transferOut: token.transfer(to, amount)</li>
 *     <li>burn / mint: token.burnForBridging / mintForBridging，先 eth_call 预演拿到 bool 返回值，为 true 才真正发送</li>
 *     <li>supportsBridge: token.isBridgeSupported(custody)</li>
 * </ul>
 * 说明：只保证交易被节点接受，不等待回执。
 */
public class Web3jTokenGateway implements TokenGateway {

    private static final Logger log = LoggerFactory.getLogger(Web3jTokenGateway.class);

    private final Web3j web3j;
    private final TransactionManager transactionManager;
    private final String custodyAccount;
    private final BigInteger gasPrice;
    private final BigInteger gasLimit;

    public Web3jTokenGateway(Web3j web3j,
                             TransactionManager transactionManager,
                             BigInteger gasPrice,
                             BigInteger gasLimit) {
        this.web3j = web3j;
        this.transactionManager = transactionManager;
        this.custodyAccount = transactionManager.getFromAddress();
        this.gasPrice = gasPrice;
        this.gasLimit = gasLimit;
    }

    @Override
    public void transferIn(String token, String from, BigInteger amount) {
        Function function = new Function("transferFrom",
                Arrays.<Type>asList(new Address(from), new Address(custodyAccount), new Uint256(amount)),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Bool>() {}));
        send(token, function, BridgeErrorCode.TOKEN_TRANSFER_FAILURE);
    }

    @Override
    public void transferOut(String token, String to, BigInteger amount) {
        Function function = new Function("transfer",
                Arrays.<Type>asList(new Address(to), new Uint256(amount)),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Bool>() {}));
        send(token, function, BridgeErrorCode.TOKEN_TRANSFER_FAILURE);
    }

    @Override
    public boolean burn(String token, String from, BigInteger amount) {
        Function function = new Function("burnForBridging",
                Arrays.<Type>asList(new Address(from), new Uint256(amount)),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Bool>() {}));
        if (!callBool(token, function)) {
            return false;
        }
        send(token, function, BridgeErrorCode.TOKEN_BURNING_FAILURE);
        return true;
    }

    @Override
    public boolean mint(String token, String to, BigInteger amount) {
        Function function = new Function("mintForBridging",
                Arrays.<Type>asList(new Address(to), new Uint256(amount)),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Bool>() {}));
        if (!callBool(token, function)) {
            return false;
        }
        send(token, function, BridgeErrorCode.TOKEN_MINTING_FAILURE);
        return true;
    }

    @Override
    public boolean supportsBridge(String token) {
        Function function = new Function("isBridgeSupported",
                Collections.<Type>singletonList(new Address(custodyAccount)),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Bool>() {}));
        try {
            return callBool(token, function);
        } catch (BridgeException e) {
            // 未实现该接口的普通 ERC-20 视为不支持
            log.warn("isBridgeSupported call failed token={} err={}", token, e.getMessage());
            return false;
        }
    }

    private String send(String token, Function function, BridgeErrorCode failureCode) {
        String data = FunctionEncoder.encode(function);
        try {
            EthSendTransaction resp = transactionManager.sendTransaction(gasPrice, gasLimit, token, data, BigInteger.ZERO);
            if (resp.hasError()) {
                throw new BridgeException(failureCode,
                        function.getName() + " rejected by node: token=" + token + ", err=" + resp.getError().getMessage());
            }
            log.info("web3j tx sent function={} token={} txHash={}", function.getName(), token, resp.getTransactionHash());
            return resp.getTransactionHash();
        } catch (IOException e) {
            log.warn("Web3j sendTransaction failed. function={} token={} err={}", function.getName(), token, e.getMessage());
            throw new BridgeException(failureCode, function.getName() + " failed: token=" + token, e);
        }
    }

    private boolean callBool(String token, Function function) {
        String data = FunctionEncoder.encode(function);
        try {
            EthCall resp = web3j.ethCall(
                    Transaction.createEthCallTransaction(custodyAccount, token, data),
                    DefaultBlockParameterName.LATEST).send();
            if (resp.hasError() || resp.isReverted()) {
                return false;
            }
            List<Type> decoded = FunctionReturnDecoder.decode(resp.getValue(), function.getOutputParameters());
            return !decoded.isEmpty() && Boolean.TRUE.equals(decoded.get(0).getValue());
        } catch (IOException e) {
            log.warn("Web3j ethCall failed. function={} token={} err={}", function.getName(), token, e.getMessage());
            throw new BridgeException(BridgeErrorCode.TOKEN_TRANSFER_FAILURE, function.getName() + " call failed: token=" + token, e);
        }
    }
}
