package com.work.bridge.demo.chain.web3j;

import com.work.bridge.core.exception.BridgeErrorCode;
import com.work.bridge.core.exception.BridgeException;
import com.work.bridge.core.gateway.FeeOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 链上 fee oracle：eth_call defineFee(uint256 chainId, address token, address account, uint256 amount)。
 */
public class Web3jFeeOracle implements FeeOracle {

    private static final Logger log = LoggerFactory.getLogger(Web3jFeeOracle.class);

    private final Web3j web3j;
    private final String oracleAddress;

    public Web3jFeeOracle(Web3j web3j, String oracleAddress) {
        this.web3j = web3j;
        this.oracleAddress = oracleAddress;
    }

    @Override
    public BigInteger defineFee(long chainId, String token, String account, BigInteger amount) {
        Function function = new Function("defineFee",
                Arrays.<Type>asList(new Uint256(BigInteger.valueOf(chainId)), new Address(token),
                        new Address(account), new Uint256(amount)),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Uint256>() {}));
        try {
            EthCall resp = web3j.ethCall(
                    Transaction.createEthCallTransaction(null, oracleAddress, FunctionEncoder.encode(function)),
                    DefaultBlockParameterName.LATEST).send();
            if (resp.hasError() || resp.isReverted()) {
                throw new BridgeException(BridgeErrorCode.UNKNOWN_FEE_ORACLE,
                        "defineFee reverted: oracle=" + oracleAddress + ", err=" + resp.getRevertReason());
            }
            List<Type> decoded = FunctionReturnDecoder.decode(resp.getValue(), function.getOutputParameters());
            if (decoded.isEmpty()) {
                throw new BridgeException(BridgeErrorCode.UNKNOWN_FEE_ORACLE, "defineFee returned nothing: oracle=" + oracleAddress);
            }
            return (BigInteger) decoded.get(0).getValue();
        } catch (IOException e) {
            log.warn("Web3j defineFee failed. oracle={} err={}", oracleAddress, e.getMessage());
            throw new BridgeException(BridgeErrorCode.UNKNOWN_FEE_ORACLE, "defineFee call failed: oracle=" + oracleAddress, e);
        }
    }
}
