package com.work.bridge.demo.chain.web3j;

import com.work.bridge.core.exception.BridgeErrorCode;
import com.work.bridge.core.exception.BridgeException;
import org.junit.jupiter.api.Test;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthCall;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class Web3jFeeOracleTest {

    private static final String ORACLE = "0x00000000000000000000000000000000000fee01";
    private static final String TOKEN = "0x1000000000000000000000000000000000000001";
    private static final String USER = "0x2000000000000000000000000000000000000002";

    @Test
    @SuppressWarnings("unchecked")
    public void fee_is_decoded_from_eth_call() throws Exception {
        Web3j web3j = mock(Web3j.class);
        Request<?, EthCall> request = mock(Request.class);
        doReturn(request).when(web3j).ethCall(any(), any());
        EthCall result = new EthCall();
        result.setResult("0x" + TypeEncoder.encode(new Uint256(BigInteger.valueOf(42))));
        when(request.send()).thenReturn(result);

        assertEquals(BigInteger.valueOf(42), new Web3jFeeOracle(web3j, ORACLE).defineFee(1L, TOKEN, USER, BigInteger.TEN));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void reverted_call_is_unknown_oracle() throws Exception {
        Web3j web3j = mock(Web3j.class);
        Request<?, EthCall> request = mock(Request.class);
        doReturn(request).when(web3j).ethCall(any(), any());
        EthCall result = new EthCall();
        result.setError(new Response.Error(3, "execution reverted"));
        when(request.send()).thenReturn(result);

        BridgeException ex = assertThrows(BridgeException.class,
                () -> new Web3jFeeOracle(web3j, ORACLE).defineFee(1L, TOKEN, USER, BigInteger.TEN));
        assertEquals(BridgeErrorCode.UNKNOWN_FEE_ORACLE, ex.getCode());
    }
}
