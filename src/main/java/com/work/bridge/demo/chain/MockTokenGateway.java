package com.work.bridge.demo.chain;

import com.work.bridge.core.exception.BridgeErrorCode;
import com.work.bridge.core.exception.BridgeException;
import com.work.bridge.core.gateway.TokenGateway;
import com.work.bridge.core.support.UndoLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.bridge.core.support.ValidationUtils.normalizeAddress;
import static com.work.bridge.core.support.ValidationUtils.requireNonNull;

/**
 * 内存版代币账本，仅用于 demo 与测试，真实项目请替换为链上实现。
 * <p>
 * 余额变更登记到 {@link UndoLog}，账本事务回滚时余额一起恢复。
 */
public class MockTokenGateway implements TokenGateway {

    private static final Logger log = LoggerFactory.getLogger(MockTokenGateway.class);

    private final String custodyAccount;
    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private final Set<String> bridgeSupported = ConcurrentHashMap.newKeySet();
    private volatile boolean mintFailure;
    private volatile boolean burnFailure;

    public MockTokenGateway(String custodyAccount) {
        this.custodyAccount = requireNonNull(normalizeAddress(custodyAccount), "custodyAccount");
    }

    @Override
    public void transferIn(String token, String from, BigInteger amount) {
        move(token, from, custodyAccount, amount);
    }

    @Override
    public void transferOut(String token, String to, BigInteger amount) {
        move(token, custodyAccount, to, amount);
    }

    @Override
    public boolean burn(String token, String from, BigInteger amount) {
        if (burnFailure) {
            return false;
        }
        String key = key(token, from);
        if (balanceOf(token, from).compareTo(amount) < 0) {
            return false;
        }
        adjust(key, amount.negate());
        return true;
    }

    @Override
    public boolean mint(String token, String to, BigInteger amount) {
        if (mintFailure) {
            return false;
        }
        adjust(key(token, to), amount);
        return true;
    }

    @Override
    public boolean supportsBridge(String token) {
        String normalized = normalizeAddress(token);
        return normalized != null && bridgeSupported.contains(normalized);
    }

    /**
     * demo 水龙头：直接给账户加余额，不经过事务。
     */
    public void credit(String token, String account, BigInteger amount) {
        balances.merge(key(token, account), requireNonNull(amount, "amount"), BigInteger::add);
        log.info("mock credit token={} account={} amount={}", normalizeAddress(token), normalizeAddress(account), amount);
    }

    public BigInteger balanceOf(String token, String account) {
        return balances.getOrDefault(key(token, account), BigInteger.ZERO);
    }

    public BigInteger custodyBalance(String token) {
        return balanceOf(token, custodyAccount);
    }

    public void setBridgeSupported(String token, boolean supported) {
        String normalized = requireNonNull(normalizeAddress(token), "token");
        if (supported) {
            bridgeSupported.add(normalized);
        } else {
            bridgeSupported.remove(normalized);
        }
    }

    public void setMintFailure(boolean mintFailure) {
        this.mintFailure = mintFailure;
    }

    public void setBurnFailure(boolean burnFailure) {
        this.burnFailure = burnFailure;
    }

    public String getCustodyAccount() {
        return custodyAccount;
    }

    private void move(String token, String from, String to, BigInteger amount) {
        requireNonNull(amount, "amount");
        if (amount.signum() == 0) {
            return;
        }
        BigInteger available = balanceOf(token, from);
        if (available.compareTo(amount) < 0) {
            throw new BridgeException(BridgeErrorCode.TOKEN_TRANSFER_FAILURE,
                    "余额不足: token=" + token + ", from=" + from + ", balance=" + available + ", amount=" + amount);
        }
        adjust(key(token, from), amount.negate());
        adjust(key(token, to), amount);
    }

    private void adjust(String key, BigInteger delta) {
        balances.merge(key, delta, BigInteger::add);
        UndoLog.record(() -> balances.merge(key, delta.negate(), BigInteger::add));
    }

    private static String key(String token, String account) {
        return normalizeAddress(token) + "#" + normalizeAddress(account);
    }
}
