package com.work.bridge.core.service;

import com.work.bridge.core.config.BridgeConfig;
import com.work.bridge.core.event.BridgeEventListener;
import com.work.bridge.core.event.BridgeEventPublisher;
import com.work.bridge.core.gateway.FeeOracle;
import com.work.bridge.core.gateway.FeeOracleResolver;
import com.work.bridge.core.guard.AccommodationGuardService;
import com.work.bridge.core.support.InMemoryBridgeLedgerRepository;
import com.work.bridge.core.support.InMemoryGuardConfigRepository;
import com.work.bridge.core.support.InMemoryTransactionManager;
import com.work.bridge.core.support.MutableClock;
import com.work.bridge.demo.chain.MockTokenGateway;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;

import static org.mockito.Mockito.mock;

/**
 * 纯内存的账本装配：内存仓储 + 内存事务 + mock 代币，fee oracle 固定收取 1%。
 */
class LedgerFixture {

    static final long CHAIN = 1L;
    static final String TOKEN = "0x1000000000000000000000000000000000000001";
    static final String BRIDGE_TOKEN = "0x1000000000000000000000000000000000000002";
    static final String USER = "0x2000000000000000000000000000000000000002";
    static final String OTHER_USER = "0x2000000000000000000000000000000000000003";
    static final String COLLECTOR = "0x3000000000000000000000000000000000000003";
    static final String ORACLE = "0x4000000000000000000000000000000000000004";
    static final String CUSTODY = BridgeConfig.defaultConfig().getCustodyAccount();

    final MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_700_000_000L));
    final BridgeEventListener listener = mock(BridgeEventListener.class);
    final BridgeEventPublisher events = new BridgeEventPublisher(Collections.singletonList(listener));
    final InMemoryTransactionManager transactionManager = new InMemoryTransactionManager();
    final InMemoryBridgeLedgerRepository repository = new InMemoryBridgeLedgerRepository();
    final MockTokenGateway tokens = new MockTokenGateway(CUSTODY);
    final AccommodationGuardService guard;
    final BridgeLedgerService ledger;

    LedgerFixture() {
        this(BridgeConfig.defaultConfig());
    }

    LedgerFixture(BridgeConfig config) {
        this(config, address -> ORACLE.equals(address)
                ? Optional.<FeeOracle>of((chainId, token, account, amount) -> amount.divide(BigInteger.valueOf(100)))
                : Optional.empty());
    }

    LedgerFixture(BridgeConfig config, FeeOracleResolver resolver) {
        guard = new AccommodationGuardService(new InMemoryGuardConfigRepository(), events, clock, transactionManager);
        guard.setBridge(config.getLedgerAddress());
        ledger = new BridgeLedgerService(repository, tokens, resolver, guard, events, config, clock, transactionManager);
    }

    BigInteger balance(String token, String account) {
        return tokens.balanceOf(token, account);
    }

    static BigInteger amount(long value) {
        return BigInteger.valueOf(value);
    }
}
