package com.work.bridge.demo.config;

import com.work.bridge.core.BridgeComponent;
import com.work.bridge.core.access.AccessControl;
import com.work.bridge.core.access.BridgeRole;
import com.work.bridge.core.access.InMemoryAccessControl;
import com.work.bridge.core.access.PauseControl;
import com.work.bridge.core.config.BridgeConfig;
import com.work.bridge.core.event.BridgeEventListener;
import com.work.bridge.core.event.BridgeEventPublisher;
import com.work.bridge.core.event.LoggingBridgeEventListener;
import com.work.bridge.core.execution.ChainExecutor;
import com.work.bridge.core.execution.DirectChainExecutor;
import com.work.bridge.core.execution.WorkerQueueChainExecutor;
import com.work.bridge.core.gateway.FeeOracleResolver;
import com.work.bridge.core.gateway.TokenGateway;
import com.work.bridge.core.guard.AccommodationGuardService;
import com.work.bridge.core.repository.BridgeLedgerRepository;
import com.work.bridge.core.repository.GuardConfigRepository;
import com.work.bridge.core.service.BridgeLedgerService;
import com.work.bridge.core.support.InMemoryBridgeLedgerRepository;
import com.work.bridge.core.support.InMemoryGuardConfigRepository;
import com.work.bridge.core.support.InMemoryTransactionManager;
import com.work.bridge.demo.chain.MockTokenGateway;
import com.work.bridge.demo.chain.web3j.Web3jFeeOracle;
import com.work.bridge.demo.fee.BasisPointFeeOracle;
import com.work.bridge.demo.fee.StaticFeeOracleResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.web3j.protocol.Web3j;

import java.time.Clock;
import java.util.stream.Collectors;

/**
 * 将核心组件装配为 Spring Bean，方便通过依赖注入复用。
 * 默认使用内存存储 + mock 代币；bridge.store=postgres / chain.mode=web3j 时由对应配置类替换实现。
 */
@Configuration
@EnableConfigurationProperties({BridgeProperties.class, ChainProperties.class, FeeProperties.class})
public class BridgeComponentConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BridgeComponentConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BridgeConfig bridgeConfig(BridgeProperties properties) {
        return new BridgeConfig(
                properties.getCustodyAccount(),
                properties.getLedgerAddress(),
                properties.isModeImmutable(),
                properties.isGuardEnabled()
        );
    }

    // ------------------------------------------------------------ memory store

    @Bean
    @ConditionalOnProperty(prefix = "bridge", name = "store", havingValue = "memory", matchIfMissing = true)
    public PlatformTransactionManager transactionManager() {
        return new InMemoryTransactionManager();
    }

    @Bean
    @ConditionalOnProperty(prefix = "bridge", name = "store", havingValue = "memory", matchIfMissing = true)
    public BridgeLedgerRepository inMemoryBridgeLedgerRepository() {
        return new InMemoryBridgeLedgerRepository();
    }

    @Bean
    @ConditionalOnProperty(prefix = "bridge", name = "store", havingValue = "memory", matchIfMissing = true)
    public GuardConfigRepository inMemoryGuardConfigRepository() {
        return new InMemoryGuardConfigRepository();
    }

    // ------------------------------------------------------------ collaborators

    /**
     * TokenGateway 实现（业务方需要替换为自己的实现）
     */
    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public TokenGateway mockTokenGateway(BridgeProperties properties) {
        // 默认使用 mock；若设置 chain.mode=web3j，将由 Web3jConfiguration 提供实现
        return new MockTokenGateway(properties.getCustodyAccount());
    }

    @Bean
    public FeeOracleResolver feeOracleResolver(FeeProperties properties, ObjectProvider<Web3j> web3j) {
        Web3j client = web3j.getIfAvailable();
        StaticFeeOracleResolver resolver = client == null
                ? new StaticFeeOracleResolver()
                : new StaticFeeOracleResolver(address -> new Web3jFeeOracle(client, address));
        return resolver.register(properties.getOracleAddress(),
                new BasisPointFeeOracle(properties.getBasisPoints(), properties.getMaxBasisPoints()));
    }

    @Bean
    public LoggingBridgeEventListener loggingBridgeEventListener() {
        return new LoggingBridgeEventListener();
    }

    @Bean
    public BridgeEventPublisher bridgeEventPublisher(ObjectProvider<BridgeEventListener> listeners) {
        return new BridgeEventPublisher(listeners.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    public AccessControl accessControl(BridgeProperties properties, BridgeEventPublisher events) {
        InMemoryAccessControl accessControl = new InMemoryAccessControl(events);
        accessControl.setup(BridgeRole.OWNER, properties.getOwner());
        properties.getBridgers().forEach(account -> accessControl.setup(BridgeRole.BRIDGER, account));
        properties.getPausers().forEach(account -> accessControl.setup(BridgeRole.PAUSER, account));
        return accessControl;
    }

    @Bean
    public PauseControl pauseControl(BridgeEventPublisher events) {
        return new PauseControl(events);
    }

    @Bean
    public ChainExecutor chainExecutor(BridgeProperties properties) {
        if ("worker-queue".equalsIgnoreCase(properties.getExecutorMode())) {
            log.info("chain executor mode=worker-queue workerCount={} queueCapacity={} dispatchTimeout={}",
                    properties.getWorkerCount(), properties.getQueueCapacity(), properties.getDispatchTimeout());
            return new WorkerQueueChainExecutor(properties.getWorkerCount(), properties.getQueueCapacity(),
                    properties.getDispatchTimeout(), "bridge-lane-");
        }
        return new DirectChainExecutor();
    }

    // ------------------------------------------------------------ services

    /**
     * 首次启动时把账本地址登记为 guard 唯一允许的调用方。
     */
    @Bean
    public AccommodationGuardService accommodationGuardService(GuardConfigRepository repository,
                                                               BridgeEventPublisher events,
                                                               Clock clock,
                                                               PlatformTransactionManager transactionManager,
                                                               BridgeConfig config) {
        AccommodationGuardService guard = new AccommodationGuardService(repository, events, clock, transactionManager);
        if (guard.getBridge() == null) {
            guard.setBridge(config.getLedgerAddress());
        }
        return guard;
    }

    @Bean
    public BridgeLedgerService bridgeLedgerService(BridgeLedgerRepository repository,
                                                   TokenGateway tokenGateway,
                                                   FeeOracleResolver feeOracleResolver,
                                                   AccommodationGuardService guard,
                                                   BridgeEventPublisher events,
                                                   BridgeConfig config,
                                                   Clock clock,
                                                   PlatformTransactionManager transactionManager) {
        return new BridgeLedgerService(repository, tokenGateway, feeOracleResolver, guard, events, config, clock, transactionManager);
    }

    @Bean
    public BridgeComponent bridgeComponent(BridgeLedgerService ledger,
                                           AccommodationGuardService guard,
                                           AccessControl accessControl,
                                           PauseControl pauseControl,
                                           ChainExecutor chainExecutor) {
        return new BridgeComponent(ledger, guard, accessControl, pauseControl, chainExecutor);
    }
}
