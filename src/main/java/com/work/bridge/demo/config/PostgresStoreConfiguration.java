package com.work.bridge.demo.config;

import com.work.bridge.core.repository.BridgeLedgerRepository;
import com.work.bridge.core.repository.GuardConfigRepository;
import com.work.bridge.core.repository.impl.PostgresBridgeLedgerRepository;
import com.work.bridge.core.repository.impl.PostgresGuardConfigRepository;
import com.work.bridge.core.repository.mapper.BridgeSettingMapper;
import com.work.bridge.core.repository.mapper.ChainLedgerStateMapper;
import com.work.bridge.core.repository.mapper.GuardConfigMapper;
import com.work.bridge.core.repository.mapper.RelocationMapper;
import com.work.bridge.core.repository.mapper.TokenModeMapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * PostgreSQL 存储装配：bridge.store=postgres 时启用。
 * DataSource 与 DataSourceTransactionManager 由 Spring Boot 自动配置提供（见 application-postgres.yml）。
 */
@Configuration
@ConditionalOnProperty(prefix = "bridge", name = "store", havingValue = "postgres")
@MapperScan("com.work.bridge.core.repository.mapper")
public class PostgresStoreConfiguration {

    @Bean
    public BridgeLedgerRepository postgresBridgeLedgerRepository(ChainLedgerStateMapper stateMapper,
                                                                 RelocationMapper relocationMapper,
                                                                 TokenModeMapper tokenModeMapper,
                                                                 BridgeSettingMapper settingMapper) {
        return new PostgresBridgeLedgerRepository(stateMapper, relocationMapper, tokenModeMapper, settingMapper);
    }

    @Bean
    public GuardConfigRepository postgresGuardConfigRepository(GuardConfigMapper guardConfigMapper,
                                                               BridgeSettingMapper settingMapper) {
        return new PostgresGuardConfigRepository(guardConfigMapper, settingMapper);
    }
}
