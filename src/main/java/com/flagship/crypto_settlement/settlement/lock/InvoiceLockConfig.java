package com.flagship.crypto_settlement.settlement.lock;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the lock implementation with {@code settlement.lock.mode}:
 * {@code advisory} (default, cross-process) or {@code in-process}.
 *
 * Advisory locks get their own connection pool, sized by
 * {@code settlement.lock.pool-size}, so held locks never take connections
 * the settlement transactions need.
 */
@Configuration
@Slf4j
public class InvoiceLockConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "settlement.lock.mode", havingValue = "advisory", matchIfMissing = true)
    public AdvisoryInvoiceLock advisoryInvoiceLock(DataSourceProperties dataSourceProperties,
                                                   @Value("${settlement.lock.pool-size:10}") int poolSize,
                                                   @Value("${settlement.lock.connection-timeout-ms:2000}") long connectionTimeoutMs) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("settlement-lock");
        config.setJdbcUrl(dataSourceProperties.determineUrl());
        config.setUsername(dataSourceProperties.determineUsername());
        config.setPassword(dataSourceProperties.determinePassword());
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(0);
        config.setConnectionTimeout(connectionTimeoutMs);
        config.setAutoCommit(true);

        log.info("Using PostgreSQL advisory locks for invoice settlement: lockPoolSize={}", poolSize);
        return new AdvisoryInvoiceLock(new HikariDataSource(config));
    }

    @Bean
    @ConditionalOnProperty(name = "settlement.lock.mode", havingValue = "in-process")
    public InvoiceLock inProcessInvoiceLock() {
        log.info("Using in-process locks for invoice settlement");
        return new InProcessInvoiceLock();
    }
}
