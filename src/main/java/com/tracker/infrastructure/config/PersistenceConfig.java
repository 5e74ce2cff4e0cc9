package com.tracker.infrastructure.config;

import com.tracker.infrastructure.persistence.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Wires the application's single shared connection. The manager is created once at startup,
 * injected into the key allocator and webhook registry, and closed on shutdown.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean(destroyMethod = "close")
    public ConnectionManager connectionManager(DataSource dataSource, DataSourceProperties dataSourceProperties) {
        log.info("Using single managed connection to {}", dataSourceProperties.getUrl());
        return new ConnectionManager(dataSource);
    }
}
