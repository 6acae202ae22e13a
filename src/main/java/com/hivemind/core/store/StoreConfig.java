package com.hivemind.core.store;

import com.hivemind.config.HivemindProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link AgentStore} bean.
 * <p>
 * With {@code hivemind.store.type=jdbc} and a JDBC url, a pooled
 * {@link JdbcAgentStore} is created and its tables ensured on startup.
 * Otherwise an {@link InMemoryAgentStore} is used -- suitable for development
 * and testing but not durable across restarts.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    public AgentStore agentStore(HivemindProperties properties) throws Exception {
        var store = properties.getStore();
        if (!store.isJdbc()) {
            log.info("No JDBC store configured; using in-memory agent store (state will not persist across restarts)");
            return new InMemoryAgentStore();
        }
        log.info("Configuring JDBC agent store at {}", store.getUrl());
        var config = new HikariConfig();
        config.setJdbcUrl(store.getUrl());
        config.setUsername(store.getUsername());
        config.setPassword(store.getPassword());
        config.setPoolName("hivemind-store");
        var jdbcStore = new JdbcAgentStore(new HikariDataSource(config));
        jdbcStore.createTables();
        return jdbcStore;
    }
}
