package com.hal9001.backend.global.datasource;

import java.time.Duration;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Registers the single {@link ConnectionManager} and exposes its data source so Spring
 * Boot's own pool auto-configuration backs off.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    public StorageSettings storageSettings(
            @Value("${hal.storage.url:}") String url,
            @Value("${hal.storage.username:}") String username,
            @Value("${hal.storage.password:#{null}}") String password,
            @Value("${hal.storage.embedded-url:" + StorageSettings.DEFAULT_EMBEDDED_URL + "}") String embeddedUrl,
            @Value("${hal.storage.pool.min-idle:1}") int poolMinIdle,
            @Value("${hal.storage.pool.max-size:10}") int poolMaxSize,
            @Value("${hal.storage.pool.connection-timeout:30s}") Duration connectionTimeout,
            @Value("${hal.storage.construction-attempts:2}") int constructionAttempts,
            @Value("${hal.storage.construction-backoff:500ms}") Duration constructionBackoff
    ) {
        return new StorageSettings(url, username, password, embeddedUrl, poolMinIdle, poolMaxSize,
                connectionTimeout, constructionAttempts, constructionBackoff);
    }

    @Bean(destroyMethod = "close")
    public ConnectionManager connectionManager(StorageSettings storageSettings) {
        return new ConnectionManager(storageSettings);
    }

    @Bean
    @Primary
    public DataSource dataSource(ConnectionManager connectionManager) {
        return connectionManager.dataSource();
    }
}
