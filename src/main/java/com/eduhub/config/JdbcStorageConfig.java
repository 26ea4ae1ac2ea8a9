package com.eduhub.config;

import com.eduhub.isolation.IsolationMode;
import com.eduhub.isolation.JdbcRecordStoreFactory;
import com.eduhub.isolation.RecordStoreFactory;
import com.eduhub.isolation.SchemaPerTenantLocator;
import com.eduhub.isolation.SharedTableLocator;
import com.eduhub.isolation.TableLocator;
import com.eduhub.isolation.TenantSessionDataSource;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.util.Locale;

/**
 * Relational storage for tenant-owned records.
 *
 * Active with {@code eduhub.storage.backend=jdbc}. The table layout follows
 * {@code eduhub.isolation.mode}; with
 * {@code eduhub.isolation.row-policy.enabled} every connection also carries
 * the current tenant for database row policies.
 */
@Configuration
@ConditionalOnProperty(name = "eduhub.storage.backend", havingValue = "jdbc")
public class JdbcStorageConfig {
    
    private static final Logger logger = LoggerFactory.getLogger(JdbcStorageConfig.class);
    
    @Value("${eduhub.storage.jdbc.url:jdbc:postgresql://localhost:5432/eduhub}")
    private String url;
    
    @Value("${eduhub.storage.jdbc.username:eduhub}")
    private String username;
    
    @Value("${eduhub.storage.jdbc.password:}")
    private String password;
    
    @Value("${eduhub.storage.jdbc.pool.size:10}")
    private int poolSize;
    
    @Value("${eduhub.isolation.mode:shared-table}")
    private String isolationMode;
    
    @Value("${eduhub.isolation.row-policy.enabled:false}")
    private boolean rowPolicyEnabled;
    
    @Bean
    public DataSource dataSource() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName("org.postgresql.Driver");
        config.setPoolName("eduhub-records");
        
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(30000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);
        
        DataSource dataSource = new HikariDataSource(config);
        logger.info("Record DataSource initialized: {} (row policies {})", url, rowPolicyEnabled ? "on" : "off");
        return rowPolicyEnabled ? new TenantSessionDataSource(dataSource) : dataSource;
    }
    
    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }
    
    @Bean
    public TableLocator tableLocator() {
        IsolationMode mode = parseMode(isolationMode);
        logger.info("Tenant isolation mode: {}", mode);
        return mode == IsolationMode.SCHEMA_PER_TENANT ? new SchemaPerTenantLocator() : new SharedTableLocator();
    }
    
    @Bean
    public RecordStoreFactory jdbcRecordStoreFactory(JdbcTemplate jdbcTemplate, TableLocator tableLocator) {
        return new JdbcRecordStoreFactory(jdbcTemplate, tableLocator);
    }
    
    static IsolationMode parseMode(String value) {
        try {
            return IsolationMode.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown eduhub.isolation.mode: " + value, e);
        }
    }
}
