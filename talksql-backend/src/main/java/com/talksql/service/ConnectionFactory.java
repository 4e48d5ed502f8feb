package com.talksql.service;

import com.talksql.api.ConnectionParams;
import com.talksql.dialect.DialectCatalog;
import com.talksql.util.JdbcConnectionInfo;
import com.talksql.util.JdbcUrlBuilder;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.UUID;

/**
 * Opens validated, pooled database connections from client connection parameters.
 */
@Slf4j
@Service
public class ConnectionFactory {
    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final long connectionTimeoutMs;
    private final int poolSize;

    public ConnectionFactory(
            @Value("${talksql.db.connection-timeout-ms:10000}") long connectionTimeoutMs,
            @Value("${talksql.db.pool-size:2}") int poolSize
    ) {
        this.connectionTimeoutMs = connectionTimeoutMs;
        this.poolSize = poolSize;
    }

    /**
     * Open a connection and check that the database answers.
     *
     * @param params connection parameters
     * @return live connection
     * @throws ConnectionException when the target is unsupported or unreachable
     */
    public DatabaseConnection open(ConnectionParams params) {
        JdbcConnectionInfo info;
        try {
            info = JdbcUrlBuilder.resolve(params);
        } catch (IllegalArgumentException e) {
            throw new ConnectionException(e.getMessage(), e);
        }

        log.info("Opening {} connection: {}", info.getDialect(), info.maskedUrl());
        HikariDataSource ds;
        try {
            ds = new HikariDataSource(buildHikariConfig(info));
        } catch (RuntimeException e) {
            // Hikari fails fast on the initial connection and wraps the driver error.
            String message = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            log.error("Connection failed for {}: {}", info.maskedUrl(), message);
            throw new ConnectionException("Failed to connect: " + message, e);
        }

        try (Connection conn = ds.getConnection()) {
            if (!conn.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                throw new SQLException("Connection is not valid");
            }
        } catch (SQLException e) {
            ds.close();
            log.error("Connection failed for {}: {} (SQLState: {}, Error Code: {})",
                    info.maskedUrl(), e.getMessage(), e.getSQLState(), e.getErrorCode());
            throw new ConnectionException("Failed to connect: " + e.getMessage(), e);
        }

        return new DatabaseConnection(ds, info.getDialect(), info.maskedUrl());
    }

    HikariConfig buildHikariConfig(JdbcConnectionInfo info) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("talksql-" + info.getDialect() + "-" + UUID.randomUUID().toString().substring(0, 8));
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(info.getUrl());
        config.setDriverClassName(info.getDriverClassName());
        if (info.getUsername() != null && !info.getUsername().isBlank()) {
            config.setUsername(info.getUsername());
        }
        if (info.getPassword() != null && !info.getPassword().isEmpty()) {
            config.setPassword(info.getPassword());
        }

        if (DialectCatalog.POSTGRESQL.equals(info.getDialect())) {
            config.addDataSourceProperty("ApplicationName", "talksql");
        } else if (DialectCatalog.ORACLE.equals(info.getDialect())) {
            config.addDataSourceProperty("v$session.program", "talksql");
        }

        config.setConnectionTimeout(connectionTimeoutMs);
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(0);
        return config;
    }
}
