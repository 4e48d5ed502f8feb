package com.talksql.service;

import com.talksql.model.ExecutionResult;
import com.talksql.util.JdbcRows;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One live, pooled database connection owned by a session.
 *
 * <p>Statement execution and close are serialized so a disconnect never tears the pool down under a
 * running query.
 */
@Slf4j
public class DatabaseConnection implements AutoCloseable {

    /**
     * Work run against a borrowed JDBC connection.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface ConnectionCallback<T> {
        T doWith(Connection connection) throws SQLException;
    }

    private final HikariDataSource dataSource;
    private final String dialect;
    private final String displayUrl;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean closed;

    public DatabaseConnection(HikariDataSource dataSource, String dialect, String displayUrl) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.displayUrl = displayUrl;
    }

    public String getDialect() {
        return dialect;
    }

    public String getDisplayUrl() {
        return displayUrl;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Run a callback on a connection borrowed from the pool.
     *
     * @param callback work to run
     * @param <T> result type
     * @return callback result
     * @throws SQLException on JDBC errors
     */
    public <T> T withConnection(ConnectionCallback<T> callback) throws SQLException {
        lock.lock();
        try {
            ensureOpen();
            try (Connection conn = dataSource.getConnection()) {
                return callback.doWith(conn);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Execute one statement. JDBC failures are reported in the result, never thrown.
     *
     * @param sql statement; a trailing semicolon is dropped
     * @param rowLimit max rows to return, {@code <= 0} for no cap
     * @param queryTimeoutSeconds statement timeout, {@code <= 0} for none
     * @return execution result
     */
    public ExecutionResult execute(String sql, int rowLimit, int queryTimeoutSeconds) {
        String statementSql = stripTrailingSemicolon(sql);
        long startTime = System.currentTimeMillis();
        try {
            return withConnection(conn -> {
                try (Statement stmt = conn.createStatement()) {
                    if (queryTimeoutSeconds > 0) {
                        stmt.setQueryTimeout(queryTimeoutSeconds);
                    }
                    if (rowLimit > 0) {
                        stmt.setMaxRows(rowLimit + 1);
                    }
                    boolean isResultSet = stmt.execute(statementSql);
                    if (isResultSet) {
                        try (ResultSet rs = stmt.getResultSet()) {
                            JdbcRows.Page page = JdbcRows.read(rs, rowLimit);
                            return ExecutionResult.rows(statementSql, page.rows(), page.truncated(),
                                    System.currentTimeMillis() - startTime);
                        }
                    }
                    long affected = Math.max(stmt.getUpdateCount(), 0);
                    return ExecutionResult.updateCount(statementSql, affected, System.currentTimeMillis() - startTime);
                }
            });
        } catch (SQLException e) {
            log.warn("Query failed on {}: {} (SQLState: {}, Error Code: {})",
                    displayUrl, e.getMessage(), e.getSQLState(), e.getErrorCode());
            return ExecutionResult.failure(statementSql, e.getMessage(), System.currentTimeMillis() - startTime);
        } catch (ConnectionException e) {
            return ExecutionResult.failure(statementSql, e.getMessage(), System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Close the underlying pool. Safe to call more than once.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            dataSource.close();
            log.info("Closed connection pool for {}", displayUrl);
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new ConnectionException("Connection is closed: " + displayUrl);
        }
    }

    static String stripTrailingSemicolon(String sql) {
        if (sql == null) {
            return "";
        }
        String trimmed = sql.trim();
        while (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
