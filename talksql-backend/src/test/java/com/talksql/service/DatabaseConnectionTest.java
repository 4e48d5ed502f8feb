package com.talksql.service;

import com.talksql.model.ExecutionResult;
import com.talksql.support.SqliteFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DatabaseConnectionTest {

    @TempDir
    Path tempDir;

    private DatabaseConnection connection;

    @BeforeEach
    void setUp() throws Exception {
        Path db = SqliteFixture.createShop(tempDir);
        connection = new ConnectionFactory(5000, 2).open(SqliteFixture.params(db));
    }

    @AfterEach
    void tearDown() {
        connection.close();
    }

    @Test
    void selectReturnsRowsInColumnOrder() {
        ExecutionResult result = connection.execute("SELECT id, name FROM customers WHERE id <= 2 ORDER BY id;", 100, 5);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getExecutedSql()).isEqualTo("SELECT id, name FROM customers WHERE id <= 2 ORDER BY id");
        assertThat(result.getRows()).hasSize(2);
        assertThat(result.getRows().get(0)).containsExactly(Map.entry("id", 1), Map.entry("name", "Alice"));
        assertThat(result.isTruncated()).isFalse();
    }

    @Test
    void rowLimitTruncates() {
        ExecutionResult result = connection.execute("SELECT * FROM customers ORDER BY id", 2, 5);

        assertThat(result.getRows()).hasSize(2);
        assertThat(result.isTruncated()).isTrue();
    }

    @Test
    void updateReportsAffectedRows() {
        ExecutionResult result = connection.execute("UPDATE orders SET status = 'shipped' WHERE status = 'paid'", 100, 5);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAffectedRowCount()).isEqualTo(2L);
        assertThat(result.payload()).isEqualTo(Map.of("affected_rows", 2L));
    }

    @Test
    void sqlErrorsBecomeFailedResults() {
        ExecutionResult result = connection.execute("SELECT * FROM missing_table", 100, 5);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("missing_table");
        assertThat(result.payload()).isNull();

        // a failed statement must not poison the pool
        assertThat(connection.execute("SELECT COUNT(*) AS n FROM orders", 10, 5).getRows())
                .isEqualTo(List.of(Map.of("n", 3)));
    }

    @Test
    void closedConnectionFailsWithoutThrowing() {
        connection.close();
        connection.close();

        ExecutionResult result = connection.execute("SELECT 1", 10, 5);

        assertThat(connection.isClosed()).isTrue();
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("closed");
    }

    @Test
    void stripsOnlyTrailingSemicolons() {
        assertThat(DatabaseConnection.stripTrailingSemicolon(" SELECT ';' FROM t ;; ")).isEqualTo("SELECT ';' FROM t");
        assertThat(DatabaseConnection.stripTrailingSemicolon(null)).isEmpty();
    }
}
