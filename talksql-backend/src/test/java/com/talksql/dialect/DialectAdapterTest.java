package com.talksql.dialect;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class DialectAdapterTest {

    @Test
    void mssqlMovesLimitIntoTop() {
        assertEquals("SELECT TOP 5 * FROM orders", DialectAdapter.adapt("SELECT * FROM orders LIMIT 5", "mssql"));
    }

    @Test
    void mssqlKeepsDistinctBeforeTop() {
        assertEquals("SELECT DISTINCT TOP 3 city FROM customers ORDER BY city",
                DialectAdapter.adapt("SELECT DISTINCT city FROM customers ORDER BY city LIMIT 3", "sqlserver"));
    }

    @Test
    void oracleWrapsLimitInRownumFilter() {
        assertEquals("SELECT * FROM (SELECT id FROM t) WHERE ROWNUM <= 10",
                DialectAdapter.adapt("SELECT id FROM t LIMIT 10", "oracle"));
    }

    @Test
    void oracleReplacesIsnullWithNvl() {
        assertEquals("SELECT NVL(total, 0) FROM orders", DialectAdapter.adapt("SELECT ISNULL(total, 0) FROM orders", "oracle"));
    }

    @Test
    void mysqlRewritesConcatOperatorAndRegexpLike() {
        assertEquals("SELECT CONCAT(first_name, ' ', last_name) FROM people WHERE name REGEXP '^A'",
                DialectAdapter.adapt("SELECT first_name || ' ' || last_name FROM people WHERE REGEXP_LIKE(name, '^A')", "mysql"));
    }

    @Test
    void mariadbUsesMysqlRules() {
        assertEquals("SELECT * FROM t OFFSET 5", DialectAdapter.adapt("SELECT * FROM t OFFSET 5 ROWS", "mariadb"));
    }

    @Test
    void sqliteTurnsTopIntoTrailingLimit() {
        assertEquals("SELECT name FROM customers ORDER BY name LIMIT 2",
                DialectAdapter.adapt("SELECT TOP 2 name FROM customers ORDER BY name", "sqlite"));
        assertEquals("SELECT IFNULL(city, 'n/a') FROM customers",
                DialectAdapter.adapt("SELECT ISNULL(city, 'n/a') FROM customers", "sqlite"));
    }

    @Test
    void trailingSemicolonSurvivesRewrite() {
        assertEquals("SELECT TOP 5 * FROM orders;", DialectAdapter.adapt("SELECT * FROM orders LIMIT 5;", "mssql"));
    }

    @Test
    void postgresqlAndUnknownDialectsAreUntouched() {
        String sql = "SELECT a || b FROM t LIMIT 4";
        assertEquals(sql, DialectAdapter.adapt(sql, "postgresql"));
        assertEquals(sql, DialectAdapter.adapt(sql, "pg"));
        assertEquals(sql, DialectAdapter.adapt(sql, "duckdb"));
        assertNull(DialectAdapter.adapt(null, "mysql"));
    }

    @Test
    void adaptingTwiceGivesTheSameResult() {
        List<String> samples = List.of(
                "SELECT * FROM orders LIMIT 5",
                "SELECT id, ISNULL(total, 0) FROM orders WHERE status = 'paid'",
                "SELECT a || b FROM t OFFSET 2 ROWS",
                "SELECT REGEXP_LIKE(name, 'x') FROM t");
        for (String dialect : List.of("postgresql", "mysql", "mssql", "sqlite")) {
            for (String sql : samples) {
                String once = DialectAdapter.adapt(sql, dialect);
                assertEquals(once, DialectAdapter.adapt(once, dialect), dialect + ": " + sql);
            }
        }
    }

    @Test
    void mssqlRemovesLimitEvenWhenTopIsPresent() {
        String adapted = DialectAdapter.adapt("SELECT TOP 2 * FROM t LIMIT 9", "mssql");
        assertEquals("SELECT TOP 2 * FROM t", adapted);
        assertFalse(adapted.contains("LIMIT"));
    }

    @Test
    void mssqlMovesOnlyTheOuterLimitIntoTop() {
        assertEquals("SELECT TOP 5 * FROM (SELECT id FROM t ORDER BY id LIMIT 3) s",
                DialectAdapter.adapt("SELECT * FROM (SELECT id FROM t ORDER BY id LIMIT 3) s LIMIT 5", "mssql"));
    }

    @Test
    void oracleWrapsOnlyTheOuterLimit() {
        assertEquals("SELECT * FROM (SELECT id FROM t WHERE id IN (SELECT id FROM u LIMIT 3)) WHERE ROWNUM <= 10",
                DialectAdapter.adapt("SELECT id FROM t WHERE id IN (SELECT id FROM u LIMIT 3) LIMIT 10", "oracle"));
    }

    @Test
    void limitInsideSubqueryAloneIsLeftAlone() {
        String sql = "SELECT * FROM (SELECT id FROM t LIMIT 3) s";
        assertEquals(sql, DialectAdapter.adapt(sql, "mssql"));
        assertEquals(sql, DialectAdapter.adapt(sql, "oracle"));
        assertEquals("SELECT * FROM (SELECT id FROM t LIMIT 3) s LIMIT 2",
                DialectAdapter.adapt("SELECT TOP 2 * FROM (SELECT id FROM t LIMIT 3) s", "sqlite"));
    }
}
