package com.talksql.llm;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class SqlExtractorTest {

    @Test
    void extractsFencedSql() {
        String reply = "- Explanation: count the rows.\n- SQL Query:\n```sql\nSELECT COUNT(*) FROM orders;\n```\n";

        assertEquals("SELECT COUNT(*) FROM orders;", SqlExtractor.extractSql(reply));
        assertEquals("- Explanation: count the rows.\n- SQL Query:", SqlExtractor.explanation(reply, "SELECT COUNT(*) FROM orders;"));
    }

    @Test
    void fallsBackToSelectLines() {
        String reply = "Here you go:\n  select name\nFROM customers";

        assertEquals("  select name\nFROM customers", SqlExtractor.extractSql(reply));
    }

    @Test
    void fallsBackToWholeReply() {
        assertEquals("WITH x AS (SELECT 1) SELECT * FROM x", SqlExtractor.extractSql("WITH x AS (SELECT 1) SELECT * FROM x"));
        assertEquals("", SqlExtractor.extractSql(null));
    }

    @Test
    void extractsCorrections() {
        assertEquals("SELECT a, COUNT(*) FROM t GROUP BY a",
                SqlExtractor.extractCorrection("Problem: b is not aggregated.\n```sql\nSELECT a, COUNT(*) FROM t GROUP BY a\n```"));
        assertEquals("SELECT * FROM orders ORDER BY id LIMIT 5",
                SqlExtractor.extractCorrection("LIMIT without ORDER BY.\nCorrected query: SELECT * FROM orders ORDER BY id LIMIT 5\n\nDone."));
        assertEquals("SELECT id FROM users",
                SqlExtractor.extractCorrection("Suggested correction: SELECT id FROM users"));
        assertNull(SqlExtractor.extractCorrection("The query appears to be correct."));
        assertNull(SqlExtractor.extractCorrection("```sql\n```"));
        assertNull(SqlExtractor.extractCorrection(null));
    }
}
