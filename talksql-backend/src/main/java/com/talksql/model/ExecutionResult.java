package com.talksql.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Outcome of running one SQL statement.
 *
 * <p>A successful query carries either {@code rows} (result-set statements) or {@code affectedRowCount}.
 * A failed one carries {@code errorMessage}.
 */
@Data
@Builder
public class ExecutionResult {
    private boolean success;
    private String executedSql;
    private List<Map<String, Object>> rows;
    private Long affectedRowCount;
    private boolean truncated;
    private long durationMs;
    private String errorMessage;

    public static ExecutionResult rows(String sql, List<Map<String, Object>> rows, boolean truncated, long durationMs) {
        return ExecutionResult.builder()
                .success(true)
                .executedSql(sql)
                .rows(rows)
                .truncated(truncated)
                .durationMs(durationMs)
                .build();
    }

    public static ExecutionResult updateCount(String sql, long affected, long durationMs) {
        return ExecutionResult.builder()
                .success(true)
                .executedSql(sql)
                .affectedRowCount(affected)
                .durationMs(durationMs)
                .build();
    }

    public static ExecutionResult failure(String sql, String errorMessage, long durationMs) {
        return ExecutionResult.builder()
                .success(false)
                .executedSql(sql)
                .errorMessage(errorMessage)
                .durationMs(durationMs)
                .build();
    }

    /**
     * Payload returned to the client as {@code data}: the rows, or the affected row count.
     *
     * @return rows, a row count, or null for a failure
     */
    public Object payload() {
        if (!success) {
            return null;
        }
        if (rows != null) {
            return rows;
        }
        return Map.of("affected_rows", affectedRowCount != null ? affectedRowCount : 0L);
    }
}
