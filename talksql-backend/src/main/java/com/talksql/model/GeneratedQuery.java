package com.talksql.model;

/**
 * SQL produced by the generation stage.
 *
 * @param sql extracted SQL statement
 * @param explanation model output with the SQL removed
 * @param rawModelOutput untouched model output
 */
public record GeneratedQuery(String sql, String explanation, String rawModelOutput) {

    /**
     * Copy of this query with the SQL replaced, used when validation supplies a correction.
     *
     * @param correctedSql replacement SQL
     * @return new query
     */
    public GeneratedQuery withSql(String correctedSql) {
        return new GeneratedQuery(correctedSql, explanation, rawModelOutput);
    }
}
