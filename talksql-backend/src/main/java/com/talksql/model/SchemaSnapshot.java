package com.talksql.model;

import java.util.List;
import java.util.Map;

/**
 * The part of a database schema deemed relevant to one question, formatted for the generation model.
 *
 * <p>Computed fresh for every question. {@code relevantTables} is always a subset of {@code allTables}.
 *
 * @param dialect normalized dialect of the connection
 * @param allTables every table of the connected database, in enumeration order
 * @param relevantTables candidate tables for the question
 * @param formattedSchema DDL plus sample rows of the relevant tables
 * @param perTableInfo structured metadata of the relevant tables
 */
public record SchemaSnapshot(
        String dialect,
        List<String> allTables,
        List<String> relevantTables,
        String formattedSchema,
        Map<String, TableSchema> perTableInfo
) {
}
