package com.talksql.model;

/**
 * Column metadata as reported by JDBC introspection.
 *
 * @param name column name
 * @param type database type name, with size where relevant
 * @param nullable whether NULL is allowed
 * @param defaultValue column default expression, may be null
 * @param primaryKey whether the column is part of the primary key
 */
public record ColumnInfo(String name, String type, boolean nullable, String defaultValue, boolean primaryKey) {
}
