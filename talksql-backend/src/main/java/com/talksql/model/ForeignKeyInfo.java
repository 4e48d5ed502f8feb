package com.talksql.model;

import java.util.List;

/**
 * Foreign key from the owning table to {@code referredTable}.
 *
 * @param constrainedColumns columns of the owning table, in key order
 * @param referredTable referenced table
 * @param referredColumns referenced columns, in key order
 */
public record ForeignKeyInfo(List<String> constrainedColumns, String referredTable, List<String> referredColumns) {
}
