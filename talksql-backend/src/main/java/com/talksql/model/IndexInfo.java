package com.talksql.model;

import java.util.List;

/**
 * Secondary index metadata.
 *
 * @param name index name
 * @param columns indexed columns, in ordinal order
 * @param unique whether the index enforces uniqueness
 */
public record IndexInfo(String name, List<String> columns, boolean unique) {
}
