package com.talksql.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class TableSchema {
    private String name;
    private List<ColumnInfo> columns;
    private List<String> primaryKeys;
    private List<ForeignKeyInfo> foreignKeys;
    private List<IndexInfo> indexes;
}
