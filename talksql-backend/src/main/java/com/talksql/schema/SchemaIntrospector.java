package com.talksql.schema;

import com.talksql.dialect.DialectCatalog;
import com.talksql.model.ColumnInfo;
import com.talksql.model.ForeignKeyInfo;
import com.talksql.model.IndexInfo;
import com.talksql.model.TableSchema;
import com.talksql.util.JdbcRows;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads table structure and sample data through {@link DatabaseMetaData}.
 */
@Component
public class SchemaIntrospector {

    /**
     * List the user tables of the connection's default schema.
     *
     * @param conn open connection
     * @param dialect normalized dialect
     * @return table names in metadata order
     * @throws SQLException on JDBC errors
     */
    public List<String> listTables(Connection conn, String dialect) throws SQLException {
        DatabaseMetaData md = conn.getMetaData();
        List<String> tables = new ArrayList<>();
        try (ResultSet rs = md.getTables(conn.getCatalog(), defaultSchema(conn, dialect), "%", new String[]{"TABLE"})) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (name == null || isSystemTable(name, dialect)) {
                    continue;
                }
                if (!tables.contains(name)) {
                    tables.add(name);
                }
            }
        }
        return tables;
    }

    /**
     * Describe one table: columns, primary key, foreign keys and indexes.
     *
     * @param conn open connection
     * @param dialect normalized dialect
     * @param table table name as listed
     * @return table schema
     * @throws SQLException on JDBC errors
     */
    public TableSchema describe(Connection conn, String dialect, String table) throws SQLException {
        DatabaseMetaData md = conn.getMetaData();
        String catalog = conn.getCatalog();
        String schema = defaultSchema(conn, dialect);

        List<String> primaryKeys = readPrimaryKeys(md, catalog, schema, table);

        List<ColumnInfo> columns = new ArrayList<>();
        try (ResultSet rs = md.getColumns(catalog, schema, table, "%")) {
            while (rs.next()) {
                String name = rs.getString("COLUMN_NAME");
                columns.add(new ColumnInfo(
                        name,
                        typeOf(rs.getString("TYPE_NAME"), rs.getInt("COLUMN_SIZE"), rs.getInt("DATA_TYPE")),
                        rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls,
                        rs.getString("COLUMN_DEF"),
                        primaryKeys.contains(name)
                ));
            }
        }

        return TableSchema.builder()
                .name(table)
                .columns(columns)
                .primaryKeys(primaryKeys)
                .foreignKeys(readForeignKeys(md, catalog, schema, table))
                .indexes(readIndexes(md, catalog, schema, table))
                .build();
    }

    /**
     * Read up to {@code limit} rows of a table.
     *
     * @param conn open connection
     * @param table table name
     * @param limit max rows
     * @return rows in column order
     * @throws SQLException on JDBC errors
     */
    public List<Map<String, Object>> sampleRows(Connection conn, String table, int limit) throws SQLException {
        if (limit <= 0) {
            return List.of();
        }
        String sql = "SELECT * FROM " + quoteIdentifier(conn.getMetaData().getIdentifierQuoteString(), table);
        try (Statement stmt = conn.createStatement()) {
            stmt.setMaxRows(limit);
            try (ResultSet rs = stmt.executeQuery(sql)) {
                return JdbcRows.read(rs, limit).rows();
            }
        }
    }

    /**
     * Render a table as a canonical CREATE TABLE statement.
     *
     * @param table table schema
     * @return DDL text
     */
    public static String createStatement(TableSchema table) {
        List<String> lines = new ArrayList<>();
        for (ColumnInfo c : table.getColumns()) {
            StringBuilder line = new StringBuilder();
            line.append(c.name()).append(' ').append(c.type());
            if (!c.nullable()) {
                line.append(" NOT NULL");
            }
            if (c.defaultValue() != null && !c.defaultValue().isBlank()) {
                line.append(" DEFAULT ").append(c.defaultValue().trim());
            }
            lines.add(line.toString());
        }
        if (table.getPrimaryKeys() != null && !table.getPrimaryKeys().isEmpty()) {
            lines.add("PRIMARY KEY (" + String.join(", ", table.getPrimaryKeys()) + ")");
        }
        if (table.getForeignKeys() != null) {
            for (ForeignKeyInfo fk : table.getForeignKeys()) {
                lines.add("FOREIGN KEY(" + String.join(", ", fk.constrainedColumns()) + ") REFERENCES "
                        + fk.referredTable() + " (" + String.join(", ", fk.referredColumns()) + ")");
            }
        }
        return "CREATE TABLE " + table.getName() + " (\n\t" + String.join(", \n\t", lines) + "\n)";
    }

    private List<String> readPrimaryKeys(DatabaseMetaData md, String catalog, String schema, String table) throws SQLException {
        Map<Integer, String> bySeq = new TreeMap<>();
        try (ResultSet rs = md.getPrimaryKeys(catalog, schema, table)) {
            while (rs.next()) {
                bySeq.put(rs.getInt("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }
        return new ArrayList<>(bySeq.values());
    }

    private List<ForeignKeyInfo> readForeignKeys(DatabaseMetaData md, String catalog, String schema, String table) throws SQLException {
        List<ForeignKeyInfo> out = new ArrayList<>();
        List<String> constrained = null;
        List<String> referredColumns = null;
        String referred = null;
        try (ResultSet rs = md.getImportedKeys(catalog, schema, table)) {
            while (rs.next()) {
                String pkTable = rs.getString("PKTABLE_NAME");
                // rows come ordered by referenced table and KEY_SEQ; KEY_SEQ 1 starts a new key
                if (constrained == null || rs.getInt("KEY_SEQ") <= 1 || !pkTable.equals(referred)) {
                    if (constrained != null) {
                        out.add(new ForeignKeyInfo(constrained, referred, referredColumns));
                    }
                    constrained = new ArrayList<>();
                    referredColumns = new ArrayList<>();
                    referred = pkTable;
                }
                constrained.add(rs.getString("FKCOLUMN_NAME"));
                referredColumns.add(rs.getString("PKCOLUMN_NAME"));
            }
        }
        if (constrained != null) {
            out.add(new ForeignKeyInfo(constrained, referred, referredColumns));
        }
        return out;
    }

    private List<IndexInfo> readIndexes(DatabaseMetaData md, String catalog, String schema, String table) {
        Map<String, IndexInfo> byName = new LinkedHashMap<>();
        try (ResultSet rs = md.getIndexInfo(catalog, schema, table, false, true)) {
            while (rs.next()) {
                String name = rs.getString("INDEX_NAME");
                String column = rs.getString("COLUMN_NAME");
                if (name == null || column == null) {
                    continue;
                }
                boolean unique = !rs.getBoolean("NON_UNIQUE");
                IndexInfo existing = byName.get(name);
                List<String> columns = existing != null ? new ArrayList<>(existing.columns()) : new ArrayList<>();
                columns.add(column);
                byName.put(name, new IndexInfo(name, columns, unique));
            }
        } catch (SQLException e) {
            // Some drivers refuse index metadata for views or without extra privileges.
            return List.of();
        }
        return new ArrayList<>(byName.values());
    }

    private static String quoteIdentifier(String quote, String name) {
        if (quote == null || quote.isBlank()) {
            return name;
        }
        return quote + name.replace(quote, quote + quote) + quote;
    }

    private static String typeOf(String typeName, int size, int sqlType) {
        String type = typeName != null && !typeName.isBlank() ? typeName.toUpperCase(Locale.ROOT) : "UNKNOWN";
        boolean sized = sqlType == java.sql.Types.VARCHAR || sqlType == java.sql.Types.CHAR
                || sqlType == java.sql.Types.NVARCHAR || sqlType == java.sql.Types.NCHAR;
        if (sized && size > 0 && size < 65_535 && !type.contains("(")) {
            return type + "(" + size + ")";
        }
        return type;
    }

    private static String defaultSchema(Connection conn, String dialect) throws SQLException {
        if (DialectCatalog.SQLITE.equals(dialect) || DialectCatalog.MYSQL.equals(dialect)
                || DialectCatalog.MARIADB.equals(dialect)) {
            return null;
        }
        if (DialectCatalog.ORACLE.equals(dialect)) {
            String user = conn.getMetaData().getUserName();
            return user != null ? user.toUpperCase(Locale.ROOT) : null;
        }
        String schema = conn.getSchema();
        if (schema != null && !schema.isBlank()) {
            return schema;
        }
        return DialectCatalog.POSTGRESQL.equals(dialect) ? "public" : null;
    }

    private static boolean isSystemTable(String name, String dialect) {
        return DialectCatalog.SQLITE.equals(dialect) && name.toLowerCase(Locale.ROOT).startsWith("sqlite_");
    }
}
