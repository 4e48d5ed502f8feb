package com.talksql.util;

import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads JDBC rows into ordered maps of JSON-safe values.
 *
 * <p>Driver-specific objects must not reach Jackson or the prompts, so everything that is not a
 * number, boolean or string is converted to text here.
 */
public final class JdbcRows {
    private static final int MAX_TEXT_CHARS = 10_000;
    private static final int MAX_BINARY_BYTES = 10_000;
    private static final String UNREADABLE = "[unreadable]";

    private JdbcRows() {
    }

    /**
     * Result of reading a result set with a row cap.
     *
     * @param rows rows read, column order preserved
     * @param truncated true when more rows were available than the cap
     */
    public record Page(List<Map<String, Object>> rows, boolean truncated) {
    }

    /**
     * Read up to {@code limit} rows.
     *
     * @param rs open result set
     * @param limit max rows, {@code <= 0} for no cap
     * @return rows and truncation flag
     * @throws SQLException on JDBC errors
     */
    public static Page read(ResultSet rs, int limit) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columnCount = md.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        boolean truncated = false;
        while (rs.next()) {
            if (limit > 0 && rows.size() >= limit) {
                truncated = true;
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(md.getColumnLabel(i), readValue(rs, i));
            }
            rows.add(row);
        }
        return new Page(rows, truncated);
    }

    private static Object readValue(ResultSet rs, int columnIndex) {
        try {
            return toJsonSafe(rs.getObject(columnIndex));
        } catch (Exception e) {
            return UNREADABLE;
        }
    }

    /**
     * Convert a JDBC value to a JSON-safe value.
     *
     * @param v raw driver value
     * @return null, Number, Boolean or String
     * @throws SQLException when a LOB cannot be read
     */
    public static Object toJsonSafe(Object v) throws SQLException {
        if (v == null || v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s);
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            int n = (int) Math.min(blob.length(), MAX_BINARY_BYTES);
            return n <= 0 ? "" : Base64.getEncoder().encodeToString(blob.getBytes(1, n));
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString());
        }
        if (v instanceof java.sql.Array arr) {
            Object array = arr.getArray();
            if (array instanceof Object[] items) {
                List<Object> out = new ArrayList<>(items.length);
                for (Object item : items) {
                    out.add(toJsonSafe(item));
                }
                return out;
            }
            return truncate(String.valueOf(array));
        }
        if (v instanceof java.util.Date || v instanceof TemporalAccessor) {
            return v.toString();
        }
        return truncate(String.valueOf(readDriverValue(v)));
    }

    // PGobject (json, jsonb, enums) exposes its text through getValue().
    private static Object readDriverValue(Object v) {
        if ("org.postgresql.util.PGobject".equals(v.getClass().getName())) {
            try {
                Object value = v.getClass().getMethod("getValue").invoke(v);
                return value != null ? value : "";
            } catch (ReflectiveOperationException e) {
                return v;
            }
        }
        return v;
    }

    private static String readClob(Clob clob) throws SQLException {
        int n = (int) Math.min(clob.length(), MAX_TEXT_CHARS);
        if (n <= 0) {
            return "";
        }
        try {
            return clob.getSubString(1, n);
        } catch (SQLException e) {
            try (Reader reader = clob.getCharacterStream()) {
                char[] buf = new char[n];
                int read = reader.read(buf, 0, n);
                return read > 0 ? new String(buf, 0, read) : "";
            } catch (Exception inner) {
                return UNREADABLE;
            }
        }
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_TEXT_CHARS) {
            return s;
        }
        return s.substring(0, MAX_TEXT_CHARS);
    }
}
