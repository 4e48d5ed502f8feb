package com.talksql.schema;

import com.talksql.model.SchemaSnapshot;
import com.talksql.model.TableSchema;
import com.talksql.service.ConnectionException;
import com.talksql.service.DatabaseConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Narrows a database schema down to the tables relevant to a question and formats them for prompting.
 */
@Slf4j
@Service
public class SchemaResolver {
    private final SchemaIntrospector introspector;
    private final TableSearchClient tableSearchClient;
    private final int sampleRows;

    public SchemaResolver(
            SchemaIntrospector introspector,
            TableSearchClient tableSearchClient,
            @Value("${talksql.agent.sample-rows:3}") int sampleRows
    ) {
        this.introspector = introspector;
        this.tableSearchClient = tableSearchClient;
        this.sampleRows = sampleRows;
    }

    /**
     * Search corpus id used for a session's table documents.
     *
     * @param sessionId session id
     * @return corpus id
     */
    public static String corpusIdFor(String sessionId) {
        return "schema_" + sessionId;
    }

    /**
     * Enumerate every table of the connected database.
     *
     * @param connection live connection
     * @return table names
     * @throws ConnectionException when the connection is closed or unreachable
     */
    public List<String> allTables(DatabaseConnection connection) {
        try {
            return connection.withConnection(conn -> introspector.listTables(conn, connection.getDialect()));
        } catch (SQLException e) {
            throw new ConnectionException("Failed to list tables: " + e.getMessage(), e);
        }
    }

    /**
     * Pick the tables most related to a question. Falls back to {@code allTables} when the search
     * fails or returns nothing usable.
     *
     * @param question question text
     * @param allTables every known table
     * @param topK max tables to ask the search for
     * @param corpusId search corpus
     * @return subset of {@code allTables} in search order, without duplicates
     */
    public List<String> relevantTables(String question, List<String> allTables, int topK, String corpusId) {
        List<String> hits;
        try {
            hits = tableSearchClient.topK(question, topK, corpusId);
        } catch (RuntimeException e) {
            log.warn("Table search failed for {}, using all tables: {}", corpusId, e.getMessage());
            return allTables;
        }

        Map<String, String> known = new LinkedHashMap<>();
        for (String table : allTables) {
            known.putIfAbsent(table.toLowerCase(Locale.ROOT), table);
        }
        List<String> out = new ArrayList<>();
        if (hits != null) {
            for (String hit : hits) {
                String table = hit == null ? null : known.get(hit.trim().toLowerCase(Locale.ROOT));
                if (table != null && !out.contains(table)) {
                    out.add(table);
                }
            }
        }
        return out.isEmpty() ? allTables : out;
    }

    /**
     * Format tables as DDL followed by sample rows.
     *
     * @param connection live connection
     * @param tables tables to format, in output order
     * @return formatted schema text
     */
    public String format(DatabaseConnection connection, List<String> tables) {
        return render(connection, tables).formatted();
    }

    /**
     * Produce the schema snapshot for one question.
     *
     * @param question question text
     * @param connection live connection
     * @param corpusId search corpus
     * @param topK max relevant tables
     * @return snapshot
     * @throws SchemaResolutionException when the schema cannot be read
     */
    public SchemaSnapshot resolve(String question, DatabaseConnection connection, String corpusId, int topK) {
        try {
            List<String> all = allTables(connection);
            List<String> relevant = relevantTables(question, all, topK, corpusId);
            Rendered rendered = render(connection, relevant);
            log.info("Resolved {} of {} table(s) for {}", relevant.size(), all.size(), corpusId);
            return new SchemaSnapshot(connection.getDialect(), all, relevant, rendered.formatted(), rendered.tables());
        } catch (SchemaResolutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SchemaResolutionException("Failed to resolve schema: " + e.getMessage(), e);
        }
    }

    /**
     * Index the DDL of every table so later questions can be matched against it. Failures are logged;
     * questions then fall back to the full table list.
     *
     * @param connection live connection
     * @param corpusId corpus to (re)build
     * @return true if the index was built
     */
    public boolean indexSchema(DatabaseConnection connection, String corpusId) {
        try {
            Map<String, String> documents = connection.withConnection(conn -> {
                Map<String, String> docs = new LinkedHashMap<>();
                for (String table : introspector.listTables(conn, connection.getDialect())) {
                    TableSchema schema = introspector.describe(conn, connection.getDialect(), table);
                    docs.put(table, SchemaIntrospector.createStatement(schema));
                }
                return docs;
            });
            tableSearchClient.index(corpusId, documents);
            return true;
        } catch (SQLException | RuntimeException e) {
            log.warn("Failed to index schema for {}: {}", corpusId, e.getMessage());
            return false;
        }
    }

    public void dropIndex(String corpusId) {
        try {
            tableSearchClient.drop(corpusId);
        } catch (RuntimeException e) {
            log.warn("Failed to drop schema index {}: {}", corpusId, e.getMessage());
        }
    }

    private Rendered render(DatabaseConnection connection, List<String> tables) {
        try {
            return connection.withConnection(conn -> {
                StringBuilder sb = new StringBuilder();
                Map<String, TableSchema> info = new LinkedHashMap<>();
                for (String table : tables) {
                    TableSchema schema = introspector.describe(conn, connection.getDialect(), table);
                    info.put(table, schema);
                    sb.append("-- Table: ").append(table).append('\n');
                    sb.append(SchemaIntrospector.createStatement(schema)).append('\n');

                    List<Map<String, Object>> rows = introspector.sampleRows(conn, table, sampleRows);
                    if (!rows.isEmpty()) {
                        sb.append("\n-- Sample rows from ").append(table).append(" table:\n");
                        for (int i = 0; i < rows.size(); i++) {
                            sb.append("-- Row ").append(i + 1).append(": ").append(rows.get(i)).append('\n');
                        }
                    }
                    sb.append('\n');
                }
                return new Rendered(sb.toString(), info);
            });
        } catch (SQLException e) {
            throw new SchemaResolutionException("Failed to read schema: " + e.getMessage(), e);
        }
    }

    private record Rendered(String formatted, Map<String, TableSchema> tables) {
    }
}
