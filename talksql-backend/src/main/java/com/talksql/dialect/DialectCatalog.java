package com.talksql.dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static knowledge about the SQL dialects the service can target.
 *
 * <p>Dialect names arriving from clients or drivers are normalized here before any lookup,
 * so {@code postgres}, {@code pg} and {@code postgresql} all resolve to the same entry.
 */
public final class DialectCatalog {

    public static final String POSTGRESQL = "postgresql";
    public static final String MYSQL = "mysql";
    public static final String MARIADB = "mariadb";
    public static final String SQLITE = "sqlite";
    public static final String MSSQL = "mssql";
    public static final String ORACLE = "oracle";

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("postgres", POSTGRESQL),
            Map.entry("pg", POSTGRESQL),
            Map.entry("postgresql", POSTGRESQL),
            Map.entry("mysql", MYSQL),
            Map.entry("mariadb", MARIADB),
            Map.entry("sqlite", SQLITE),
            Map.entry("sqlite3", SQLITE),
            Map.entry("mssql", MSSQL),
            Map.entry("sqlserver", MSSQL),
            Map.entry("microsoft sql server", MSSQL),
            Map.entry("oracle", ORACLE)
    );

    private static final List<String> COMMON_AGGREGATES = List.of("SUM", "AVG", "MIN", "MAX", "COUNT");

    private static final Map<String, DialectFeatures> FEATURES = Map.of(
            POSTGRESQL, new DialectFeatures(POSTGRESQL, true, true, true, true,
                    List.of("DATE_TRUNC", "EXTRACT", "TO_CHAR"),
                    List.of("LOWER", "UPPER", "TRIM", "SUBSTRING", "REGEXP_REPLACE"),
                    withCommonAggregates("ARRAY_AGG", "STRING_AGG")),
            MYSQL, new DialectFeatures(MYSQL, true, true, true, false,
                    List.of("DATE_FORMAT", "EXTRACT", "DATE_ADD", "DATE_SUB"),
                    List.of("LOWER", "UPPER", "TRIM", "SUBSTRING", "REGEXP_REPLACE"),
                    withCommonAggregates("GROUP_CONCAT")),
            SQLITE, new DialectFeatures(SQLITE, false, false, false, false,
                    List.of("STRFTIME", "DATE", "TIME", "DATETIME"),
                    List.of("LOWER", "UPPER", "TRIM", "SUBSTR", "REPLACE"),
                    withCommonAggregates("GROUP_CONCAT")),
            MSSQL, new DialectFeatures(MSSQL, true, true, true, false,
                    List.of("DATEPART", "DATEADD", "DATEDIFF", "FORMAT"),
                    List.of("LOWER", "UPPER", "TRIM", "SUBSTRING", "REPLACE"),
                    withCommonAggregates("STRING_AGG")),
            ORACLE, new DialectFeatures(ORACLE, true, true, true, false,
                    List.of("TO_CHAR", "EXTRACT", "ADD_MONTHS", "MONTHS_BETWEEN"),
                    List.of("LOWER", "UPPER", "TRIM", "SUBSTR", "REPLACE", "REGEXP_REPLACE"),
                    withCommonAggregates("LISTAGG"))
    );

    private DialectCatalog() {
    }

    /**
     * Normalize a dialect or database type name.
     *
     * @param dialect incoming name, may be null
     * @return canonical name (lowercased + alias mapping), empty string when blank
     */
    public static String normalize(String dialect) {
        if (dialect == null) {
            return "";
        }
        String v = dialect.trim().toLowerCase(Locale.ROOT);
        if (v.isBlank()) {
            return "";
        }
        return ALIASES.getOrDefault(v, v);
    }

    /**
     * Dialect used for rewrite rules. MariaDB shares the MySQL rules.
     *
     * @param dialect incoming name
     * @return rewrite family name
     */
    public static String rewriteFamily(String dialect) {
        String normalized = normalize(dialect);
        return MARIADB.equals(normalized) ? MYSQL : normalized;
    }

    /**
     * Look up the feature set of a dialect.
     *
     * <p>Unknown dialects get a permissive default so that generation is still attempted.
     *
     * @param dialect incoming name
     * @return feature set, never null
     */
    public static DialectFeatures featureSet(String dialect) {
        String family = rewriteFamily(dialect);
        DialectFeatures known = FEATURES.get(family);
        if (known != null) {
            if (!family.equals(normalize(dialect))) {
                return rename(known, normalize(dialect));
            }
            return known;
        }
        String name = normalize(dialect);
        return new DialectFeatures(name.isEmpty() ? "unknown" : name, true, true, true, true,
                List.of("DATE", "EXTRACT", "CURRENT_DATE"),
                List.of("LOWER", "UPPER", "TRIM", "SUBSTRING"),
                COMMON_AGGREGATES);
    }

    /**
     * Whether the dialect has a dedicated feature entry.
     *
     * @param dialect incoming name
     * @return true if known
     */
    public static boolean isKnown(String dialect) {
        return FEATURES.containsKey(rewriteFamily(dialect));
    }

    private static DialectFeatures rename(DialectFeatures f, String name) {
        return new DialectFeatures(name, f.supportsWindowFunctions(), f.supportsCTEs(), f.supportsJSON(),
                f.supportsArrays(), f.dateFunctions(), f.stringFunctions(), f.aggregateFunctions());
    }

    private static List<String> withCommonAggregates(String... extra) {
        List<String> out = new ArrayList<>(COMMON_AGGREGATES);
        out.addAll(List.of(extra));
        return List.copyOf(out);
    }
}
