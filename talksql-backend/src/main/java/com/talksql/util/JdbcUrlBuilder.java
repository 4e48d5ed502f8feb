package com.talksql.util;

import com.talksql.api.ConnectionParams;
import com.talksql.dialect.DialectCatalog;

import java.util.Locale;
import java.util.Map;

/**
 * Maps client connection parameters onto a JDBC URL and driver class.
 */
public final class JdbcUrlBuilder {

    private static final Map<String, Integer> DEFAULT_PORTS = Map.of(
            DialectCatalog.POSTGRESQL, 5432,
            DialectCatalog.MYSQL, 3306,
            DialectCatalog.MARIADB, 3306,
            DialectCatalog.MSSQL, 1433,
            DialectCatalog.ORACLE, 1521
    );

    private static final Map<String, String> DRIVERS = Map.of(
            DialectCatalog.POSTGRESQL, "org.postgresql.Driver",
            DialectCatalog.MYSQL, "com.mysql.cj.jdbc.Driver",
            DialectCatalog.MARIADB, "org.mariadb.jdbc.Driver",
            DialectCatalog.MSSQL, "com.microsoft.sqlserver.jdbc.SQLServerDriver",
            DialectCatalog.ORACLE, "oracle.jdbc.OracleDriver",
            DialectCatalog.SQLITE, "org.sqlite.JDBC"
    );

    private JdbcUrlBuilder() {
    }

    /**
     * Resolve connection parameters into JDBC connection info.
     *
     * @param params client connection parameters
     * @return jdbc connection info
     * @throws IllegalArgumentException for unsupported database types or missing fields
     */
    public static JdbcConnectionInfo resolve(ConnectionParams params) {
        String dialect = DialectCatalog.normalize(params.getDbType());
        if (!DRIVERS.containsKey(dialect)) {
            throw new IllegalArgumentException("Unsupported database type: " + params.getDbType());
        }
        String database = params.getDatabase();
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("database is required");
        }

        String url;
        if (DialectCatalog.SQLITE.equals(dialect)) {
            url = "jdbc:sqlite:" + database.trim();
        } else {
            String host = params.getHost();
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("host is required for database type: " + dialect);
            }
            int port = params.getPort() != null && params.getPort() > 0 ? params.getPort() : DEFAULT_PORTS.get(dialect);
            url = buildNetworkUrl(dialect, host.trim(), port, database.trim(), params.getSslmode());
        }

        return JdbcConnectionInfo.builder()
                .url(url)
                .username(params.getUsername())
                .password(params.getPassword())
                .dialect(dialect)
                .driverClassName(DRIVERS.get(dialect))
                .build();
    }

    private static String buildNetworkUrl(String dialect, String host, int port, String database, String sslmode) {
        String ssl = sslmode != null ? sslmode.trim().toLowerCase(Locale.ROOT) : "";
        if (DialectCatalog.POSTGRESQL.equals(dialect)) {
            String url = String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
            return ssl.isEmpty() ? url : url + "?sslmode=" + ssl;
        }
        if (DialectCatalog.MYSQL.equals(dialect)) {
            String url = String.format("jdbc:mysql://%s:%d/%s", host, port, database);
            return ssl.isEmpty() ? url : url + "?sslMode=" + mysqlSslMode(ssl);
        }
        if (DialectCatalog.MARIADB.equals(dialect)) {
            String url = String.format("jdbc:mariadb://%s:%d/%s", host, port, database);
            return ssl.isEmpty() ? url : url + "?sslMode=" + mariadbSslMode(ssl);
        }
        if (DialectCatalog.MSSQL.equals(dialect)) {
            boolean encrypt = "require".equals(ssl) || ssl.startsWith("verify");
            return String.format("jdbc:sqlserver://%s:%d;databaseName=%s;encrypt=%s;trustServerCertificate=%s",
                    host, port, database, encrypt, !ssl.startsWith("verify"));
        }
        return String.format("jdbc:oracle:thin:@//%s:%d/%s", host, port, database);
    }

    private static String mysqlSslMode(String sslmode) {
        if ("disable".equals(sslmode)) {
            return "DISABLED";
        }
        if ("require".equals(sslmode)) {
            return "REQUIRED";
        }
        if ("verify-ca".equals(sslmode)) {
            return "VERIFY_CA";
        }
        if ("verify-full".equals(sslmode)) {
            return "VERIFY_IDENTITY";
        }
        return "PREFERRED";
    }

    private static String mariadbSslMode(String sslmode) {
        if ("require".equals(sslmode) || "prefer".equals(sslmode) || "allow".equals(sslmode)) {
            return "trust";
        }
        if ("verify-ca".equals(sslmode) || "verify-full".equals(sslmode)) {
            return sslmode;
        }
        return "disable";
    }
}
