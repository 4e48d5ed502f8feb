package com.talksql.util;

import com.talksql.api.ConnectionParams;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdbcUrlBuilderTest {

    private static ConnectionParams params(String dbType, Integer port, String sslmode) {
        return ConnectionParams.builder()
                .dbType(dbType)
                .host("db.internal")
                .port(port)
                .database("shop")
                .username("app")
                .password("secret")
                .sslmode(sslmode)
                .build();
    }

    @Test
    void postgresWithSslMode() {
        JdbcConnectionInfo info = JdbcUrlBuilder.resolve(params("postgres", 6543, "require"));
        assertEquals("jdbc:postgresql://db.internal:6543/shop?sslmode=require", info.getUrl());
        assertEquals("postgresql", info.getDialect());
        assertEquals("org.postgresql.Driver", info.getDriverClassName());
        assertEquals("jdbc:postgresql://db.internal:6543/shop", info.maskedUrl());
    }

    @Test
    void defaultPortsPerDialect() {
        assertEquals("jdbc:mysql://db.internal:3306/shop", JdbcUrlBuilder.resolve(params("mysql", null, null)).getUrl());
        assertEquals("jdbc:mariadb://db.internal:3306/shop", JdbcUrlBuilder.resolve(params("mariadb", null, null)).getUrl());
        assertEquals("jdbc:oracle:thin:@//db.internal:1521/shop", JdbcUrlBuilder.resolve(params("oracle", null, null)).getUrl());
    }

    @Test
    void mysqlSslModeIsTranslated() {
        assertEquals("jdbc:mysql://db.internal:3306/shop?sslMode=REQUIRED",
                JdbcUrlBuilder.resolve(params("mysql", 3306, "require")).getUrl());
    }

    @Test
    void sqlServerUrlUsesProperties() {
        JdbcConnectionInfo info = JdbcUrlBuilder.resolve(params("sqlserver", null, "require"));
        assertEquals("jdbc:sqlserver://db.internal:1433;databaseName=shop;encrypt=true;trustServerCertificate=true", info.getUrl());
        assertEquals("jdbc:sqlserver://db.internal:1433", info.maskedUrl());
    }

    @Test
    void sqliteUsesDatabaseAsPath() {
        ConnectionParams p = ConnectionParams.builder().dbType("sqlite").database("/tmp/shop.db").build();
        assertEquals("jdbc:sqlite:/tmp/shop.db", JdbcUrlBuilder.resolve(p).getUrl());
    }

    @Test
    void rejectsMissingHostAndUnknownTypes() {
        ConnectionParams noHost = ConnectionParams.builder().dbType("postgresql").database("shop").build();
        assertThrows(IllegalArgumentException.class, () -> JdbcUrlBuilder.resolve(noHost));
        assertThrows(IllegalArgumentException.class, () -> JdbcUrlBuilder.resolve(params("mongodb", null, null)));
    }
}
