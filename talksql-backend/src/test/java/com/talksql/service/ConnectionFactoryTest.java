package com.talksql.service;

import com.talksql.api.ConnectionParams;
import com.talksql.support.SqliteFixture;
import com.talksql.util.JdbcConnectionInfo;
import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionFactoryTest {

    @TempDir
    Path tempDir;

    private final ConnectionFactory factory = new ConnectionFactory(2000, 2);

    @Test
    void opensSqliteConnection() throws Exception {
        Path db = SqliteFixture.createShop(tempDir);

        try (DatabaseConnection connection = factory.open(SqliteFixture.params(db))) {
            assertThat(connection.getDialect()).isEqualTo("sqlite");
            assertThat(connection.isClosed()).isFalse();
            assertThat(connection.getDisplayUrl()).startsWith("jdbc:sqlite:");
        }
    }

    @Test
    void unsupportedDatabaseTypeIsAConnectionFailure() {
        ConnectionParams params = ConnectionParams.builder().dbType("cassandra").host("h").database("d").build();

        assertThatThrownBy(() -> factory.open(params))
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("Unsupported database type");
    }

    @Test
    void unreachableDatabaseIsAConnectionFailure() {
        ConnectionParams params = SqliteFixture.params(tempDir.resolve("no/such/dir/shop.db"));

        assertThatThrownBy(() -> factory.open(params))
                .isInstanceOf(ConnectionException.class)
                .hasMessageStartingWith("Failed to connect");
    }

    @Test
    void hikariConfigCarriesPoolSettings() {
        JdbcConnectionInfo info = JdbcConnectionInfo.builder()
                .url("jdbc:postgresql://db:5432/shop")
                .username("app")
                .password("secret")
                .dialect("postgresql")
                .driverClassName("org.postgresql.Driver")
                .build();

        HikariConfig config = factory.buildHikariConfig(info);

        assertThat(config.getMaximumPoolSize()).isEqualTo(2);
        assertThat(config.getConnectionTimeout()).isEqualTo(2000);
        assertThat(config.getExceptionOverrideClassName()).isEqualTo(HikariSqlExceptionOverride.class.getName());
        assertThat(config.getDataSourceProperties()).containsEntry("ApplicationName", "talksql");
        assertThat(config.getPoolName()).startsWith("talksql-postgresql-");
    }
}
