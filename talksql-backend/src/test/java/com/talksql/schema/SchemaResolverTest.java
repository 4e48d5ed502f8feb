package com.talksql.schema;

import com.talksql.model.SchemaSnapshot;
import com.talksql.service.ConnectionFactory;
import com.talksql.service.DatabaseConnection;
import com.talksql.support.SqliteFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SchemaResolverTest {

    private static final List<String> ALL = List.of("customers", "orders", "products");

    @TempDir
    Path tempDir;

    private DatabaseConnection connection;

    @BeforeEach
    void setUp() throws Exception {
        Path db = SqliteFixture.createShop(tempDir);
        connection = new ConnectionFactory(5000, 2).open(SqliteFixture.params(db));
    }

    @AfterEach
    void tearDown() {
        connection.close();
    }

    @Test
    void relevantTablesKeepSearchOrderAndDropUnknownNames() {
        TableSearchClient search = mock(TableSearchClient.class);
        when(search.topK(anyString(), anyInt(), anyString()))
                .thenReturn(Arrays.asList("ORDERS", "ghost", "orders", null, "customers"));
        SchemaResolver resolver = new SchemaResolver(new SchemaIntrospector(), search, 3);

        assertThat(resolver.relevantTables("q", ALL, 5, "schema_s1")).containsExactly("orders", "customers");
    }

    @Test
    void relevantTablesFallBackToAllTables() {
        TableSearchClient search = mock(TableSearchClient.class);
        SchemaResolver resolver = new SchemaResolver(new SchemaIntrospector(), search, 3);

        when(search.topK(anyString(), anyInt(), anyString())).thenReturn(List.of());
        assertThat(resolver.relevantTables("q", ALL, 5, "schema_s1")).isEqualTo(ALL);

        when(search.topK(anyString(), anyInt(), anyString())).thenThrow(new IllegalStateException("no corpus"));
        assertThat(resolver.relevantTables("q", ALL, 5, "schema_s1")).isEqualTo(ALL);
    }

    @Test
    void resolveUsesTheSessionIndex() {
        SchemaResolver resolver = new SchemaResolver(new SchemaIntrospector(), new SchemaIndexService(), 3);
        String corpus = SchemaResolver.corpusIdFor("s1");
        assertThat(resolver.indexSchema(connection, corpus)).isTrue();

        SchemaSnapshot snapshot = resolver.resolve("How many orders per customer?", connection, corpus, 5);

        assertThat(snapshot.dialect()).isEqualTo("sqlite");
        assertThat(snapshot.allTables()).containsExactlyInAnyOrder("customers", "orders", "products");
        assertThat(snapshot.relevantTables()).containsExactlyInAnyOrder("orders", "customers");
        assertThat(snapshot.perTableInfo()).containsOnlyKeys("orders", "customers");
        assertThat(snapshot.formattedSchema())
                .contains("-- Table: orders\nCREATE TABLE orders (")
                .contains("-- Sample rows from customers table:\n-- Row 1: {id=1, name=Alice, city=Paris}\n")
                .doesNotContain("-- Row 4:")
                .doesNotContain("products");
    }

    @Test
    void resolveWithoutIndexUsesEveryTable() {
        SchemaResolver resolver = new SchemaResolver(new SchemaIntrospector(), new SchemaIndexService(), 0);

        SchemaSnapshot snapshot = resolver.resolve("anything", connection, "schema_missing", 5);

        assertThat(snapshot.relevantTables()).containsExactlyInAnyOrderElementsOf(snapshot.allTables());
        assertThat(snapshot.formattedSchema()).contains("-- Table: products").doesNotContain("-- Sample rows");
    }

    @Test
    void closedConnectionFailsResolution() {
        SchemaResolver resolver = new SchemaResolver(new SchemaIntrospector(), new SchemaIndexService(), 3);
        connection.close();

        assertThatThrownBy(() -> resolver.resolve("q", connection, "schema_s1", 5))
                .isInstanceOf(SchemaResolutionException.class);
        assertThat(resolver.indexSchema(connection, "schema_s1")).isFalse();
    }
}
