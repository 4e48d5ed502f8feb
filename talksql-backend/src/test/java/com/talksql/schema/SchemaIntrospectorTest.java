package com.talksql.schema;

import com.talksql.model.ColumnInfo;
import com.talksql.model.ForeignKeyInfo;
import com.talksql.model.TableSchema;
import com.talksql.support.SqliteFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaIntrospectorTest {

    @TempDir
    Path tempDir;

    private final SchemaIntrospector introspector = new SchemaIntrospector();
    private Connection conn;

    @BeforeEach
    void setUp() throws Exception {
        Path db = SqliteFixture.createShop(tempDir);
        conn = DriverManager.getConnection("jdbc:sqlite:" + db);
    }

    @AfterEach
    void tearDown() throws Exception {
        conn.close();
    }

    @Test
    void listsUserTables() throws Exception {
        assertThat(introspector.listTables(conn, "sqlite"))
                .containsExactlyInAnyOrder("customers", "orders", "products");
    }

    @Test
    void describesColumnsKeysAndIndexes() throws Exception {
        TableSchema orders = introspector.describe(conn, "sqlite", "orders");

        assertThat(orders.getColumns()).extracting(ColumnInfo::name)
                .containsExactly("id", "customer_id", "total", "status");
        assertThat(orders.getPrimaryKeys()).containsExactly("id");

        ColumnInfo customerId = orders.getColumns().get(1);
        assertThat(customerId.nullable()).isFalse();
        assertThat(customerId.type()).isEqualTo("INTEGER");
        assertThat(orders.getColumns().get(3).defaultValue()).isEqualTo("'new'");

        assertThat(orders.getForeignKeys()).hasSize(1);
        ForeignKeyInfo fk = orders.getForeignKeys().get(0);
        assertThat(fk.constrainedColumns()).containsExactly("customer_id");
        assertThat(fk.referredTable()).isEqualTo("customers");
        assertThat(fk.referredColumns()).containsExactly("id");

        assertThat(orders.getIndexes()).anySatisfy(idx -> {
            assertThat(idx.name()).isEqualTo("idx_orders_status");
            assertThat(idx.columns()).containsExactly("status");
        });
    }

    @Test
    void samplesRowsUpToLimit() throws Exception {
        List<Map<String, Object>> rows = introspector.sampleRows(conn, "customers", 2);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).containsEntry("name", "Alice");
        assertThat(introspector.sampleRows(conn, "customers", 0)).isEmpty();
    }

    @Test
    void rendersCreateStatement() {
        TableSchema table = TableSchema.builder()
                .name("orders")
                .columns(List.of(
                        new ColumnInfo("id", "INTEGER", false, null, true),
                        new ColumnInfo("customer_id", "INTEGER", true, null, false),
                        new ColumnInfo("status", "VARCHAR(20)", true, " 'new' ", false)))
                .primaryKeys(List.of("id"))
                .foreignKeys(List.of(new ForeignKeyInfo(List.of("customer_id"), "customers", List.of("id"))))
                .indexes(List.of())
                .build();

        assertThat(SchemaIntrospector.createStatement(table)).isEqualTo(
                "CREATE TABLE orders (\n"
                        + "\tid INTEGER NOT NULL, \n"
                        + "\tcustomer_id INTEGER, \n"
                        + "\tstatus VARCHAR(20) DEFAULT 'new', \n"
                        + "\tPRIMARY KEY (id), \n"
                        + "\tFOREIGN KEY(customer_id) REFERENCES customers (id)\n"
                        + ")");
    }
}
