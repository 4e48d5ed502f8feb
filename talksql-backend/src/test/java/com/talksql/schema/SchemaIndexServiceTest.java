package com.talksql.schema;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaIndexServiceTest {

    private final SchemaIndexService index = new SchemaIndexService();

    @BeforeEach
    void setUp() {
        Map<String, String> docs = new LinkedHashMap<>();
        docs.put("customers", "CREATE TABLE customers (id INTEGER, name TEXT, city TEXT)");
        docs.put("orders", "CREATE TABLE orders (id INTEGER, customer_id INTEGER, total REAL)");
        docs.put("products", "CREATE TABLE products (sku TEXT, title TEXT, price REAL)");
        index.index("schema_s1", docs);
    }

    @Test
    void ranksTablesByQuestionTerms() {
        assertThat(index.topK("What is the price of each product?", 5, "schema_s1")).containsExactly("products");
        assertThat(index.topK("Which city has the most customers?", 1, "schema_s1")).containsExactly("customers");
    }

    @Test
    void pluralAndSnakeCaseTermsMatch() {
        assertThat(index.topK("order totals per customer", 5, "schema_s1"))
                .startsWith("orders")
                .contains("customers")
                .doesNotContain("products");
    }

    @Test
    void unrelatedQuestionFindsNothing() {
        assertThat(index.topK("weather forecast", 5, "schema_s1")).isEmpty();
    }

    @Test
    void unknownOrDroppedCorpusIsAnError() {
        assertThatThrownBy(() -> index.topK("orders", 5, "schema_other")).isInstanceOf(IllegalStateException.class);

        index.drop("schema_s1");
        index.drop("schema_s1");

        assertThatThrownBy(() -> index.topK("orders", 5, "schema_s1")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void tokenizerSplitsIdentifiers() {
        assertThat(SchemaIndexService.termCounts("Customer_ID, categories"))
                .containsKeys("customer_id", "customer", "id", "category");
    }
}
