package com.talksql.agent;

import com.talksql.dialect.DialectCatalog;
import com.talksql.llm.CompletionClient;
import com.talksql.llm.CompletionException;
import com.talksql.llm.PromptTemplates;
import com.talksql.llm.SqlExtractor;
import com.talksql.model.GeneratedQuery;
import com.talksql.model.SchemaSnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a question plus schema snapshot into SQL through the completion model.
 */
@Component
public class QueryGenerator {
    private static final String TABLE_HEADER = "-- Table:";

    private final CompletionClient completionClient;

    public QueryGenerator(CompletionClient completionClient) {
        this.completionClient = completionClient;
    }

    /**
     * Generate SQL for a question.
     *
     * @param question question text
     * @param snapshot schema snapshot
     * @return generated query
     * @throws GenerationException when the model fails or returns nothing
     */
    public GeneratedQuery generate(String question, SchemaSnapshot snapshot) {
        Map<String, Object> context = baseContext(question, snapshot);
        context.putAll(exampleQueries(snapshot.formattedSchema()));
        return complete(PromptTemplates.QUERY_GENERATION, context);
    }

    /**
     * Generate a replacement for a query that failed to execute.
     *
     * @param question question text
     * @param snapshot schema snapshot
     * @param previousSql query that failed
     * @param error database error message
     * @return generated query
     * @throws GenerationException when the model fails or returns nothing
     */
    public GeneratedQuery fix(String question, SchemaSnapshot snapshot, String previousSql, String error) {
        Map<String, Object> context = baseContext(question, snapshot);
        context.put("previous_query", previousSql != null ? previousSql : "");
        context.put("error", error != null ? error : "");
        return complete(PromptTemplates.QUERY_FIXER, context);
    }

    private GeneratedQuery complete(String template, Map<String, Object> context) {
        String reply;
        try {
            reply = completionClient.complete(template, context);
        } catch (CompletionException e) {
            throw new GenerationException("Query generation failed: " + e.getMessage(), e);
        }
        if (reply == null || reply.isBlank()) {
            throw new GenerationException("Query generation returned an empty response");
        }
        String sql = SqlExtractor.extractSql(reply).trim();
        if (sql.isEmpty()) {
            throw new GenerationException("No SQL found in the generation response");
        }
        return new GeneratedQuery(sql, SqlExtractor.explanation(reply, sql), reply);
    }

    private Map<String, Object> baseContext(String question, SchemaSnapshot snapshot) {
        Map<String, Object> context = new HashMap<>();
        context.put("dialect", snapshot.dialect());
        context.put("schema", snapshot.formattedSchema());
        context.put("dialect_features", DialectCatalog.featureSet(snapshot.dialect()).describe());
        context.put("question", question);
        return context;
    }

    /**
     * Few-shot examples built from the table names of a formatted schema.
     *
     * @param formattedSchema schema text with {@code -- Table:} headers
     * @return example_question_N / example_query_N values
     */
    static Map<String, Object> exampleQueries(String formattedSchema) {
        List<String> tables = new ArrayList<>();
        if (formattedSchema != null) {
            for (String line : formattedSchema.split("\n")) {
                if (line.startsWith(TABLE_HEADER)) {
                    tables.add(line.substring(TABLE_HEADER.length()).trim());
                }
            }
        }

        Map<String, Object> examples = new HashMap<>();
        if (tables.isEmpty()) {
            examples.put("example_question_1", "Show me the top 5 customers by total order amount");
            examples.put("example_query_1", "SELECT c.customer_name, SUM(o.total_amount) as total_spent\nFROM customers c\n"
                    + "JOIN orders o ON c.customer_id = o.customer_id\nGROUP BY c.customer_name\nORDER BY total_spent DESC\nLIMIT 5");
            examples.put("example_question_2", "How many orders were placed in each month of 2023?");
            examples.put("example_query_2", "SELECT EXTRACT(MONTH FROM order_date) as month, COUNT(*) as order_count\nFROM orders\n"
                    + "WHERE EXTRACT(YEAR FROM order_date) = 2023\nGROUP BY EXTRACT(MONTH FROM order_date)\nORDER BY month");
            examples.put("example_question_3", "Find all products that have never been ordered");
            examples.put("example_query_3", "SELECT p.product_name\nFROM products p\n"
                    + "LEFT JOIN order_items oi ON p.product_id = oi.product_id\nWHERE oi.order_id IS NULL");
            return examples;
        }

        String first = tables.get(0);
        examples.put("example_question_1", "Show me all records from the " + first + " table");
        examples.put("example_query_1", "SELECT *\nFROM " + first + "\nLIMIT 10");

        if (tables.size() >= 2) {
            examples.put("example_question_2", "Count the number of records in the " + tables.get(1) + " table");
            examples.put("example_query_2", "SELECT COUNT(*) as record_count\nFROM " + tables.get(1));
        } else {
            examples.put("example_question_2", "Count the number of records in the orders table");
            examples.put("example_query_2", "SELECT COUNT(*) as record_count\nFROM orders");
        }

        if (tables.size() >= 3) {
            String third = tables.get(2);
            examples.put("example_question_3", "Show me the relationship between " + first + " and " + third);
            examples.put("example_query_3", "SELECT a.*, b.*\nFROM " + first + " a\nJOIN " + third + " b ON a.id = b."
                    + first + "_id\nLIMIT 5");
        } else {
            examples.put("example_question_3", "Show me the relationship between customers and orders");
            examples.put("example_query_3", "SELECT c.*, o.*\nFROM customers c\nJOIN orders o ON c.customer_id = o.customer_id\nLIMIT 5");
        }
        return examples;
    }
}
