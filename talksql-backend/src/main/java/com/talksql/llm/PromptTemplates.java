package com.talksql.llm;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prompt texts sent to the completion model. Placeholders are written as {@code {name}}.
 */
public final class PromptTemplates {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_0-9]+)}");

    public static final String QUERY_GENERATION =
            "You are an expert SQL query generator. Your task is to convert a natural language question into a correct SQL query\n"
                    + "based on the provided database schema and dialect.\n\n"
                    + "**Database Dialect:** {dialect}\n\n"
                    + "**Schema Information:**\n{schema}\n\n"
                    + "**Dialect-Specific Features:**\n{dialect_features}\n\n"
                    + "**Examples:**\n"
                    + "1. Question: {example_question_1}\nSQL Query:\n```sql\n{example_query_1}\n```\n\n"
                    + "2. Question: {example_question_2}\nSQL Query:\n```sql\n{example_query_2}\n```\n\n"
                    + "3. Question: {example_question_3}\nSQL Query:\n```sql\n{example_query_3}\n```\n\n"
                    + "**User Question:** {question}\n\n"
                    + "**Task:**\n"
                    + "Generate a SQL query that accurately answers the user's question. Follow these guidelines:\n"
                    + "1. Use only the tables and columns defined in the schema.\n"
                    + "2. Apply appropriate joins based on foreign key relationships in the schema.\n"
                    + "3. Use correct SQL syntax and functions supported by {dialect}.\n"
                    + "4. Include necessary filtering, grouping, sorting, or aggregations to match the question's intent.\n"
                    + "5. For unbounded queries (no filter, grouping or window function), add `LIMIT 10` to restrict output.\n"
                    + "6. Avoid tables, columns, or functions not present in the schema or dialect.\n"
                    + "7. Provide a brief step-by-step explanation of your reasoning before the query.\n\n"
                    + "**Output Format:**\n"
                    + "- Explanation: [Your step-by-step reasoning here]\n"
                    + "- SQL Query:\n```sql\n[Your SQL query here]\n```\n";

    public static final String QUERY_FIXER =
            "You are an expert SQL query fixer. Analyze a failed SQL query, identify why it failed based on the schema,\n"
                    + "question, previous query and error, and generate a corrected SQL query that answers the question.\n\n"
                    + "**Database Dialect:** {dialect}\n\n"
                    + "**Schema Information:**\n{schema}\n\n"
                    + "**Dialect-Specific Features:**\n{dialect_features}\n\n"
                    + "**User Question:**\n{question}\n\n"
                    + "**Previous Query:**\n```sql\n{previous_query}\n```\n\n"
                    + "**Error Message:**\n{error}\n\n"
                    + "**Task:**\n"
                    + "1. Analyze the previous query and error to identify the cause of the failure.\n"
                    + "2. Generate a corrected SQL query that accurately answers the user's question.\n"
                    + "3. Use only the tables and columns defined in the schema, with syntax and functions supported by {dialect}.\n"
                    + "4. For unbounded queries (no filter, grouping or window function), add `LIMIT 10` to restrict output.\n"
                    + "5. Explain why the previous query failed and how the corrected query addresses it.\n\n"
                    + "**Output Format:**\n"
                    + "- Explanation: [Why the query failed and how it is fixed]\n"
                    + "- Corrected SQL Query:\n```sql\n[Your corrected SQL query here]\n```\n";

    public static final String QUERY_VALIDATION =
            "You are an expert SQL validator. Your task is to check a SQL query for errors and suggest corrections if needed.\n\n"
                    + "Database Dialect: {dialect}\n\n"
                    + "Schema Information:\n{schema}\n\n"
                    + "SQL Query to Validate:\n{query}\n\n"
                    + "Please analyze this query and check for the following issues:\n"
                    + "1. Syntax errors\n"
                    + "2. Missing or incorrect table or column names\n"
                    + "3. Incorrect join conditions\n"
                    + "4. Incorrect use of functions\n"
                    + "5. Incorrect use of operators\n"
                    + "6. Incorrect use of GROUP BY, ORDER BY, or HAVING clauses\n"
                    + "7. Potential SQL injection vulnerabilities\n"
                    + "8. Any other issues that would prevent the query from executing correctly\n\n"
                    + "For each issue found, explain the problem and suggest a correction in a ```sql block.\n"
                    + "If the query is valid, state that it appears to be correct.\n\n"
                    + "Validation Result:\n";

    public static final String FINAL_ANSWER =
            "You are an expert in generating React ECharts JSON data and natural language responses based on user inputs\n"
                    + "and database query results.\n\n"
                    + "**User Input**: {user_input}\n\n"
                    + "**Database Response**: {response}\n\n"
                    + "**Query**: {query}\n\n"
                    + "### Chart Type Requirements\n"
                    + "| Chart Type | Required Configuration | Data Format |\n"
                    + "|------------|------------------------|-------------|\n"
                    + "| Line | xAxis (type: \"category\"), series (type: \"line\", data) | Array of values for series.data, labels for xAxis.data |\n"
                    + "| Bar | xAxis (type: \"category\"), series (type: \"bar\", data) | Array of values for series.data, labels for xAxis.data |\n"
                    + "| Pie | series (type: \"pie\", data) | Array of {name: string, value: number} objects |\n"
                    + "| Doughnut | series (type: \"pie\", data, radius: [\"40%\", \"70%\"]) | Array of {name: string, value: number} objects |\n"
                    + "| Scatter | xAxis (type: \"value\"), yAxis (type: \"value\"), series (type: \"scatter\", data) | Array of [x, y] coordinates |\n"
                    + "| Funnel | series (type: \"funnel\", data, sort: \"descending\") | Array of {name: string, value: number} objects |\n"
                    + "| Gauge | series (type: \"gauge\", data) | Array of {value: number, name: string} objects |\n\n"
                    + "## Instructions\n"
                    + "1. Determine the chart type from the user input, or infer the best fit from the database response.\n"
                    + "2. If the data is empty or malformed, return only an nl_response explaining the issue.\n"
                    + "3. Generate chart_data when visualization is appropriate (several data points, categorical or numerical data).\n"
                    + "4. Generate nl_response when the response is a single value, the user asks for a summary, or a chart adds nothing.\n"
                    + "5. Both may be provided when they complement each other.\n"
                    + "6. Add tooltip {trigger: \"item\"} for pie charts and {trigger: \"axis\"} for line and bar charts, and grid {containLabel: true}.\n"
                    + "7. Summarize the database response in one or two sentences addressing the user input.\n\n"
                    + "## Response Format\n"
                    + "Return only a JSON object:\n"
                    + "```json\n"
                    + "{\n"
                    + "  \"chart_data\": null | {<ECharts JSON object>},\n"
                    + "  \"nl_response\": null | \"<Natural language summary>\",\n"
                    + "  \"only_chart\": true | false\n"
                    + "}\n"
                    + "```\n"
                    + "At least one of chart_data or nl_response must be non-null.\n";

    private PromptTemplates() {
    }

    /**
     * Substitute {@code {name}} placeholders. Placeholders without a value are left as they are.
     *
     * @param template prompt template
     * @param context placeholder values
     * @return rendered prompt
     */
    public static String render(String template, Map<String, Object> context) {
        if (template == null) {
            return "";
        }
        if (context == null || context.isEmpty()) {
            return template;
        }
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String key = m.group(1);
            String replacement = context.containsKey(key) ? String.valueOf(context.get(key)) : m.group(0);
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
