package com.talksql.dialect;

import java.util.List;

/**
 * Static capabilities of a SQL dialect, used to brief the generation model on what syntax is safe to emit.
 *
 * @param name normalized dialect name
 * @param supportsWindowFunctions window functions (OVER ...) are available
 * @param supportsCTEs WITH clauses are available
 * @param supportsJSON JSON operators/functions are available
 * @param supportsArrays array types are available
 * @param dateFunctions notable date functions
 * @param stringFunctions notable string functions
 * @param aggregateFunctions notable aggregate functions
 */
public record DialectFeatures(
        String name,
        boolean supportsWindowFunctions,
        boolean supportsCTEs,
        boolean supportsJSON,
        boolean supportsArrays,
        List<String> dateFunctions,
        List<String> stringFunctions,
        List<String> aggregateFunctions
) {

    /**
     * Render the feature set as the prompt fragment handed to the generation model.
     *
     * @return multi-line description
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Dialect: ").append(name).append("\n");
        sb.append("Supported Features:\n");
        sb.append("- Window Functions: ").append(supportsWindowFunctions).append("\n");
        sb.append("- Common Table Expressions (CTEs): ").append(supportsCTEs).append("\n");
        sb.append("- JSON Support: ").append(supportsJSON).append("\n");
        sb.append("- Array Support: ").append(supportsArrays).append("\n");
        appendList(sb, "Date Functions", dateFunctions);
        appendList(sb, "String Functions", stringFunctions);
        appendList(sb, "Aggregate Functions", aggregateFunctions);
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String label, List<String> values) {
        if (values == null || values.isEmpty()) {
            return;
        }
        sb.append(label).append(": ").append(String.join(", ", values)).append("\n");
    }
}
