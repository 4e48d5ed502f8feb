package com.talksql.agent;

import com.talksql.llm.CompletionClient;
import com.talksql.llm.CompletionException;
import com.talksql.llm.PromptTemplates;
import com.talksql.llm.SqlExtractor;
import com.talksql.model.SchemaSnapshot;
import com.talksql.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Advisory SQL checks: structure, common mistakes, table existence and the completion model's opinion.
 *
 * <p>All checks run; none stops the others. The result never fails a run on its own.
 */
@Slf4j
@Component
public class QueryValidator {
    static final String MISSING_FROM = "SELECT statement is missing FROM clause.";
    static final String MISSING_SEMICOLON = "Query is missing a semicolon at the end.";
    static final String LIMIT_WITHOUT_ORDER = "LIMIT is used without ORDER BY, which may lead to inconsistent results.";
    static final String GROUP_BY_WITHOUT_AGGREGATE = "GROUP BY is used without any aggregation functions.";
    static final String INJECTION = "Potential SQL injection vulnerability detected.";
    static final String NULL_COMPARISON = "Incorrect NULL comparison. Use IS NULL or IS NOT NULL instead of = NULL.";

    private static final Pattern LINE_COMMENT = Pattern.compile("--.*$", Pattern.MULTILINE);
    private static final Pattern STARTS_WITH_SELECT = Pattern.compile("^\\s*SELECT\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern FROM_KEYWORD = Pattern.compile("\\bFROM\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIMIT = Pattern.compile("LIMIT\\s+\\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern ORDER_BY = Pattern.compile("ORDER\\s+BY", Pattern.CASE_INSENSITIVE);
    private static final Pattern GROUP_BY = Pattern.compile("GROUP\\s+BY", Pattern.CASE_INSENSITIVE);
    private static final Pattern AGGREGATE = Pattern.compile("\\b(COUNT|SUM|AVG|MIN|MAX)\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern INJECTION_OR = Pattern.compile("'.*\\s+OR\\s+.*'", Pattern.CASE_INSENSITIVE);
    private static final Pattern INJECTION_AND = Pattern.compile("'.*\\s+AND\\s+.*'", Pattern.CASE_INSENSITIVE);
    private static final Pattern EQUALS_NULL = Pattern.compile("=\\s*NULL|NULL\\s*=", Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_REFERENCE = Pattern.compile(
            "\\b(?:from|join)\\s+([a-zA-Z0-9_]+(?:\\.[a-zA-Z0-9_]+)*)", Pattern.CASE_INSENSITIVE);
    // FROM inside EXTRACT(...) and similar calls is not a table reference
    private static final Pattern FUNCTION_FROM_PREFIX = Pattern.compile(
            "\\b(?:EXTRACT|SUBSTRING|TRIM)\\s*\\([^()]*$", Pattern.CASE_INSENSITIVE);

    private static final List<String> AFFIRMATIONS = List.of("appears to be correct", "is valid", "query is correct");
    private static final List<String> NEGATIONS = List.of("not valid", "invalid");

    private final CompletionClient completionClient;

    public QueryValidator(CompletionClient completionClient) {
        this.completionClient = completionClient;
    }

    /**
     * Validate a query.
     *
     * @param sql query text
     * @param snapshot schema snapshot the query was generated against
     * @param dialect normalized dialect
     * @return validation result
     */
    public ValidationResult validate(String sql, SchemaSnapshot snapshot, String dialect) {
        List<String> issues = new ArrayList<>();
        String structural = checkStructure(sql);
        if (structural != null) {
            issues.add(structural);
        }
        issues.addAll(checkCommonMistakes(sql));
        issues.addAll(checkTables(sql, snapshot));

        String opinion = askOpinion(sql, snapshot, dialect);
        boolean affirmed = affirms(opinion);
        boolean valid = issues.isEmpty() && affirmed;

        String corrected = valid ? null : SqlExtractor.extractCorrection(opinion);
        if (!valid) {
            log.info("Validation found {} issue(s), opinion_affirms={}, correction_found={}",
                    issues.size(), affirmed, corrected != null);
        }
        return new ValidationResult(valid, List.copyOf(issues), corrected, opinion);
    }

    static String checkStructure(String sql) {
        String stripped = LINE_COMMENT.matcher(sql == null ? "" : sql).replaceAll("");
        if (STARTS_WITH_SELECT.matcher(stripped).find() && !FROM_KEYWORD.matcher(stripped).find()) {
            return MISSING_FROM;
        }
        return null;
    }

    static List<String> checkCommonMistakes(String sql) {
        List<String> issues = new ArrayList<>();
        String q = sql == null ? "" : sql;
        if (!q.trim().endsWith(";")) {
            issues.add(MISSING_SEMICOLON);
        }
        if (LIMIT.matcher(q).find() && !ORDER_BY.matcher(q).find()) {
            issues.add(LIMIT_WITHOUT_ORDER);
        }
        if (GROUP_BY.matcher(q).find() && !AGGREGATE.matcher(q).find()) {
            issues.add(GROUP_BY_WITHOUT_AGGREGATE);
        }
        if (INJECTION_OR.matcher(q).find() || INJECTION_AND.matcher(q).find()) {
            issues.add(INJECTION);
        }
        if (EQUALS_NULL.matcher(q).find()) {
            issues.add(NULL_COMPARISON);
        }
        return issues;
    }

    static List<String> checkTables(String sql, SchemaSnapshot snapshot) {
        Set<String> known = knownTables(snapshot);
        if (known.isEmpty()) {
            return List.of();
        }
        Set<String> missing = new LinkedHashSet<>();
        String q = sql == null ? "" : sql;
        Matcher m = TABLE_REFERENCE.matcher(q);
        while (m.find()) {
            if (FUNCTION_FROM_PREFIX.matcher(q.substring(0, m.start())).find()) {
                continue;
            }
            String table = lastSegment(m.group(1)).toLowerCase(Locale.ROOT);
            if (!known.contains(table)) {
                missing.add(table);
            }
        }
        List<String> issues = new ArrayList<>();
        for (String table : missing) {
            issues.add("Table '" + table + "' is not found in the schema.");
        }
        return issues;
    }

    private static String lastSegment(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        return dot < 0 ? qualifiedName : qualifiedName.substring(dot + 1);
    }

    private static Set<String> knownTables(SchemaSnapshot snapshot) {
        Set<String> known = new LinkedHashSet<>();
        if (snapshot == null) {
            return known;
        }
        if (snapshot.allTables() != null) {
            snapshot.allTables().forEach(t -> known.add(t.toLowerCase(Locale.ROOT)));
        }
        if (known.isEmpty() && snapshot.formattedSchema() != null) {
            for (String line : snapshot.formattedSchema().split("\n")) {
                if (line.startsWith("-- Table:")) {
                    known.add(line.substring("-- Table:".length()).trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return known;
    }

    static boolean affirms(String opinion) {
        if (opinion == null || opinion.isBlank()) {
            return false;
        }
        String text = opinion.toLowerCase(Locale.ROOT);
        for (String negation : NEGATIONS) {
            if (text.contains(negation)) {
                return false;
            }
        }
        for (String affirmation : AFFIRMATIONS) {
            if (text.contains(affirmation)) {
                return true;
            }
        }
        return false;
    }

    private String askOpinion(String sql, SchemaSnapshot snapshot, String dialect) {
        Map<String, Object> context = new HashMap<>();
        context.put("dialect", dialect);
        context.put("schema", snapshot != null ? snapshot.formattedSchema() : "");
        context.put("query", sql);
        try {
            return completionClient.complete(PromptTemplates.QUERY_VALIDATION, context);
        } catch (CompletionException e) {
            log.warn("Validation opinion unavailable: {}", e.getMessage());
            return null;
        }
    }
}
