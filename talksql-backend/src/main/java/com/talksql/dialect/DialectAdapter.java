package com.talksql.dialect;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites dialect-agnostic (or wrong-dialect) SQL into the syntax of the target dialect.
 *
 * <p>Rewrites are targeted textual transforms, not a parse: each rule is a no-op when its pattern is absent
 * and runs at most once per call. PostgreSQL is the lingua franca and is never rewritten.
 * A trailing semicolon is set aside before the rules run and restored afterwards. Only the outermost,
 * trailing {@code LIMIT} is moved into {@code TOP} or a {@code ROWNUM} filter; a {@code LIMIT} inside a
 * subquery is left where it is.
 */
public final class DialectAdapter {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Pattern OFFSET_ROWS = Pattern.compile("\\bOFFSET\\s+(\\d+)\\s+ROWS?\\b", FLAGS);
    private static final Pattern TRAILING_LIMIT = Pattern.compile("\\s*\\bLIMIT\\s+(\\d+)\\s*$", FLAGS);
    private static final Pattern LEADING_SELECT = Pattern.compile("^\\s*SELECT\\s+(DISTINCT\\s+)?", FLAGS);
    private static final Pattern SELECT_TOP = Pattern.compile("^(\\s*SELECT\\s+(?:DISTINCT\\s+)?)TOP\\s+(\\d+)\\s+", FLAGS);
    private static final Pattern HAS_TOP = Pattern.compile("^\\s*SELECT\\s+(?:DISTINCT\\s+)?TOP\\b", FLAGS);

    private static final Pattern ISNULL_2 = twoArgFunction("ISNULL");
    private static final Pattern CONCAT_2 = twoArgFunction("CONCAT");
    private static final Pattern REGEXP_LIKE_2 = twoArgFunction("REGEXP_LIKE");

    private static final String CONCAT_OPERAND = "(?:'(?:[^']|'')*'|[\\w.]+(?:\\([^()]*\\))?)";
    private static final Pattern CONCAT_OPERAND_PATTERN = Pattern.compile(CONCAT_OPERAND);
    private static final Pattern CONCAT_CHAIN = Pattern.compile(
            CONCAT_OPERAND + "(?:\\s*\\|\\|\\s*" + CONCAT_OPERAND + ")+");

    private static final Pattern TRAILING_SEMICOLON = Pattern.compile(";\\s*$");

    private static final Map<String, List<UnaryOperator<String>>> RULES = Map.of(
            DialectCatalog.MYSQL, List.of(
                    DialectAdapter::dropRowsAfterOffset,
                    DialectAdapter::concatOperatorToFunction,
                    sql -> replaceTwoArg(sql, REGEXP_LIKE_2, "%s REGEXP %s")),
            DialectCatalog.SQLITE, List.of(
                    DialectAdapter::dropRowsAfterOffset,
                    sql -> replaceTwoArg(sql, ISNULL_2, "IFNULL(%s, %s)"),
                    DialectAdapter::topToLimit),
            DialectCatalog.MSSQL, List.of(
                    DialectAdapter::limitToTop,
                    sql -> replaceTwoArg(sql, CONCAT_2, "%s + %s"),
                    sql -> replaceTwoArg(sql, REGEXP_LIKE_2, "%s LIKE %s")),
            DialectCatalog.ORACLE, List.of(
                    DialectAdapter::limitToRownum,
                    sql -> replaceTwoArg(sql, ISNULL_2, "NVL(%s, %s)"))
    );

    private DialectAdapter() {
    }

    /**
     * Adapt a SQL string to the target dialect.
     *
     * @param sql SQL text, may be null
     * @param dialect target dialect name (any alias accepted)
     * @return rewritten SQL; the input unchanged for postgresql and unknown dialects
     */
    public static String adapt(String sql, String dialect) {
        if (sql == null || sql.isBlank()) {
            return sql;
        }
        List<UnaryOperator<String>> rules = RULES.get(DialectCatalog.rewriteFamily(dialect));
        if (rules == null) {
            return sql;
        }

        boolean terminated = TRAILING_SEMICOLON.matcher(sql).find();
        String body = terminated ? TRAILING_SEMICOLON.matcher(sql).replaceFirst("") : sql;
        for (UnaryOperator<String> rule : rules) {
            body = rule.apply(body);
        }
        return terminated ? body + ";" : body;
    }

    private static Pattern twoArgFunction(String name) {
        return Pattern.compile("\\b" + name + "\\s*\\(\\s*([^,()]+?)\\s*,\\s*([^,()]+?)\\s*\\)", FLAGS);
    }

    private static String replaceTwoArg(String sql, Pattern pattern, String format) {
        Matcher m = pattern.matcher(sql);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String replacement = String.format(format, m.group(1), m.group(2));
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String dropRowsAfterOffset(String sql) {
        return OFFSET_ROWS.matcher(sql).replaceAll("OFFSET $1");
    }

    private static String concatOperatorToFunction(String sql) {
        Matcher chain = CONCAT_CHAIN.matcher(sql);
        StringBuilder sb = new StringBuilder();
        while (chain.find()) {
            Matcher operand = CONCAT_OPERAND_PATTERN.matcher(chain.group());
            StringBuilder args = new StringBuilder();
            while (operand.find()) {
                if (args.length() > 0) {
                    args.append(", ");
                }
                args.append(operand.group());
            }
            chain.appendReplacement(sb, Matcher.quoteReplacement("CONCAT(" + args + ")"));
        }
        chain.appendTail(sb);
        return sb.toString();
    }

    private static String topToLimit(String sql) {
        Matcher m = SELECT_TOP.matcher(sql);
        if (!m.find()) {
            return sql;
        }
        String n = m.group(2);
        String withoutTop = (m.group(1) + sql.substring(m.end())).trim();
        if (TRAILING_LIMIT.matcher(withoutTop).find()) {
            return withoutTop;
        }
        return withoutTop + " LIMIT " + n;
    }

    private static String limitToTop(String sql) {
        Matcher limit = TRAILING_LIMIT.matcher(sql);
        if (!limit.find()) {
            return sql;
        }
        String n = limit.group(1);
        String withoutLimit = sql.substring(0, limit.start()).trim();
        if (HAS_TOP.matcher(withoutLimit).find()) {
            return withoutLimit;
        }
        Matcher select = LEADING_SELECT.matcher(withoutLimit);
        if (!select.find()) {
            return withoutLimit;
        }
        return withoutLimit.substring(0, select.end()) + "TOP " + n + " " + withoutLimit.substring(select.end());
    }

    private static String limitToRownum(String sql) {
        Matcher limit = TRAILING_LIMIT.matcher(sql);
        if (!limit.find()) {
            return sql;
        }
        String n = limit.group(1);
        String inner = sql.substring(0, limit.start()).trim();
        return "SELECT * FROM (" + inner + ") WHERE ROWNUM <= " + n;
    }
}
