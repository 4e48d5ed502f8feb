package com.talksql.llm;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls SQL out of free-form model replies.
 */
public final class SqlExtractor {
    private static final Pattern FENCED_SQL = Pattern.compile("```sql\\s*\\n(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private static final Pattern EMPTY_FENCE = Pattern.compile("```(?:sql)?\\s*```", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> CORRECTION_PATTERNS = List.of(
            Pattern.compile("Corrected query:(.*?)(?:\\n\\n|$)", Pattern.DOTALL | Pattern.CASE_INSENSITIVE),
            Pattern.compile("Suggested correction:(.*?)(?:\\n\\n|$)", Pattern.DOTALL | Pattern.CASE_INSENSITIVE),
            Pattern.compile("Here's the corrected query:(.*?)(?:\\n\\n|$)", Pattern.DOTALL | Pattern.CASE_INSENSITIVE)
    );

    private SqlExtractor() {
    }

    /**
     * Extract the SQL statement from a reply: the first ```sql fenced block, else every line from the
     * first one starting with SELECT, else the whole reply.
     *
     * @param text model reply
     * @return extracted SQL, never null
     */
    public static String extractSql(String text) {
        if (text == null) {
            return "";
        }
        String fenced = firstFencedBlock(text);
        if (fenced != null) {
            return fenced;
        }

        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].trim().toUpperCase(Locale.ROOT).startsWith("SELECT")) {
                return String.join("\n", List.of(lines).subList(i, lines.length));
            }
        }
        return text;
    }

    /**
     * The reply with the extracted SQL removed.
     *
     * @param text model reply
     * @param sql SQL previously extracted from it
     * @return explanation text, trimmed
     */
    public static String explanation(String text, String sql) {
        if (text == null) {
            return "";
        }
        if (sql == null || sql.isEmpty()) {
            return text.trim();
        }
        return EMPTY_FENCE.matcher(text.replace(sql, "")).replaceAll("").trim();
    }

    /**
     * Extract a suggested correction from a validation reply: a ```sql fenced block, then
     * "Corrected query:", "Suggested correction:" or "Here's the corrected query:" followed by text.
     *
     * @param text validation reply
     * @return corrected SQL or null
     */
    public static String extractCorrection(String text) {
        if (text == null) {
            return null;
        }
        String fenced = firstFencedBlock(text);
        if (fenced != null) {
            return fenced.isEmpty() ? null : fenced;
        }
        for (Pattern p : CORRECTION_PATTERNS) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                String candidate = m.group(1).trim();
                if (!candidate.isEmpty()) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private static String firstFencedBlock(String text) {
        Matcher m = FENCED_SQL.matcher(text);
        return m.find() ? m.group(1).trim() : null;
    }
}
