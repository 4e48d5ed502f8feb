package com.talksql.model;

import java.util.List;
import java.util.Optional;

/**
 * Advisory outcome of query validation. Never fatal on its own.
 *
 * @param valid true when no local issue was found and the external opinion affirmed the query
 * @param issues structural, heuristic and schema findings
 * @param correctedSql correction extracted from the external opinion, null when none
 * @param opinion raw external opinion text, may be null
 */
public record ValidationResult(boolean valid, List<String> issues, String correctedSql, String opinion) {

    public Optional<String> correction() {
        if (correctedSql == null || correctedSql.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(correctedSql);
    }
}
