package com.talksql.agent;

import com.talksql.model.AgentError;

/**
 * Raised at the HTTP boundary when a run ended in an error instead of an answer.
 */
public class QueryFailedException extends RuntimeException {
    private final AgentError error;

    public QueryFailedException(AgentError error) {
        super(error.message());
        this.error = error;
    }

    public AgentError getError() {
        return error;
    }
}
