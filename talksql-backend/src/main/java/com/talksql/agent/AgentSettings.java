package com.talksql.agent;

import org.springframework.core.env.Environment;

/**
 * Tunables of one question-answering run.
 *
 * @param maxRetries execution failures that may be fed back to generation
 * @param topK max relevant tables per question
 * @param rowLimit max rows returned by a query
 * @param queryTimeoutSeconds statement timeout
 */
public record AgentSettings(int maxRetries, int topK, int rowLimit, int queryTimeoutSeconds) {

    public static final int DEFAULT_MAX_RETRIES = 3;

    public static AgentSettings defaults() {
        return new AgentSettings(DEFAULT_MAX_RETRIES, 5, 500, 30);
    }

    /**
     * Read settings from {@code talksql.agent.*}, falling back to the defaults.
     *
     * @param environment Spring environment
     * @return settings
     */
    public static AgentSettings fromEnvironment(Environment environment) {
        AgentSettings d = defaults();
        return new AgentSettings(
                Math.max(0, environment.getProperty("talksql.agent.max-retries", Integer.class, d.maxRetries())),
                Math.max(1, environment.getProperty("talksql.agent.top-k", Integer.class, d.topK())),
                environment.getProperty("talksql.agent.row-limit", Integer.class, d.rowLimit()),
                environment.getProperty("talksql.agent.query-timeout-seconds", Integer.class, d.queryTimeoutSeconds())
        );
    }

    /**
     * Upper bound on state transitions per run: the forward path plus one generate/validate/execute
     * cycle per attempt.
     *
     * @return max steps
     */
    public int maxSteps() {
        return 6 + 3 * (maxRetries + 1);
    }
}
