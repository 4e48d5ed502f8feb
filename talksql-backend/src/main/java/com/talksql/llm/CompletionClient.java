package com.talksql.llm;

import java.util.Map;

/**
 * Text completion against a language model.
 */
public interface CompletionClient {

    /**
     * Render a prompt template with its variables and return the model's reply.
     *
     * @param prompt template with {@code {name}} placeholders
     * @param context placeholder values
     * @return model reply text
     * @throws CompletionException on transport, configuration or model errors
     */
    String complete(String prompt, Map<String, Object> context);
}
