package com.talksql.llm;

import java.util.List;

/**
 * Text embeddings from a language model gateway.
 */
public interface EmbeddingClient {

    /**
     * @return true when embeddings can be requested at all
     */
    boolean isEnabled();

    /**
     * Embed texts in one request.
     *
     * @param texts texts to embed
     * @return one unit-length vector per text, in input order
     * @throws CompletionException on transport, configuration or model errors
     */
    List<float[]> embed(List<String> texts);
}
