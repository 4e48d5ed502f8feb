package com.talksql.schema;

import java.util.List;
import java.util.Map;

/**
 * Similarity search over per-session table documents.
 */
public interface TableSearchClient {

    /**
     * Rank the tables of a corpus against a question.
     *
     * @param query natural-language question
     * @param k max number of table names to return
     * @param corpusId corpus to search
     * @return table names, best match first
     * @throws IllegalStateException when the corpus does not exist
     */
    List<String> topK(String query, int k, String corpusId);

    /**
     * Replace the documents of a corpus.
     *
     * @param corpusId corpus id
     * @param documents table name to document text
     */
    void index(String corpusId, Map<String, String> documents);

    /**
     * Drop a corpus. Unknown ids are ignored.
     *
     * @param corpusId corpus id
     */
    void drop(String corpusId);
}
