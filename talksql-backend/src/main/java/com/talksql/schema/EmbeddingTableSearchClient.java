package com.talksql.schema;

import com.talksql.llm.CompletionException;
import com.talksql.llm.EmbeddingClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table search by meaning: one gateway embedding per table document, ranked by cosine similarity
 * to the embedded question.
 *
 * <p>Every corpus is also kept in the keyword index. It answers when no API key is configured, when
 * the corpus could not be embedded, or when embedding the question fails.
 */
@Slf4j
@Primary
@Service
public class EmbeddingTableSearchClient implements TableSearchClient {
    private final EmbeddingClient embeddingClient;
    private final SchemaIndexService keywordIndex;
    private final Map<String, Map<String, float[]>> corpora = new ConcurrentHashMap<>();

    public EmbeddingTableSearchClient(EmbeddingClient embeddingClient, SchemaIndexService keywordIndex) {
        this.embeddingClient = embeddingClient;
        this.keywordIndex = keywordIndex;
    }

    @Override
    public List<String> topK(String query, int k, String corpusId) {
        Map<String, float[]> vectors = corpora.get(corpusId);
        if (vectors == null) {
            return keywordIndex.topK(query, k, corpusId);
        }
        if (k <= 0 || query == null || query.isBlank()) {
            return List.of();
        }

        float[] queryVector;
        try {
            queryVector = embeddingClient.embed(List.of(query)).get(0);
        } catch (CompletionException e) {
            log.warn("Question embedding failed for {}, using keyword search: {}", corpusId, e.getMessage());
            return keywordIndex.topK(query, k, corpusId);
        }

        List<Map.Entry<String, Double>> scored = new ArrayList<>();
        vectors.forEach((table, vector) -> scored.add(Map.entry(table, dot(queryVector, vector))));
        scored.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));

        List<String> out = new ArrayList<>();
        for (int i = 0; i < scored.size() && i < k; i++) {
            out.add(scored.get(i).getKey());
        }
        return out;
    }

    @Override
    public void index(String corpusId, Map<String, String> documents) {
        keywordIndex.index(corpusId, documents);
        corpora.remove(corpusId);
        if (!embeddingClient.isEnabled() || documents.isEmpty()) {
            return;
        }

        List<String> tables = new ArrayList<>(documents.keySet());
        List<String> texts = new ArrayList<>(tables.size());
        for (String table : tables) {
            texts.add("Table " + table + "\n" + documents.get(table));
        }
        try {
            List<float[]> embedded = embeddingClient.embed(texts);
            Map<String, float[]> vectors = new LinkedHashMap<>();
            for (int i = 0; i < tables.size(); i++) {
                vectors.put(tables.get(i), embedded.get(i));
            }
            corpora.put(corpusId, vectors);
            log.info("Embedded {} table(s) in {}", tables.size(), corpusId);
        } catch (CompletionException e) {
            log.warn("Schema embedding failed for {}, keyword search only: {}", corpusId, e.getMessage());
        }
    }

    @Override
    public void drop(String corpusId) {
        corpora.remove(corpusId);
        keywordIndex.drop(corpusId);
    }

    private static double dot(float[] a, float[] b) {
        int n = Math.min(a.length, b.length);
        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
