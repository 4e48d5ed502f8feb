package com.talksql.schema;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process keyword table search: TF-IDF term vectors per table document, ranked by cosine similarity.
 * Used on its own when no embedding gateway is configured.
 */
@Slf4j
@Service
public class SchemaIndexService implements TableSearchClient {
    private final Map<String, Corpus> corpora = new ConcurrentHashMap<>();

    @Override
    public List<String> topK(String query, int k, String corpusId) {
        Corpus corpus = corpora.get(corpusId);
        if (corpus == null) {
            throw new IllegalStateException("No schema index for corpus: " + corpusId);
        }
        Map<String, Double> queryVector = corpus.weigh(termCounts(query));
        if (queryVector.isEmpty() || k <= 0) {
            return List.of();
        }

        List<Map.Entry<String, Double>> scored = new ArrayList<>();
        for (Map.Entry<String, Map<String, Double>> doc : corpus.vectors.entrySet()) {
            double score = cosine(queryVector, doc.getValue());
            if (score > 0) {
                scored.add(Map.entry(doc.getKey(), score));
            }
        }
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
        Map<String, Map<String, Integer>> counts = new LinkedHashMap<>();
        documents.forEach((table, text) -> counts.put(table, termCounts(table + " " + text)));
        corpora.put(corpusId, new Corpus(counts));
        log.info("Indexed {} table(s) in {}", documents.size(), corpusId);
    }

    @Override
    public void drop(String corpusId) {
        if (corpora.remove(corpusId) != null) {
            log.info("Dropped schema index {}", corpusId);
        }
    }

    static Map<String, Integer> termCounts(String text) {
        Map<String, Integer> counts = new HashMap<>();
        if (text == null) {
            return counts;
        }
        for (String raw : text.toLowerCase(Locale.ROOT).split("[^a-z0-9_]+")) {
            if (raw.isEmpty()) {
                continue;
            }
            counts.merge(stem(raw), 1, Integer::sum);
            if (raw.indexOf('_') >= 0) {
                for (String part : raw.split("_")) {
                    if (!part.isEmpty()) {
                        counts.merge(stem(part), 1, Integer::sum);
                    }
                }
            }
        }
        return counts;
    }

    // crude plural folding so "orders" matches "order"
    private static String stem(String term) {
        if (term.length() > 4 && term.endsWith("ies")) {
            return term.substring(0, term.length() - 3) + "y";
        }
        if (term.length() > 3 && term.endsWith("s") && !term.endsWith("ss")) {
            return term.substring(0, term.length() - 1);
        }
        return term;
    }

    private static double cosine(Map<String, Double> a, Map<String, Double> b) {
        double dot = 0;
        for (Map.Entry<String, Double> e : a.entrySet()) {
            Double other = b.get(e.getKey());
            if (other != null) {
                dot += e.getValue() * other;
            }
        }
        if (dot == 0) {
            return 0;
        }
        return dot / (norm(a) * norm(b));
    }

    private static double norm(Map<String, Double> v) {
        double sum = 0;
        for (double x : v.values()) {
            sum += x * x;
        }
        return Math.sqrt(sum);
    }

    private static final class Corpus {
        private final Map<String, Double> idf = new HashMap<>();
        private final Map<String, Map<String, Double>> vectors = new LinkedHashMap<>();

        Corpus(Map<String, Map<String, Integer>> counts) {
            Map<String, Integer> docFrequency = new HashMap<>();
            counts.values().forEach(c -> c.keySet().forEach(t -> docFrequency.merge(t, 1, Integer::sum)));
            int n = counts.size();
            docFrequency.forEach((term, df) -> idf.put(term, Math.log(1.0 + (double) n / df)));
            counts.forEach((table, c) -> vectors.put(table, weigh(c)));
        }

        Map<String, Double> weigh(Map<String, Integer> counts) {
            Map<String, Double> out = new HashMap<>();
            counts.forEach((term, tf) -> {
                Double w = idf.get(term);
                if (w != null) {
                    out.put(term, tf * w);
                }
            });
            return out;
        }
    }
}
