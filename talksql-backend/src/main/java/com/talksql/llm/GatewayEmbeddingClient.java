package com.talksql.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Embedding client for OpenAI-compatible {@code /v1/embeddings} endpoints.
 *
 * <p>Vectors are normalized to unit length, so cosine similarity reduces to a dot product.
 */
@Slf4j
@Service
public class GatewayEmbeddingClient implements EmbeddingClient {

    private final ObjectMapper objectMapper;
    private final Environment environment;
    private final GatewayTransport transport;

    public GatewayEmbeddingClient(ObjectMapper objectMapper, Environment environment) {
        this.objectMapper = objectMapper;
        this.environment = environment;
        this.transport = new GatewayTransport();
    }

    @Override
    public boolean isEnabled() {
        return GatewayConfig.fromEnvironment(environment).isEnabled();
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        GatewayConfig config = GatewayConfig.fromEnvironment(environment);
        if (!config.isEnabled()) {
            throw new CompletionException(String.join(" ", config.disabledWarnings()));
        }

        String body;
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("model", config.embeddingModel());
            payload.put("input", texts);
            body = objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new CompletionException("Failed to encode embedding request: " + e.getMessage(), e);
        }

        String response = transport.postJson(config, "/v1/embeddings", body, config.embeddingModel());
        List<float[]> vectors = readVectors(response, texts.size());
        log.debug("Embedded {} text(s) with {}", texts.size(), config.embeddingModel());
        return vectors;
    }

    private List<float[]> readVectors(String responseBody, int expected) {
        JsonNode data;
        try {
            data = objectMapper.readTree(responseBody).path("data");
        } catch (IOException e) {
            throw new CompletionException("LLM gateway returned invalid JSON: " + e.getMessage(), e);
        }
        if (!data.isArray() || data.size() != expected) {
            throw new CompletionException("LLM gateway returned " + data.size() + " embedding(s) for "
                    + expected + " input(s)");
        }

        float[][] ordered = new float[expected][];
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            int index = item.path("index").asInt(i);
            JsonNode embedding = item.path("embedding");
            if (index < 0 || index >= expected || !embedding.isArray() || embedding.isEmpty()) {
                throw new CompletionException("LLM gateway returned a malformed embedding at position " + i);
            }
            float[] vector = new float[embedding.size()];
            for (int j = 0; j < vector.length; j++) {
                vector[j] = (float) embedding.get(j).asDouble();
            }
            ordered[index] = normalize(vector);
        }
        if (Arrays.stream(ordered).anyMatch(v -> v == null)) {
            throw new CompletionException("LLM gateway returned duplicate embedding indexes");
        }
        return new ArrayList<>(Arrays.asList(ordered));
    }

    static float[] normalize(float[] vector) {
        double sum = 0;
        for (float v : vector) {
            sum += v * v;
        }
        double norm = Math.sqrt(sum);
        if (norm == 0) {
            return vector;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] / norm);
        }
        return vector;
    }
}
