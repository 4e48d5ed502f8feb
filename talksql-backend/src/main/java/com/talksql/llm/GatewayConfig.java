package com.talksql.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;

import java.util.List;

/**
 * Settings for the OpenAI-compatible gateway, read from {@code talksql.ai.*} with an environment
 * variable fallback for each key.
 */
record GatewayConfig(
        String baseUrl,
        String apiKey,
        String model,
        String embeddingModel,
        int timeoutMs,
        int maxAttempts,
        double temperature
) {
    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    static final String DEFAULT_BASE_URL = "https://api.openai.com";
    static final String DEFAULT_MODEL = "gpt-4o-mini";
    static final String DEFAULT_EMBEDDING_MODEL = "text-embedding-3-small";
    static final int DEFAULT_TIMEOUT_MS = 30000;
    static final int DEFAULT_MAX_ATTEMPTS = 2;

    static GatewayConfig fromEnvironment(Environment environment) {
        String baseUrl = getTrimmed(environment, "talksql.ai.base-url", "TALKSQL_AI_BASE_URL");
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        String apiKey = getTrimmed(environment, "talksql.ai.api-key", "OPENAI_API_KEY");
        String model = orDefault(getTrimmed(environment, "talksql.ai.model", "TALKSQL_AI_MODEL"), DEFAULT_MODEL);
        String embeddingModel = orDefault(
                getTrimmed(environment, "talksql.ai.embedding-model", "TALKSQL_AI_EMBEDDING_MODEL"),
                DEFAULT_EMBEDDING_MODEL);

        int timeoutMs = parseInt(getTrimmed(environment, "talksql.ai.timeout-ms", "TALKSQL_AI_TIMEOUT_MS"), DEFAULT_TIMEOUT_MS);
        int maxAttempts = Math.max(1, parseInt(getTrimmed(environment, "talksql.ai.max-attempts", "TALKSQL_AI_MAX_ATTEMPTS"), DEFAULT_MAX_ATTEMPTS));

        double temperature = 0.0;
        String temperatureRaw = getTrimmed(environment, "talksql.ai.temperature", "TALKSQL_AI_TEMPERATURE");
        if (temperatureRaw != null && !temperatureRaw.isBlank()) {
            try {
                temperature = Double.parseDouble(temperatureRaw);
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid talksql.ai.temperature: {}", temperatureRaw);
            }
        }

        return new GatewayConfig(baseUrl, apiKey, model, embeddingModel, timeoutMs, maxAttempts, temperature);
    }

    boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    List<String> disabledWarnings() {
        return List.of(
                "LLM gateway is disabled - missing API key.",
                "Required env: OPENAI_API_KEY (or talksql.ai.api-key).",
                "Optional env: TALKSQL_AI_BASE_URL, TALKSQL_AI_MODEL, TALKSQL_AI_EMBEDDING_MODEL, TALKSQL_AI_TIMEOUT_MS."
        );
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static int parseInt(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid integer setting: {}", raw);
            return fallback;
        }
    }

    private static String getTrimmed(Environment environment, String propKey, String envKey) {
        String v = null;
        if (environment != null) {
            v = environment.getProperty(propKey);
            if (v == null || v.isBlank()) {
                v = environment.getProperty(envKey);
            }
        }
        return v != null ? v.trim() : null;
    }
}
