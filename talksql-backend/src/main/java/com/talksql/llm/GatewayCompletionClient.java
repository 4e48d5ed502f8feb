package com.talksql.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Completion client for OpenAI-compatible chat completion endpoints.
 *
 * Talks plain HTTP through the JDK client, so any gateway exposing {@code /v1/chat/completions} works.
 */
@Service
public class GatewayCompletionClient implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(GatewayCompletionClient.class);

    private final ObjectMapper objectMapper;
    private final Environment environment;
    private final GatewayTransport transport;

    /**
     * Create a completion client.
     *
     * @param objectMapper Jackson object mapper
     * @param environment Spring environment for configuration
     */
    public GatewayCompletionClient(ObjectMapper objectMapper, Environment environment) {
        this.objectMapper = objectMapper;
        this.environment = environment;
        this.transport = new GatewayTransport();
    }

    /**
     * Log whether completions are configured. The API key itself is never logged.
     */
    @PostConstruct
    public void logConfigStatus() {
        GatewayConfig config = GatewayConfig.fromEnvironment(environment);
        if (config.isEnabled()) {
            log.info("LLM completion is ENABLED (base_url={}, model={}, timeout_ms={}, max_attempts={})",
                    config.baseUrl(), config.model(), config.timeoutMs(), config.maxAttempts());
            return;
        }
        log.warn("LLM completion is DISABLED (base_url={}, api_key_configured=false, model={}). {}",
                config.baseUrl(), config.model(), String.join(" ", config.disabledWarnings()));
    }

    @Override
    public String complete(String prompt, Map<String, Object> context) {
        GatewayConfig config = GatewayConfig.fromEnvironment(environment);
        if (!config.isEnabled()) {
            throw new CompletionException(String.join(" ", config.disabledWarnings()));
        }

        String body;
        try {
            Map<String, Object> payload = new HashMap<>();
            payload.put("model", config.model());
            payload.put("temperature", config.temperature());
            payload.put("messages", List.of(Map.of(
                    "role", "user",
                    "content", PromptTemplates.render(prompt, context)
            )));
            body = objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new CompletionException("Failed to encode completion request: " + e.getMessage(), e);
        }

        return readContent(transport.postJson(config, "/v1/chat/completions", body, config.model()));
    }

    private String readContent(String responseBody) {
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
            if (!contentNode.isTextual()) {
                throw new CompletionException("LLM gateway returned no message content");
            }
            return contentNode.asText();
        } catch (IOException e) {
            throw new CompletionException("LLM gateway returned invalid JSON: " + e.getMessage(), e);
        }
    }
}
