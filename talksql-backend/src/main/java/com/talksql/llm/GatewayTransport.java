package com.talksql.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * JSON POSTs to the gateway with bounded retries. 429 and 5xx responses and I/O failures are retried;
 * other 4xx responses fail at once.
 */
final class GatewayTransport {

    private static final Logger log = LoggerFactory.getLogger(GatewayTransport.class);

    private static final long RETRY_BACKOFF_MS = 500;

    private final HttpClient httpClient;

    GatewayTransport() {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Send a JSON body and return the response body of the first successful attempt.
     *
     * @param config gateway settings
     * @param path endpoint path, e.g. {@code /v1/embeddings}
     * @param body JSON request body
     * @param model model name, for logging
     * @return response body
     * @throws CompletionException when every attempt fails or the gateway rejects the request
     */
    String postJson(GatewayConfig config, String path, String body, String model) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + path))
                .timeout(Duration.ofMillis(config.timeoutMs()))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        CompletionException last = null;
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if (status == 429 || status >= 500) {
                    log.warn("LLM gateway request failed (path={}, status_code={}, attempt={}/{}, model={})",
                            path, status, attempt, config.maxAttempts(), model);
                    last = new CompletionException("LLM gateway error: HTTP " + status);
                } else if (status >= 400) {
                    log.warn("LLM gateway rejected request (path={}, status_code={}, model={})", path, status, model);
                    throw new CompletionException("LLM gateway error: HTTP " + status + " - " + response.body());
                } else {
                    return response.body();
                }
            } catch (IOException e) {
                log.warn("LLM gateway request failed (path={}, attempt={}/{}): {}",
                        path, attempt, config.maxAttempts(), e.getMessage());
                last = new CompletionException("LLM gateway unreachable: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException("Interrupted while waiting for the LLM gateway", e);
            }

            if (attempt < config.maxAttempts()) {
                sleepBeforeRetry();
            }
        }
        throw last != null ? last : new CompletionException("No gateway attempt was made");
    }

    private static void sleepBeforeRetry() {
        try {
            Thread.sleep(RETRY_BACKOFF_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted while waiting to retry the LLM gateway", e);
        }
    }
}
