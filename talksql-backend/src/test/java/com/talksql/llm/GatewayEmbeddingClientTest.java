package com.talksql.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GatewayEmbeddingClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<String> requestBodies = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicReference<String> reply = new AtomicReference<>();
    private HttpServer server;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/embeddings", exchange -> {
            calls.incrementAndGet();
            requestBodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] body = reply.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private GatewayEmbeddingClient client(String apiKey) {
        MockEnvironment env = new MockEnvironment()
                .withProperty("talksql.ai.base-url", "http://127.0.0.1:" + server.getAddress().getPort())
                .withProperty("talksql.ai.embedding-model", "embed-test")
                .withProperty("talksql.ai.max-attempts", "1");
        if (apiKey != null) {
            env.setProperty("talksql.ai.api-key", apiKey);
        }
        return new GatewayEmbeddingClient(objectMapper, env);
    }

    @Test
    void returnsUnitVectorsInInputOrder() throws Exception {
        reply.set("{\"data\":["
                + "{\"index\":1,\"embedding\":[0.0,2.0]},"
                + "{\"index\":0,\"embedding\":[3.0,4.0]}]}");

        List<float[]> vectors = client("sk-test").embed(List.of("orders", "payments"));

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(0)[0]).isCloseTo(0.6f, within(1e-6f));
        assertThat(vectors.get(0)[1]).isCloseTo(0.8f, within(1e-6f));
        assertThat(vectors.get(1)).containsExactly(0.0f, 1.0f);

        JsonNode sent = objectMapper.readTree(requestBodies.get(0));
        assertThat(sent.path("model").asText()).isEqualTo("embed-test");
        assertThat(sent.path("input").get(1).asText()).isEqualTo("payments");
    }

    @Test
    void countMismatchIsAnError() {
        reply.set("{\"data\":[{\"index\":0,\"embedding\":[1.0]}]}");

        assertThatThrownBy(() -> client("sk-test").embed(List.of("a", "b")))
                .isInstanceOf(CompletionException.class)
                .hasMessageContaining("1 embedding(s) for 2 input(s)");
    }

    @Test
    void disabledWithoutApiKey() {
        GatewayEmbeddingClient client = client(null);

        assertThat(client.isEnabled()).isFalse();
        assertThatThrownBy(() -> client.embed(List.of("orders")))
                .isInstanceOf(CompletionException.class)
                .hasMessageContaining("missing API key");
        assertThat(calls.get()).isZero();
    }

    @Test
    void emptyInputMakesNoRequest() {
        assertThat(client("sk-test").embed(List.of())).isEmpty();
        assertThat(calls.get()).isZero();
    }
}
