package com.trademind.memory.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trademind.common.exception.DegradedDependencyException;
import com.trademind.common.exception.ValidationException;
import com.trademind.common.model.Embedding;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Calls an OpenAI-compatible {@code POST /embeddings} endpoint.
 *
 * <p>Fails with {@link DegradedDependencyException} on transport errors, timeouts and
 * malformed responses, and with {@link ValidationException} when the returned vector
 * does not have the configured dimension. Callers decide how to fall back.
 */
public class RemoteEmbeddingClient {

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final String model;
    private final int dimension;
    private final Duration timeout;

    public RemoteEmbeddingClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                 String baseUrl, String apiKey, String model,
                                 int dimension, Duration timeout) {
        WebClient.Builder configured = builder
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (apiKey != null && !apiKey.isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        this.client = configured.build();
        this.objectMapper = objectMapper;
        this.model = model;
        this.dimension = dimension;
        this.timeout = timeout;
    }

    public String model() {
        return model;
    }

    public Mono<Embedding> embed(String text) {
        Map<String, Object> requestBody = Map.of("model", model, "input", text);

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                client.post()
                    .uri("/embeddings")
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout))
            .onErrorMap(e -> !(e instanceof ValidationException),
                        e -> new DegradedDependencyException("embedding-backend", e.getMessage(), e))
            .map(this::parseResponse);
    }

    private Embedding parseResponse(String response) {
        JsonNode vectorNode;
        try {
            vectorNode = objectMapper.readTree(response).path("data").path(0).path("embedding");
        } catch (Exception e) {
            throw new DegradedDependencyException("embedding-backend", "unreadable response", e);
        }
        if (!vectorNode.isArray() || vectorNode.isEmpty()) {
            throw new DegradedDependencyException("embedding-backend", "response carries no embedding");
        }
        if (vectorNode.size() != dimension) {
            throw new ValidationException("embedding backend returned dimension " + vectorNode.size()
                                          + ", expected " + dimension);
        }
        float[] values = new float[vectorNode.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = (float) vectorNode.get(i).asDouble();
        }
        return new Embedding(values);
    }
}
