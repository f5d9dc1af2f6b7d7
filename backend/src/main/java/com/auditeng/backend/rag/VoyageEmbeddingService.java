package com.auditeng.backend.rag;

import com.auditeng.backend.config.RagProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Service for generating vector embeddings using Voyage AI.
 * <p>
 * Without an API key every text is embedded by {@link LocalEmbeddings}. With a key, a failed query
 * falls back to the local embedding, while a failed document raises {@link EmbeddingUnavailableException}
 * so that no vector from another model is ever stored. Each result carries the model that produced it;
 * searches only compare vectors of the same model.
 */
@Service
public class VoyageEmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(VoyageEmbeddingService.class);

    static final int MAX_DOCUMENT_TOKENS = 8000;
    static final int MAX_QUERY_TOKENS = 2000;
    private static final int CHARS_PER_TOKEN = 4;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String apiKey;
    private final String model;
    private final int dimensions;

    public VoyageEmbeddingService(ObjectMapper objectMapper,
            @Value("${voyage.api.url:https://api.voyageai.com/v1/embeddings}") String apiUrl,
            @Value("${voyage.api.key:}") String apiKey,
            RagProperties properties) {
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = properties.embeddingModel();
        this.dimensions = properties.embeddingDimensions();
    }

    /**
     * Embed content for storage.
     *
     * @throws EmbeddingUnavailableException when the configured provider fails
     */
    public EmbeddingResult embedDocument(String text) {
        String input = truncate(text, MAX_DOCUMENT_TOKENS);
        if (!isRemoteConfigured()) {
            return local(input);
        }
        try {
            return remote(input, "document");
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("[RAG] Voyage AI document embedding failed: {}", e.getMessage());
            throw new EmbeddingUnavailableException("Voyage AI embedding failed: " + e.getMessage(), e);
        }
    }

    /**
     * Embed a search query.
     */
    public EmbeddingResult embedQuery(String text) {
        String input = truncate(text, MAX_QUERY_TOKENS);
        if (!isRemoteConfigured()) {
            log.debug("[RAG] Voyage AI API key not configured, using local embedding");
            return local(input);
        }
        try {
            return remote(input, "query");
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("[RAG] Voyage AI query embedding failed, using local embedding: {}", e.getMessage());
            return local(input);
        }
    }

    private boolean isRemoteConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    private EmbeddingResult remote(String text, String inputType) throws Exception {
        Map<String, Object> requestBody = Map.of(
                "input", List.of(text),
                "model", model,
                "input_type", inputType);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl))
                .timeout(Duration.ofSeconds(30))
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(requestBody)))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            log.error("[RAG] Voyage AI API error: {} - {}", response.statusCode(), response.body());
            throw new IllegalStateException("Voyage AI API error: " + response.statusCode());
        }

        JsonNode responseJson = objectMapper.readTree(response.body());
        List<Double> embedding = new ArrayList<>();
        for (JsonNode value : responseJson.path("data").path(0).path("embedding")) {
            embedding.add(value.asDouble());
        }
        if (embedding.isEmpty()) {
            throw new IllegalStateException("Voyage AI returned no embedding");
        }
        if (embedding.size() != dimensions) {
            throw new IllegalStateException("Voyage AI returned " + embedding.size()
                    + " dimensions, expected " + dimensions);
        }
        return EmbeddingResult.builder()
                .embedding(embedding)
                .tokensUsed(responseJson.path("usage").path("total_tokens").asInt(0))
                .model(model)
                .build();
    }

    private EmbeddingResult local(String text) {
        return EmbeddingResult.builder()
                .embedding(LocalEmbeddings.embed(text, dimensions))
                .tokensUsed(0)
                .model(LocalEmbeddings.MODEL)
                .build();
    }

    private static String truncate(String text, int maxTokens) {
        String safe = text != null ? text : "";
        int maxChars = maxTokens * CHARS_PER_TOKEN;
        return safe.length() > maxChars ? safe.substring(0, maxChars) : safe;
    }
}
