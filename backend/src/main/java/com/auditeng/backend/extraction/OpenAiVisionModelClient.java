package com.auditeng.backend.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vision model client for OpenAI-compatible chat completion endpoints.
 */
@Component
public class OpenAiVisionModelClient implements VisionModelClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiVisionModelClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Value("${auditeng.vision.url:https://api.openai.com/v1/chat/completions}")
    private String apiUrl;

    @Value("${auditeng.vision.api-key:}")
    private String apiKey;

    @Value("${auditeng.extraction.timeout:PT60S}")
    private Duration timeout;

    public OpenAiVisionModelClient(ObjectMapper objectMapper) {
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        this.objectMapper = objectMapper;
    }

    @Override
    public ChatCompletion complete(List<ChatMessage> messages, String model, VisionDetail detail,
            int maxTokens, double temperature) throws VisionModelException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new VisionModelException(401, "Vision model API key not configured");
        }

        Map<String, Object> requestBody = Map.of(
                "model", model,
                "max_tokens", maxTokens,
                "temperature", temperature,
                "response_format", Map.of("type", "json_object"),
                "messages", toWireMessages(messages, detail));

        HttpResponse<String> response;
        try {
            String jsonBody = objectMapper.writeValueAsString(requestBody);
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new VisionModelException("Vision model request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VisionModelException("Vision model request interrupted", e);
        }

        if (response.statusCode() == 429) {
            throw new VisionModelException(429, "Rate limit exceeded (429 Too Many Requests)");
        }
        if (response.statusCode() != 200) {
            log.error("[EXTRACTION] Vision API error: {} - {}", response.statusCode(), response.body());
            throw new VisionModelException(response.statusCode(), "Vision API error: " + response.statusCode());
        }

        try {
            JsonNode responseJson = objectMapper.readTree(response.body());
            String content = responseJson.path("choices").path(0).path("message").path("content").asText(null);
            if (content == null || content.isBlank()) {
                throw new VisionModelException(response.statusCode(), "Empty response from vision model");
            }
            JsonNode usage = responseJson.path("usage");
            return ChatCompletion.builder()
                    .content(content)
                    .promptTokens(usage.path("prompt_tokens").asInt(0))
                    .completionTokens(usage.path("completion_tokens").asInt(0))
                    .model(responseJson.path("model").asText(model))
                    .build();
        } catch (IOException e) {
            throw new VisionModelException("Unreadable vision API response: " + e.getMessage(), e);
        }
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages, VisionDetail detail) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.getImageUrls() == null || message.getImageUrls().isEmpty()) {
                wire.add(Map.of("role", message.getRole(), "content", message.getText()));
                continue;
            }
            List<Map<String, Object>> parts = new ArrayList<>();
            parts.add(Map.of("type", "text", "text", message.getText()));
            for (String url : message.getImageUrls()) {
                Map<String, Object> image = new LinkedHashMap<>();
                image.put("url", url);
                image.put("detail", detail.apiValue());
                parts.add(Map.of("type", "image_url", "image_url", image));
            }
            wire.add(Map.of("role", message.getRole(), "content", parts));
        }
        return wire;
    }
}
