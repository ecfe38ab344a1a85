package com.scenecraft.core.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scenecraft.core.service.ServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/**
 * {@link ChatCompletionClient} for OpenAI-compatible endpoints (DeepSeek, OpenAI,
 * Ollama, ...) over {@code java.net.http}.
 *
 * <p>Posts {@code {model, messages, temperature, max_tokens}} to
 * {@code {baseUrl}/v1/chat/completions} with a bearer token and reads
 * {@code choices[0].message.content}. The underlying {@link HttpClient} is shared
 * and thread-safe.
 */
public final class HttpChatCompletionClient implements ChatCompletionClient {

    private static final Logger log = LoggerFactory.getLogger(HttpChatCompletionClient.class);

    private static final int MAX_ERROR_BODY = 300;

    private final AiClientConfig config;
    private final String apiKey;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    public HttpChatCompletionClient(AiClientConfig config, String apiKey, ObjectMapper mapper) {
        this.config = config;
        this.apiKey = apiKey;
        this.mapper = mapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(config.timeout())
            .build();
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) throws ServiceException {
        String body = requestBody(systemPrompt, userPrompt);
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(config.completionsUrl()))
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + apiKey)
            .timeout(config.timeout())
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ServiceException("Request to " + config.completionsUrl() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Request to " + config.completionsUrl() + " interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new ServiceException("Chat completion API error " + response.statusCode() + ": "
                + abbreviate(response.body()));
        }
        log.debug("Chat completion returned {} characters", response.body().length());
        return readContent(response.body());
    }

    String requestBody(String systemPrompt, String userPrompt) throws ServiceException {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", config.model());
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);
        body.put("temperature", config.temperature());
        body.put("max_tokens", config.maxTokens());
        try {
            return mapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new ServiceException("Could not encode request body", e);
        }
    }

    String readContent(String responseBody) throws ServiceException {
        JsonNode root;
        try {
            root = mapper.readTree(responseBody);
        } catch (IOException e) {
            throw new ServiceException("Chat completion response is not JSON: " + abbreviate(responseBody), e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ServiceException("Chat completion response has no choices[0].message.content");
        }
        return content.asText();
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_ERROR_BODY ? text : text.substring(0, MAX_ERROR_BODY) + "...";
    }
}
