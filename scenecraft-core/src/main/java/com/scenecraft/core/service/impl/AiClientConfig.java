package com.scenecraft.core.service.impl;

import java.time.Duration;
import java.util.function.Function;

/**
 * Connection settings for an OpenAI-compatible chat completion endpoint.
 *
 * <p>The API key itself is never part of the configuration; only the name of the
 * environment variable holding it is.
 *
 * @param baseUrl endpoint base URL, without the {@code /v1/chat/completions} suffix
 * @param model model name
 * @param temperature sampling temperature
 * @param maxTokens maximum completion tokens
 * @param timeout request timeout
 * @param apiKeyEnv name of the environment variable holding the API key
 */
public record AiClientConfig(
    String baseUrl,
    String model,
    double temperature,
    int maxTokens,
    Duration timeout,
    String apiKeyEnv
) {
    public static final String DEFAULT_BASE_URL = "https://api.deepseek.com";
    public static final String DEFAULT_MODEL = "deepseek-chat";
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 4096;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final String DEFAULT_API_KEY_ENV = "DEEPSEEK_API_KEY";

    /**
     * Compact constructor with defaults.
     */
    public AiClientConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (model == null || model.isBlank()) {
            model = DEFAULT_MODEL;
        }
        if (maxTokens <= 0) {
            maxTokens = DEFAULT_MAX_TOKENS;
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (apiKeyEnv == null || apiKeyEnv.isBlank()) {
            apiKeyEnv = DEFAULT_API_KEY_ENV;
        }
    }

    /**
     * Returns the default DeepSeek settings.
     *
     * @return default config
     */
    public static AiClientConfig defaults() {
        return new AiClientConfig(DEFAULT_BASE_URL, DEFAULT_MODEL, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS,
            DEFAULT_TIMEOUT, DEFAULT_API_KEY_ENV);
    }

    /**
     * Looks up the API key.
     *
     * @param environment environment lookup, usually {@code System::getenv}
     * @return API key
     * @throws IllegalStateException if the variable is unset or blank
     */
    public String resolveApiKey(Function<String, String> environment) {
        String key = environment.apply(apiKeyEnv);
        if (key == null || key.isBlank()) {
            throw new IllegalStateException("No API key found; set the " + apiKeyEnv + " environment variable");
        }
        return key.strip();
    }

    /**
     * Returns the full chat completions endpoint.
     *
     * @return endpoint URL
     */
    public String completionsUrl() {
        return baseUrl + "/v1/chat/completions";
    }
}
