package com.scenecraft.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scenecraft.core.engine.GeneratorConfig;
import com.scenecraft.core.service.impl.AiClientConfig;

import java.time.Duration;
import java.util.List;

/**
 * Root configuration, loaded from {@code scenecraft.yaml}.
 *
 * <p>Every section and every field is optional; anything left out keeps its
 * built-in default.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * ai:
 *   baseUrl: "https://api.deepseek.com"
 *   model: "deepseek-chat"
 *   apiKeyEnv: "DEEPSEEK_API_KEY"
 *
 * generator:
 *   maxDepth: 4
 *   maxTotalNodes: 150
 *   maxRounds: 3
 *
 * output:
 *   directory: "./output"
 *   format: markdown
 * }</pre>
 *
 * @param ai chat model connection settings
 * @param generator generator tuning
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SceneCraftConfig(
    @JsonProperty("ai") AiSettings ai,
    @JsonProperty("generator") GeneratorSettings generator,
    @JsonProperty("output") OutputSettings output
) {
    /**
     * Compact constructor, fills in missing sections.
     */
    public SceneCraftConfig {
        if (ai == null) {
            ai = AiSettings.empty();
        }
        if (generator == null) {
            generator = GeneratorSettings.empty();
        }
        if (output == null) {
            output = OutputSettings.defaults();
        }
    }

    /**
     * Returns the built-in configuration.
     *
     * @return default configuration
     */
    public static SceneCraftConfig defaults() {
        return new SceneCraftConfig(null, null, null);
    }

    /**
     * Returns the defaults with every field spelled out, for writing a starter file.
     *
     * @return fully populated default configuration
     */
    public static SceneCraftConfig template() {
        AiClientConfig ai = AiClientConfig.defaults();
        GeneratorConfig generator = GeneratorConfig.defaults();
        return new SceneCraftConfig(
            new AiSettings(ai.baseUrl(), ai.model(), ai.temperature(), ai.maxTokens(),
                (int) ai.timeout().toSeconds(), ai.apiKeyEnv()),
            new GeneratorSettings(
                generator.maxDepth(),
                generator.maxNodesPerContainer(),
                generator.parallelExpansion(),
                generator.parallelBatchSize(),
                generator.maxConcurrent(),
                generator.maxTotalNodes(),
                generator.minDescriptionLength(),
                generator.costControl(),
                generator.aggressivePruning(),
                generator.maxRounds(),
                generator.completenessThreshold(),
                generator.minNewNodesPerRound(),
                generator.maxIterations(),
                generator.genericItemNames(),
                generator.placeholderNames()),
            OutputSettings.defaults());
    }

    /**
     * Chat model connection settings. The API key is read from the named environment
     * variable and never stored in the file.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AiSettings(
        @JsonProperty("baseUrl") String baseUrl,
        @JsonProperty("model") String model,
        @JsonProperty("temperature") Double temperature,
        @JsonProperty("maxTokens") Integer maxTokens,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("apiKeyEnv") String apiKeyEnv
    ) {
        public static AiSettings empty() {
            return new AiSettings(null, null, null, null, null, null);
        }

        public AiClientConfig toClientConfig() {
            return new AiClientConfig(
                baseUrl,
                model,
                temperature == null ? AiClientConfig.DEFAULT_TEMPERATURE : temperature,
                maxTokens == null ? AiClientConfig.DEFAULT_MAX_TOKENS : maxTokens,
                timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds),
                apiKeyEnv);
        }
    }

    /**
     * Generator tuning; null fields keep the {@link GeneratorConfig} defaults.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("maxDepth") Integer maxDepth,
        @JsonProperty("maxNodesPerContainer") Integer maxNodesPerContainer,
        @JsonProperty("parallelExpansion") Boolean parallelExpansion,
        @JsonProperty("parallelBatchSize") Integer parallelBatchSize,
        @JsonProperty("maxConcurrent") Integer maxConcurrent,
        @JsonProperty("maxTotalNodes") Integer maxTotalNodes,
        @JsonProperty("minDescriptionLength") Integer minDescriptionLength,
        @JsonProperty("costControl") Boolean costControl,
        @JsonProperty("aggressivePruning") Boolean aggressivePruning,
        @JsonProperty("maxRounds") Integer maxRounds,
        @JsonProperty("completenessThreshold") Integer completenessThreshold,
        @JsonProperty("minNewNodesPerRound") Integer minNewNodesPerRound,
        @JsonProperty("maxIterations") Integer maxIterations,
        @JsonProperty("genericItemNames") List<String> genericItemNames,
        @JsonProperty("placeholderNames") List<String> placeholderNames
    ) {
        public static GeneratorSettings empty() {
            return new GeneratorSettings(null, null, null, null, null, null, null, null, null, null, null, null,
                null, null, null);
        }

        /**
         * Overlays the configured values onto a builder.
         *
         * @param builder builder to modify
         * @return the same builder
         */
        public GeneratorConfig.Builder applyTo(GeneratorConfig.Builder builder) {
            if (maxDepth != null) {
                builder.maxDepth(maxDepth);
            }
            if (maxNodesPerContainer != null) {
                builder.maxNodesPerContainer(maxNodesPerContainer);
            }
            if (parallelExpansion != null) {
                builder.parallelExpansion(parallelExpansion);
            }
            if (parallelBatchSize != null) {
                builder.parallelBatchSize(parallelBatchSize);
            }
            if (maxConcurrent != null) {
                builder.maxConcurrent(maxConcurrent);
            }
            if (maxTotalNodes != null) {
                builder.maxTotalNodes(maxTotalNodes);
            }
            if (minDescriptionLength != null) {
                builder.minDescriptionLength(minDescriptionLength);
            }
            if (costControl != null) {
                builder.costControl(costControl);
            }
            if (aggressivePruning != null) {
                builder.aggressivePruning(aggressivePruning);
            }
            if (maxRounds != null) {
                builder.maxRounds(maxRounds);
            }
            if (completenessThreshold != null) {
                builder.completenessThreshold(completenessThreshold);
            }
            if (minNewNodesPerRound != null) {
                builder.minNewNodesPerRound(minNewNodesPerRound);
            }
            if (maxIterations != null) {
                builder.maxIterations(maxIterations);
            }
            if (genericItemNames != null) {
                builder.genericItemNames(genericItemNames);
            }
            if (placeholderNames != null) {
                builder.placeholderNames(placeholderNames);
            }
            return builder;
        }

        public GeneratorConfig toGeneratorConfig() {
            return applyTo(GeneratorConfig.builder()).build();
        }
    }

    /**
     * Output settings.
     *
     * @param directory directory generated scenes are written to
     * @param format default output format id
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("format") String format
    ) {
        public static final String DEFAULT_DIRECTORY = "./output";
        public static final String DEFAULT_FORMAT = "json";

        /**
         * Compact constructor with defaults.
         */
        public OutputSettings {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_DIRECTORY;
            }
            if (format == null || format.isBlank()) {
                format = DEFAULT_FORMAT;
            }
        }

        public static OutputSettings defaults() {
            return new OutputSettings(DEFAULT_DIRECTORY, DEFAULT_FORMAT);
        }
    }
}
