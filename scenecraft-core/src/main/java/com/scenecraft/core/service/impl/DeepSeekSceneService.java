package com.scenecraft.core.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scenecraft.core.model.ExpansionRequest;
import com.scenecraft.core.model.ExpansionTarget;
import com.scenecraft.core.model.FlatNode;
import com.scenecraft.core.model.NodeSpec;
import com.scenecraft.core.model.OptimizationSuggestion;
import com.scenecraft.core.model.RoundAnalysis;
import com.scenecraft.core.model.SceneContext;
import com.scenecraft.core.model.SuggestionAction;
import com.scenecraft.core.service.SceneService;
import com.scenecraft.core.service.ServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link SceneService} backed by a DeepSeek (or any OpenAI-compatible) chat model.
 *
 * <p>Each operation is one chat completion whose reply must contain a JSON object.
 * Malformed entries inside an otherwise valid reply are skipped with a warning;
 * a reply without any parsable object fails the call.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SceneService service = DeepSeekSceneService.create(AiClientConfig.defaults());
 * }</pre>
 */
public final class DeepSeekSceneService implements SceneService {

    private static final Logger log = LoggerFactory.getLogger(DeepSeekSceneService.class);

    private final ChatCompletionClient client;
    private final ObjectMapper mapper;
    private final JsonResponseExtractor extractor;
    private final ScenePrompts prompts;

    public DeepSeekSceneService(ChatCompletionClient client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
        this.extractor = new JsonResponseExtractor(mapper);
        this.prompts = new ScenePrompts(mapper);
    }

    /**
     * Creates a service talking HTTP to the configured endpoint, with the API key
     * taken from the environment.
     *
     * @param config endpoint settings
     * @return service
     * @throws IllegalStateException if the API key environment variable is not set
     */
    public static DeepSeekSceneService create(AiClientConfig config) {
        ObjectMapper mapper = newObjectMapper();
        String apiKey = config.resolveApiKey(System::getenv);
        log.info("Using chat model '{}' at {}", config.model(), config.baseUrl());
        return new DeepSeekSceneService(new HttpChatCompletionClient(config, apiKey, mapper), mapper);
    }

    static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<NodeSpec> generateInitialNodes(SceneContext context) throws ServiceException {
        JsonNode reply = ask(prompts.initialGenerationPrompt(context));
        return readNodes(reply);
    }

    @Override
    public List<NodeSpec> expandContainer(ExpansionRequest request, SceneContext context) throws ServiceException {
        JsonNode reply = ask(prompts.expansionPrompt(request, context));
        List<NodeSpec> nodes = readNodes(reply);
        log.debug("Expansion of '{}' returned {} node(s)", request.containerName(), nodes.size());
        return nodes;
    }

    @Override
    public RoundAnalysis analyzeRound(int round, List<FlatNode> nodes, SceneContext context, String previousSummary)
            throws ServiceException {
        String prompt;
        try {
            prompt = prompts.analysisPrompt(round, nodes, context, previousSummary);
        } catch (JsonProcessingException e) {
            throw new ServiceException("Could not render analysis prompt", e);
        }
        return readAnalysis(ask(prompt));
    }

    @Override
    public List<NodeSpec> optimizeNodes(List<OptimizationSuggestion> suggestions, List<FlatNode> nodes,
                                        SceneContext context) throws ServiceException {
        String prompt;
        try {
            prompt = prompts.optimizationPrompt(suggestions, nodes, context);
        } catch (JsonProcessingException e) {
            throw new ServiceException("Could not render optimization prompt", e);
        }
        return readNodes(ask(prompt));
    }

    private JsonNode ask(String userPrompt) throws ServiceException {
        String reply = client.complete(prompts.systemPrompt(), userPrompt);
        return extractor.extract(reply);
    }

    List<NodeSpec> readNodes(JsonNode reply) {
        List<NodeSpec> nodes = new ArrayList<>();
        for (JsonNode entry : reply.path("nodes")) {
            try {
                nodes.add(mapper.treeToValue(entry, NodeSpec.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed node entry: {}", e.getOriginalMessage());
            }
        }
        return nodes;
    }

    RoundAnalysis readAnalysis(JsonNode reply) {
        List<String> issues = new ArrayList<>();
        reply.path("issues_found").forEach(issue -> issues.add(issue.asText()));

        List<OptimizationSuggestion> suggestions = new ArrayList<>();
        for (JsonNode entry : reply.path("optimization_suggestions")) {
            suggestions.add(readSuggestion(entry));
        }

        List<ExpansionTarget> targets = new ArrayList<>();
        for (JsonNode entry : reply.path("containers_to_expand_next")) {
            if (entry.isTextual()) {
                targets.add(new ExpansionTarget(entry.asText(), "", ExpansionTarget.MIN_PRIORITY));
            } else if (entry.hasNonNull("name")) {
                targets.add(new ExpansionTarget(entry.path("name").asText(), entry.path("reason").asText(""),
                    entry.path("priority").asInt(ExpansionTarget.MIN_PRIORITY)));
            }
        }

        List<String> stop = new ArrayList<>();
        reply.path("containers_to_stop").forEach(name -> stop.add(name.asText()));

        return new RoundAnalysis(
            reply.path("summary").asText(""),
            reply.path("completeness_score").asInt(0),
            issues,
            suggestions,
            targets,
            stop,
            reply.path("next_round_focus").asText(""));
    }

    private OptimizationSuggestion readSuggestion(JsonNode entry) {
        String rawAction = entry.path("action").asText("");
        SuggestionAction action = SuggestionAction.parse(rawAction).orElseGet(() -> {
            log.warn("Unknown suggestion action '{}', treating as modify", rawAction);
            return SuggestionAction.MODIFY;
        });

        NodeSpec replacement = null;
        JsonNode data = entry.path("new_data");
        if (data.isObject() && data.size() > 0) {
            try {
                replacement = mapper.treeToValue(data, NodeSpec.class);
            } catch (JsonProcessingException e) {
                log.warn("Ignoring malformed new_data for '{}': {}", entry.path("target_node").asText(),
                    e.getOriginalMessage());
            }
        }
        return new OptimizationSuggestion(action, entry.path("target_node").asText(""),
            entry.path("reason").asText(""), replacement);
    }
}
