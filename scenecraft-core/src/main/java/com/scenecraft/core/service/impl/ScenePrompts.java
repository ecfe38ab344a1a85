package com.scenecraft.core.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scenecraft.core.model.ExpansionRequest;
import com.scenecraft.core.model.FlatNode;
import com.scenecraft.core.model.OptimizationSuggestion;
import com.scenecraft.core.model.SceneContext;

import java.util.List;
import java.util.Map;

/**
 * Prompt templates for the scene service.
 */
public final class ScenePrompts {

    static final String NODE_SCHEMA = """
        {
          "nodes": [
            {
              "name": "node name",
              "node_type": "item or container",
              "container_type": "physical / character / abstract (containers only)",
              "description": "detailed description",
              "position": "where it is",
              "attributes": {"material": "", "color": "", "size": "", "condition": ""},
              "should_expand": true
            }
          ],
          "reasoning": "why these nodes"
        }""";

    static final String SYSTEM_PROMPT = """
        You are a professional scene designer. Given a script and a scene requirement you produce
        the concrete elements of the scene as a tree of nodes.

        ## Node types

        1. item: a terminal element that contains nothing else (apple, cup, book, key, phone, wallet).
        2. container: an element that can hold other nodes.
           - physical: desk, drawer, room, cabinet, box, bookshelf
           - character: a person carrying items, wearing clothes, holding props
           - abstract: an idea, plan, system or concept

        ## Rules

        1. Anything that may hold other things is a container.
        2. People are character containers by default.
        3. Furniture is usually a container; small objects are usually items.
        4. Set should_expand according to how much the container matters to the scene.

        ## Output

        Reply with JSON only, no extra text:

        """ + NODE_SCHEMA;

    private final ObjectMapper mapper;

    public ScenePrompts(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    /**
     * Renders the scene context as labeled lines; empty tone fields are omitted.
     *
     * @param context scene context
     * @return prompt text
     */
    public String renderContext(SceneContext context) {
        StringBuilder text = new StringBuilder();
        text.append("[Script] ").append(context.script()).append('\n');
        text.append("[Scene requirement] ").append(context.requirement());
        appendIfPresent(text, "Era", context.era());
        appendIfPresent(text, "Location", context.location());
        appendIfPresent(text, "Atmosphere", context.atmosphere());
        appendIfPresent(text, "Style", context.style());
        for (Map.Entry<String, String> entry : context.extra().entrySet()) {
            appendIfPresent(text, entry.getKey(), entry.getValue());
        }
        return text.toString();
    }

    public String initialGenerationPrompt(SceneContext context) {
        return """
            Generate the main elements of the scene described below.

            %s

            Notes:
            1. Balance items and containers according to the requirement.
            2. Respect the era and the atmosphere.
            3. Characters may be containers.
            4. Mark whether each container needs further expansion.

            Reply with the JSON only.""".formatted(renderContext(context));
    }

    public String expansionPrompt(ExpansionRequest request, SceneContext context) {
        return """
            Expand the contents of the following container.

            ## Container
            - Name: %s
            - Type: %s
            - Description: %s
            - Level: %d
            - Theme: %s

            ## Scene context
            %s

            ## Rules
            1. The container sits at level %d; trees should not grow deeper than 5 levels.
            2. Choose contents that fit the container type and theme.
            3. At level 4 or deeper prefer items over containers.
            4. Contents must fit the era and the atmosphere of the scene.
            5. If the container's contents do not matter to the scene, return an empty node list.

            Reply with the JSON only.""".formatted(
            request.containerName(),
            request.containerType().value(),
            request.description(),
            request.level(),
            request.theme(),
            renderContext(context),
            request.level());
    }

    public String analysisPrompt(int round, List<FlatNode> nodes, SceneContext context, String previousSummary)
            throws JsonProcessingException {
        return """
            Review round %d of the scene generation.

            ## Scene context
            %s

            ## Previous round summary
            %s

            ## Current nodes
            %s

            Assess how completely the nodes meet the scene requirement and reply with JSON only:
            {
              "summary": "short summary of the current scene",
              "completeness_score": 0-100,
              "issues_found": ["problem"],
              "optimization_suggestions": [
                {"action": "add / remove / modify", "target_node": "node name", "reason": "why", "new_data": {}}
              ],
              "containers_to_expand_next": [{"name": "container name", "reason": "why", "priority": 1-5}],
              "containers_to_stop": ["container name"],
              "next_round_focus": "what to focus on next"
            }""".formatted(
            round,
            renderContext(context),
            previousSummary == null || previousSummary.isBlank() ? "(first round)" : previousSummary,
            mapper.writerWithDefaultPrettyPrinter().writeValueAsString(nodes));
    }

    public String optimizationPrompt(List<OptimizationSuggestion> suggestions, List<FlatNode> nodes,
                                     SceneContext context) throws JsonProcessingException {
        return """
            Apply the suggestions below to the scene and return the complete, updated node list.

            ## Scene context
            %s

            ## Suggestions
            %s

            ## Current nodes
            %s

            Every node that should remain must appear in the reply under its current name.
            Nodes left out are deleted. Reply with JSON only, in this format:

            %s""".formatted(
            renderContext(context),
            mapper.writerWithDefaultPrettyPrinter().writeValueAsString(suggestions),
            mapper.writerWithDefaultPrettyPrinter().writeValueAsString(nodes),
            NODE_SCHEMA);
    }

    private static void appendIfPresent(StringBuilder text, String label, String value) {
        if (value != null && !value.isBlank()) {
            text.append('\n').append('[').append(label).append("] ").append(value);
        }
    }
}
