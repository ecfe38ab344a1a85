package com.scenecraft.core.service.impl;

import com.scenecraft.core.model.ContainerType;
import com.scenecraft.core.model.ExpansionRequest;
import com.scenecraft.core.model.NodeSpec;
import com.scenecraft.core.model.RoundAnalysis;
import com.scenecraft.core.model.SceneContext;
import com.scenecraft.core.model.SuggestionAction;
import com.scenecraft.core.service.ServiceException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DeepSeekSceneService}.
 */
class DeepSeekSceneServiceTest {

    private static final SceneContext CONTEXT = new SceneContext("A detective enters the study",
        "A cluttered study at midnight", "1920s", "London", "tense", "noir", Map.of());

    private final List<String> prompts = new ArrayList<>();

    private DeepSeekSceneService serviceReplying(String reply) {
        return new DeepSeekSceneService((system, user) -> {
            prompts.add(user);
            return reply;
        }, DeepSeekSceneService.newObjectMapper());
    }

    @Test
    void generateInitialNodes_readsNodeArray() throws Exception {
        DeepSeekSceneService service = serviceReplying("""
            ```json
            {"nodes": [
              {"name": "desk", "node_type": "container", "container_type": "physical",
               "description": "A mahogany desk", "should_expand": true, "attributes": {"material": "mahogany"}},
              {"name": "ashtray", "node_type": "item", "description": "A full glass ashtray", "confidence": 0.9}
            ]}
            ```""");

        List<NodeSpec> nodes = service.generateInitialNodes(CONTEXT);

        assertThat(nodes).extracting(NodeSpec::name).containsExactly("desk", "ashtray");
        assertThat(nodes.get(0).shouldExpand()).isTrue();
        assertThat(nodes.get(0).attribute("material")).isEqualTo("mahogany");
        assertThat(prompts.get(0)).contains("[Script] A detective enters the study").contains("London");
    }

    @Test
    void expandContainer_promptNamesContainer() throws Exception {
        DeepSeekSceneService service = serviceReplying("{\"nodes\": []}");

        List<NodeSpec> nodes = service.expandContainer(
            new ExpansionRequest("desk", ContainerType.PHYSICAL, "A mahogany desk", "contents of desk", 0), CONTEXT);

        assertThat(nodes).isEmpty();
        assertThat(prompts.get(0)).contains("- Name: desk").contains("- Theme: contents of desk");
    }

    @Test
    void expandContainer_missingNodes_returnsEmptyList() throws Exception {
        DeepSeekSceneService service = serviceReplying("{\"items\": [1, 2]}");

        assertThat(service.expandContainer(
            new ExpansionRequest("drawer", ContainerType.PHYSICAL, "", "", 1), CONTEXT)).isEmpty();
    }

    @Test
    void analyzeRound_readsAllFields() throws Exception {
        DeepSeekSceneService service = serviceReplying("""
            {"summary": "Study mostly furnished",
             "completeness_score": 72,
             "issues_found": ["no light source"],
             "optimization_suggestions": [
               {"action": "add", "target_node": "lamp", "reason": "needs light",
                "new_data": {"name": "lamp", "node_type": "item", "description": "A green banker's lamp"}},
               {"action": "rename", "target_node": "desk", "reason": "odd"}
             ],
             "containers_to_expand_next": ["desk", {"name": "safe", "reason": "clue", "priority": 9}],
             "containers_to_stop": ["rug"],
             "next_round_focus": "clues"}""");

        RoundAnalysis analysis = service.analyzeRound(2, List.of(), CONTEXT, "previous");

        assertThat(analysis.summary()).isEqualTo("Study mostly furnished");
        assertThat(analysis.completenessScore()).isEqualTo(72);
        assertThat(analysis.issuesFound()).containsExactly("no light source");
        assertThat(analysis.optimizationSuggestions()).hasSize(2);
        assertThat(analysis.optimizationSuggestions().get(0).action()).isEqualTo(SuggestionAction.ADD);
        assertThat(analysis.optimizationSuggestions().get(0).replacement().name()).isEqualTo("lamp");
        assertThat(analysis.optimizationSuggestions().get(1).action()).isEqualTo(SuggestionAction.MODIFY);
        assertThat(analysis.containersToExpandNext()).extracting(t -> t.name() + ":" + t.priority())
            .containsExactly("desk:1", "safe:5");
        assertThat(analysis.containersToStop()).containsExactly("rug");
        assertThat(analysis.nextRoundFocus()).isEqualTo("clues");
    }

    @Test
    void analyzeRound_scoreOutOfRange_isClamped() throws Exception {
        DeepSeekSceneService service = serviceReplying("{\"completeness_score\": 140}");

        assertThat(service.analyzeRound(1, List.of(), CONTEXT, "").completenessScore()).isEqualTo(100);
    }

    @Test
    void optimizeNodes_clientFailure_propagates() {
        DeepSeekSceneService service = new DeepSeekSceneService((system, user) -> {
            throw new ServiceException("timeout");
        }, DeepSeekSceneService.newObjectMapper());

        assertThatThrownBy(() -> service.optimizeNodes(List.of(), List.of(), CONTEXT))
            .isInstanceOf(ServiceException.class)
            .hasMessage("timeout");
    }

    @Test
    void optimizeNodes_malformedEntry_isSkipped() throws Exception {
        DeepSeekSceneService service = serviceReplying(
            "{\"nodes\": [{\"name\": \"desk\", \"node_type\": \"container\"}, {\"name\": [1, 2]}]}");

        assertThat(service.optimizeNodes(List.of(), List.of(), CONTEXT)).extracting(NodeSpec::name)
            .containsExactly("desk");
    }
}
