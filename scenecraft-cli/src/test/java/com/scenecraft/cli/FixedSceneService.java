package com.scenecraft.cli;

import com.scenecraft.core.model.ContainerType;
import com.scenecraft.core.model.ExpansionRequest;
import com.scenecraft.core.model.FlatNode;
import com.scenecraft.core.model.NodeSpec;
import com.scenecraft.core.model.OptimizationSuggestion;
import com.scenecraft.core.model.RoundAnalysis;
import com.scenecraft.core.model.SceneContext;
import com.scenecraft.core.service.SceneService;

import java.util.ArrayList;
import java.util.List;

/**
 * Service returning a fixed desk scene, recording the contexts it was asked about.
 */
class FixedSceneService implements SceneService {

    final List<SceneContext> contexts = new ArrayList<>();

    @Override
    public synchronized List<NodeSpec> generateInitialNodes(SceneContext context) {
        contexts.add(context);
        return List.of(NodeSpec.container("desk", ContainerType.PHYSICAL, "An oak writing desk"));
    }

    @Override
    public List<NodeSpec> expandContainer(ExpansionRequest request, SceneContext context) {
        if (!request.containerName().equals("desk")) {
            return List.of();
        }
        return List.of(
            NodeSpec.item("pen", "A blue ballpoint pen"),
            NodeSpec.item("paper", "Lined paper, stacked"));
    }

    @Override
    public RoundAnalysis analyzeRound(int round, List<FlatNode> nodes, SceneContext context, String previousSummary) {
        return new RoundAnalysis("Desk scene", 95, List.of(), List.of(), List.of(), List.of(), "");
    }

    @Override
    public List<NodeSpec> optimizeNodes(List<OptimizationSuggestion> suggestions, List<FlatNode> nodes,
                                        SceneContext context) {
        return List.of();
    }
}
