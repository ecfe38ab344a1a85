package com.scenecraft.core.service;

import com.scenecraft.core.model.ExpansionRequest;
import com.scenecraft.core.model.FlatNode;
import com.scenecraft.core.model.NodeSpec;
import com.scenecraft.core.model.OptimizationSuggestion;
import com.scenecraft.core.model.RoundAnalysis;
import com.scenecraft.core.model.SceneContext;

import java.util.List;

/**
 * Generative back end that proposes, analyzes and refines scene nodes.
 *
 * <p>Implementations must be safe to call from several threads at once; the
 * expansion scheduler issues one wave of {@link #expandContainer} calls
 * concurrently.
 */
public interface SceneService {

    /**
     * Proposes the root nodes of a new scene.
     *
     * @param context scene context
     * @return candidate root nodes, possibly empty
     * @throws ServiceException if the call or its payload fails
     */
    List<NodeSpec> generateInitialNodes(SceneContext context) throws ServiceException;

    /**
     * Proposes the children of one container.
     *
     * @param request container to expand
     * @param context scene context
     * @return candidate children, possibly empty
     * @throws ServiceException if the call or its payload fails
     */
    List<NodeSpec> expandContainer(ExpansionRequest request, SceneContext context) throws ServiceException;

    /**
     * Analyzes the current tree and recommends what to do next.
     *
     * @param round round number (1-based)
     * @param nodes flattened tree
     * @param context scene context
     * @param previousSummary summary of the previous round, empty for round 1
     * @return analysis
     * @throws ServiceException if the call or its payload fails
     */
    RoundAnalysis analyzeRound(int round, List<FlatNode> nodes, SceneContext context, String previousSummary)
        throws ServiceException;

    /**
     * Produces a consolidated node list with the suggestions applied.
     *
     * @param suggestions edits to apply
     * @param nodes flattened tree
     * @param context scene context
     * @return updated node list, possibly empty
     * @throws ServiceException if the call or its payload fails
     */
    List<NodeSpec> optimizeNodes(List<OptimizationSuggestion> suggestions, List<FlatNode> nodes, SceneContext context)
        throws ServiceException;
}
