package com.scenecraft.core.engine;

import com.scenecraft.core.event.GenerationEventType;
import com.scenecraft.core.model.NodeSpec;
import com.scenecraft.core.model.NodeType;
import com.scenecraft.core.model.OptimizationSuggestion;
import com.scenecraft.core.service.ServiceException;
import com.scenecraft.core.tree.SceneNode;
import com.scenecraft.core.tree.StructuralException;
import com.scenecraft.core.tree.TreeMutator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies an optimizer's consolidated node list to the tree, matching nodes by name.
 *
 * <p>Nodes missing from the list are removed, nodes present in both are converted
 * or updated, and names only present in the list become new roots if admitted. An
 * empty or failed response changes nothing.
 */
final class NodeReconciler {

    private static final Logger log = LoggerFactory.getLogger(NodeReconciler.class);

    /**
     * Requests the optimized node list and reconciles the tree against it.
     *
     * @param run current run
     * @param suggestions suggestions from the analysis
     * @return what changed
     */
    ReconcileResult reconcile(GenerationRun run, List<OptimizationSuggestion> suggestions) {
        List<NodeSpec> optimized;
        try {
            run.counters().recordAiCall();
            optimized = run.service().optimizeNodes(suggestions, run.flatNodes(), run.context());
        } catch (ServiceException | RuntimeException e) {
            log.warn("Optimization call failed, keeping tree unchanged: {}", e.getMessage());
            return ReconcileResult.NONE;
        }
        if (optimized == null || optimized.isEmpty()) {
            log.info("Optimizer returned no nodes, keeping tree unchanged");
            return ReconcileResult.NONE;
        }
        return apply(run, optimized);
    }

    ReconcileResult apply(GenerationRun run, List<NodeSpec> optimized) {
        Map<String, NodeSpec> byName = new LinkedHashMap<>();
        for (NodeSpec spec : optimized) {
            byName.putIfAbsent(spec.name().strip(), spec);
        }

        TreeMutator mutator = run.mutator();
        Set<String> existingNames = new HashSet<>();
        int removed = 0;
        int converted = 0;
        int updated = 0;

        for (SceneNode node : run.scene().flatten()) {
            existingNames.add(node.name());
            // descendants of a removed or converted node are already gone
            if (!run.scene().contains(node)) {
                continue;
            }
            NodeSpec spec = byName.get(node.name());
            try {
                if (spec == null) {
                    mutator.remove(run.scene(), node);
                    removed++;
                    run.emit(GenerationEventType.RECONCILED, "Removed " + node.fullPath(),
                        Map.of("action", "remove", "node", node.fullPath()));
                    continue;
                }
                NodeType target = run.factory().resolveNodeType(spec);
                if (target != node.nodeType()) {
                    TreeMutator.Conversion conversion = mutator.convert(run.scene(), node, target, spec);
                    converted++;
                    run.emit(GenerationEventType.NODE_CONVERTED, "Converted " + node.fullPath(), Map.of(
                        "node", node.fullPath(),
                        "from", node.nodeType().value(),
                        "to", target.value(),
                        "discarded", conversion.discardedNodes()));
                } else if (mutator.update(node, spec)) {
                    updated++;
                }
            } catch (StructuralException e) {
                run.structuralError("reconcile " + node.name(), e);
            }
        }

        int added = 0;
        for (NodeSpec spec : byName.values()) {
            if (existingNames.contains(spec.name().strip())) {
                continue;
            }
            Admission verdict = run.admission().evaluate(spec);
            if (!verdict.isAccepted()) {
                run.emit(GenerationEventType.NODE_REJECTED, "Rejected '" + spec.name() + "'",
                    Map.of("node", spec.name(), "reason", verdict.name()));
                continue;
            }
            if (run.insertRoot(spec) != null) {
                added++;
            }
        }

        ReconcileResult result = new ReconcileResult(added, removed, converted, updated);
        log.info("Reconciled tree: {} added, {} removed, {} converted, {} updated",
            added, removed, converted, updated);
        return result;
    }

    /**
     * Counts of changes made by one reconciliation.
     */
    record ReconcileResult(int added, int removed, int converted, int updated) {
        static final ReconcileResult NONE = new ReconcileResult(0, 0, 0, 0);
    }
}
