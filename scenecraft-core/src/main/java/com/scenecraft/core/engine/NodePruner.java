package com.scenecraft.core.engine;

import com.scenecraft.core.event.GenerationEventType;
import com.scenecraft.core.model.ContainerType;
import com.scenecraft.core.model.NodeType;
import com.scenecraft.core.tree.ContainerNode;
import com.scenecraft.core.tree.SceneNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Removes low-value nodes.
 *
 * <ul>
 *   <li>items with a near-empty description or a placeholder name</li>
 *   <li>childless containers without a description</li>
 *   <li>abstract containers without children</li>
 * </ul>
 */
final class NodePruner {

    private static final Logger log = LoggerFactory.getLogger(NodePruner.class);

    /**
     * Prunes the tree of the given run.
     *
     * @param run current run
     * @return number of nodes pruned (not counting descendants)
     */
    int prune(GenerationRun run) {
        GeneratorConfig config = run.config();
        int pruned = 0;
        for (SceneNode node : run.scene().flatten()) {
            if (!run.scene().contains(node)) {
                continue;
            }
            String reason = reasonToPrune(node, config);
            if (reason != null && run.mutator().remove(run.scene(), node)) {
                pruned++;
                run.emit(GenerationEventType.PRUNED, "Pruned " + node.fullPath(),
                    Map.of("node", node.fullPath(), "reason", reason));
            }
        }
        if (pruned > 0) {
            log.info("Pruned {} node(s)", pruned);
        }
        return pruned;
    }

    static String reasonToPrune(SceneNode node, GeneratorConfig config) {
        if (node.nodeType() == NodeType.ITEM) {
            if (node.description().strip().length() < config.nearEmptyDescriptionLength()) {
                return "near-empty description";
            }
            return config.isPlaceholderName(node.name()) ? "placeholder name" : null;
        }

        ContainerNode container = node.asContainer();
        if (!container.children().isEmpty()) {
            return null;
        }
        if (container.description().isBlank()) {
            return "empty container without description";
        }
        if (container.containerType() == ContainerType.ABSTRACT) {
            return "abstract container without children";
        }
        return null;
    }
}
