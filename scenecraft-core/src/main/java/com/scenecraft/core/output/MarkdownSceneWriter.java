package com.scenecraft.core.output;

import com.scenecraft.core.model.GenerationStats;
import com.scenecraft.core.model.RoundInfo;
import com.scenecraft.core.model.SceneContext;
import com.scenecraft.core.model.TreeStatistics;
import com.scenecraft.core.tree.Scene;
import com.scenecraft.core.tree.SceneNode;

import java.util.List;

/**
 * Writes scenes as a Markdown document: context, nested structure, statistics and,
 * when present, the round log.
 */
public class MarkdownSceneWriter implements SceneWriter {

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public String render(SceneDocument document) {
        Scene scene = document.scene();
        StringBuilder md = new StringBuilder();
        md.append("# Scene: ").append(scene.name()).append("\n\n");

        md.append("## Context\n\n");
        SceneContext context = scene.context();
        if (context == null) {
            md.append("- N/A\n");
        } else {
            md.append("- **Script**: ").append(context.script()).append('\n');
            md.append("- **Requirement**: ").append(context.requirement()).append('\n');
            md.append("- **Era**: ").append(context.era()).append('\n');
            appendIfPresent(md, "Location", context.location());
            appendIfPresent(md, "Atmosphere", context.atmosphere());
            appendIfPresent(md, "Style", context.style());
        }

        md.append("\n## Structure\n\n");
        for (SceneNode node : scene.roots()) {
            appendNode(md, node, 0);
        }

        TreeStatistics statistics = scene.calculateStatistics();
        md.append("\n## Statistics\n\n");
        md.append("- Items: ").append(statistics.totalItems()).append('\n');
        md.append("- Containers: ").append(statistics.totalContainers()).append('\n');
        md.append("- Max depth: ").append(statistics.maxDepthReached()).append('\n');

        GenerationStats stats = document.stats();
        if (stats != null) {
            md.append("- AI calls: ").append(stats.totalAiCalls()).append('\n');
            md.append("- Nodes generated: ").append(stats.totalNodesGenerated()).append('\n');
            md.append("- Containers expanded: ").append(stats.totalContainersExpanded()).append('\n');
        }
        if (document.stopReason() != null) {
            md.append("- Stop reason: ").append(document.stopReason()).append('\n');
        }

        appendRounds(md, document.rounds());
        return md.toString();
    }

    private void appendNode(StringBuilder md, SceneNode node, int depth) {
        String indent = "  ".repeat(depth);
        String kind = switch (node.nodeType()) {
            case ITEM -> "item";
            case CONTAINER -> "container-" + node.asContainer().containerType().value();
        };
        md.append(indent).append("- **").append(node.name()).append("** [").append(kind).append("]\n");
        if (!node.description().isBlank()) {
            md.append(indent).append("  - Description: ").append(node.description()).append('\n');
        }
        if (node.isContainer()) {
            for (SceneNode child : node.asContainer().children()) {
                appendNode(md, child, depth + 1);
            }
        }
    }

    private void appendRounds(StringBuilder md, List<RoundInfo> rounds) {
        if (rounds.isEmpty()) {
            return;
        }
        md.append("\n## Rounds\n\n");
        md.append("| Round | Expanded | Added | Net change | Score |\n");
        md.append("|-------|----------|-------|------------|-------|\n");
        for (RoundInfo round : rounds) {
            md.append("| ").append(round.roundNumber())
                .append(" | ").append(round.expandedContainers().size())
                .append(" | ").append(round.nodesAdded())
                .append(" | ").append(round.netNodeChange())
                .append(" | ").append(round.completenessScore())
                .append(" |\n");
        }
    }

    private static void appendIfPresent(StringBuilder md, String label, String value) {
        if (value != null && !value.isBlank()) {
            md.append("- **").append(label).append("**: ").append(value).append('\n');
        }
    }
}
