package com.scenecraft.core.output;

import com.scenecraft.core.model.TreeStatistics;
import com.scenecraft.core.tree.Scene;
import com.scenecraft.core.tree.SceneNode;

import java.util.List;

/**
 * Renders a scene as a console tree.
 */
public final class TreePrinter {

    private static final int DESCRIPTION_PREVIEW = 50;

    private TreePrinter() {
        // Utility class
    }

    public static String render(Scene scene) {
        StringBuilder out = new StringBuilder();
        out.append("=".repeat(60)).append('\n');
        out.append("Scene: ").append(scene.name()).append('\n');
        out.append("=".repeat(60)).append('\n');

        if (scene.context() != null) {
            out.append("\nContext:\n");
            out.append("  Script: ").append(preview(scene.context().script(), 100)).append('\n');
            out.append("  Requirement: ").append(scene.context().requirement()).append('\n');
            out.append("  Era: ").append(scene.context().era()).append('\n');
        }

        out.append("\nStructure:\n").append("-".repeat(40)).append('\n');
        List<SceneNode> roots = scene.roots();
        for (int i = 0; i < roots.size(); i++) {
            appendNode(out, roots.get(i), "", i == roots.size() - 1);
        }

        TreeStatistics statistics = scene.calculateStatistics();
        out.append("\nStatistics:\n");
        out.append("  Items: ").append(statistics.totalItems()).append('\n');
        out.append("  Containers: ").append(statistics.totalContainers()).append('\n');
        out.append("  Max depth: ").append(statistics.maxDepthReached()).append('\n');
        return out.toString();
    }

    private static void appendNode(StringBuilder out, SceneNode node, String prefix, boolean last) {
        String label = switch (node.nodeType()) {
            case ITEM -> "[item]";
            case CONTAINER -> "[" + node.asContainer().containerType().value() + "]";
        };
        out.append(prefix).append(last ? "└── " : "├── ").append(node.name()).append(' ').append(label).append('\n');

        String childPrefix = prefix + (last ? "    " : "│   ");
        if (!node.description().isBlank()) {
            out.append(childPrefix).append("  ").append(preview(node.description(), DESCRIPTION_PREVIEW)).append('\n');
        }
        if (node.isContainer()) {
            List<SceneNode> children = node.asContainer().children();
            for (int i = 0; i < children.size(); i++) {
                appendNode(out, children.get(i), childPrefix, i == children.size() - 1);
            }
        }
    }

    private static String preview(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
