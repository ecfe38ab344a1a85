package com.scenecraft.core.output;

import com.scenecraft.core.tree.ItemNode;
import com.scenecraft.core.tree.SceneNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes scenes as indented plain text, one {@code 【name】} block per node.
 */
public class TextSceneWriter implements SceneWriter {

    private static final String INDENT = "  ";

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    @Override
    public String render(SceneDocument document) {
        List<String> lines = new ArrayList<>();
        for (SceneNode root : document.scene().roots()) {
            appendNode(lines, root, 0);
            lines.add("");
        }
        return String.join("\n", lines);
    }

    private void appendNode(List<String> lines, SceneNode node, int depth) {
        String indent = INDENT.repeat(depth);
        lines.add(indent + "【" + node.name() + "】");
        if (!node.description().isBlank()) {
            lines.add(indent + "description: " + node.description());
        }
        if (node.position() != null && !node.position().isBlank()) {
            lines.add(indent + "position: " + node.position());
        }

        List<String> attributes = new ArrayList<>();
        attributesOf(node).forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                attributes.add(key + ": " + value);
            }
        });
        if (!attributes.isEmpty()) {
            lines.add(indent + "attributes: " + String.join(", ", attributes));
        }

        if (node.isContainer() && !node.asContainer().children().isEmpty()) {
            lines.add(indent + "contains:");
            for (SceneNode child : node.asContainer().children()) {
                appendNode(lines, child, depth + 1);
            }
        }
    }

    private static Map<String, String> attributesOf(SceneNode node) {
        Map<String, String> attributes = new LinkedHashMap<>(node.attributes());
        if (node.isContainer()) {
            return attributes;
        }
        ItemNode item = node.asItem();
        attributes.putIfAbsent("material", item.material());
        attributes.putIfAbsent("color", item.color());
        attributes.putIfAbsent("size", item.size());
        attributes.putIfAbsent("condition", item.condition());
        return attributes;
    }
}
