package com.scenecraft.core.tree;

import com.scenecraft.core.model.NodeSpec;
import com.scenecraft.core.model.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Structural edits on a {@link Scene}: insert, remove, update and type conversion.
 *
 * <p>Owners are always found by walking down from the scene's roots; nodes carry no
 * parent pointer. The mutator holds only immutable configuration and may be shared,
 * but a given scene must only be mutated from one thread at a time.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TreeMutator mutator = new TreeMutator(factory, UpdatePolicy.defaults());
 * SceneNode desk = factory.create(NodeSpec.container("desk", ContainerType.PHYSICAL, "An oak desk"));
 * mutator.insert(scene, null, desk);
 * mutator.insert(scene, desk.asContainer(), factory.create(NodeSpec.item("pen", "A fountain pen")));
 * }</pre>
 */
public final class TreeMutator {

    private static final Logger log = LoggerFactory.getLogger(TreeMutator.class);

    private final NodeFactory factory;
    private final UpdatePolicy updatePolicy;

    public TreeMutator(NodeFactory factory, UpdatePolicy updatePolicy) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.updatePolicy = Objects.requireNonNull(updatePolicy, "updatePolicy must not be null");
    }

    /**
     * Appends a detached node to a container, or to the root list when {@code parent}
     * is null. Sets the node's level, parent path and theme, and re-bases any subtree
     * the node already carries.
     *
     * @param scene scene to modify
     * @param parent owning container, or null to insert a root
     * @param node detached node to insert
     * @throws StructuralException if the parent is not part of the scene, its recorded
     *         level disagrees with its actual depth, or the node (or part of its
     *         subtree) is already attached to the scene
     */
    public void insert(Scene scene, ContainerNode parent, SceneNode node) {
        Objects.requireNonNull(scene, "scene must not be null");
        Objects.requireNonNull(node, "node must not be null");

        if (scene.contains(node)) {
            throw new StructuralException("Node '" + node.name() + "' is already attached to the scene");
        }
        if (node.isContainer() && subtreeTouchesScene(scene, node.asContainer())) {
            throw new StructuralException("Subtree of '" + node.name() + "' is already attached to the scene");
        }

        if (parent == null) {
            node.setLevel(0);
            node.setParentPath("");
            rebaseChildren(node);
            scene.mutableRoots().add(node);
            return;
        }

        Scene.Slot parentSlot = scene.locate(parent).orElseThrow(() ->
            new StructuralException("Parent '" + parent.name() + "' is not part of the scene"));
        if (parentSlot.depth() != parent.level()) {
            throw new StructuralException("Level mismatch: parent '" + parent.fullPath() + "' records level "
                + parent.level() + " but sits at depth " + parentSlot.depth());
        }

        attachTo(parent, node);
        rebaseChildren(node);
        parent.mutableChildren().add(node);
    }

    /**
     * Removes a node, and with it its whole subtree. Removing a node that is not in
     * the scene is a no-op.
     *
     * @param scene scene to modify
     * @param node node to remove
     * @return true if the node was found and removed
     */
    public boolean remove(Scene scene, SceneNode node) {
        Optional<Scene.Slot> slot = scene.locate(node);
        if (slot.isEmpty()) {
            log.debug("Remove skipped, node not in scene: {}", node);
            return false;
        }
        slot.get().siblings(scene).remove(slot.get().index());
        log.debug("Removed {}", node);
        return true;
    }

    /**
     * Refreshes description, position and attributes in place, applying only the
     * deltas the {@link UpdatePolicy} considers worthwhile.
     *
     * @param node node to update
     * @param spec new data
     * @return true if any field changed
     */
    public boolean update(SceneNode node, NodeSpec spec) {
        boolean changed = false;

        if (updatePolicy.isDescriptionUpdateWorthy(node.description(), spec.description())) {
            node.setDescription(spec.description().strip());
            changed = true;
        }
        if (updatePolicy.isValueUpdateWorthy(node.position(), spec.position())) {
            node.setPosition(spec.position().strip());
            changed = true;
        }

        for (var entry : NodeFactory.stringAttributes(spec).entrySet()) {
            if (updatePolicy.isValueUpdateWorthy(node.attributes().get(entry.getKey()), entry.getValue())) {
                node.putAttributes(Map.of(entry.getKey(), entry.getValue()));
                changed = true;
            }
        }

        if (node.nodeType() == NodeType.ITEM) {
            changed |= updatePhysical(node.asItem(), spec);
        }
        return changed;
    }

    /**
     * Replaces a node with a node of another variant in the same sibling slot.
     *
     * <p>Name, level, parent path, theme, position, id and creation time carry over.
     * Converting a container to an item discards its entire subtree. Converting a
     * node to its own type degrades to {@link #update(SceneNode, NodeSpec)}.
     *
     * @param scene scene to modify
     * @param node node to convert
     * @param targetType variant to convert to
     * @param spec data for the new node
     * @return the installed node and the number of discarded descendants
     * @throws StructuralException if the node is not part of the scene
     */
    public Conversion convert(Scene scene, SceneNode node, NodeType targetType, NodeSpec spec) {
        Scene.Slot slot = scene.locate(node).orElseThrow(() ->
            new StructuralException("Cannot convert '" + node.name() + "': owner not found"));

        if (node.nodeType() == targetType) {
            update(node, spec);
            return new Conversion(node, 0);
        }

        String description = spec.description().isBlank() ? node.description() : spec.description().strip();
        int discarded = 0;

        SceneNode replacement = switch (targetType) {
            case ITEM -> {
                ContainerNode container = node.asContainer();
                discarded = container.countDescendants();
                if (discarded > 0) {
                    log.warn("Converting container '{}' to item discards {} descendant node(s)",
                        container.fullPath(), discarded);
                }
                ItemNode item = new ItemNode(node.id(), node.createdAt(), node.name(), description);
                NodeFactory.applyPhysical(item, spec);
                yield item;
            }
            case CONTAINER -> {
                ContainerNode container = new ContainerNode(node.id(), node.createdAt(), node.name(), description,
                    factory.resolveContainerType(spec), factory.maxDepth());
                container.setShouldExpand(spec.shouldExpand() == null || spec.shouldExpand());
                yield container;
            }
        };

        replacement.setLevel(node.level());
        replacement.setParentPath(node.parentPath());
        replacement.setTheme(node.theme());
        replacement.setPosition(spec.position() == null || spec.position().isBlank() ? node.position() : spec.position());
        replacement.putAttributes(node.attributes());
        replacement.putAttributes(NodeFactory.stringAttributes(spec));

        slot.siblings(scene).set(slot.index(), replacement);
        log.info("Converted '{}' from {} to {}", node.fullPath(), node.nodeType().value(), targetType.value());
        return new Conversion(replacement, discarded);
    }

    /**
     * Outcome of a type conversion.
     *
     * @param node node now occupying the slot
     * @param discardedNodes descendants dropped by a container-to-item conversion
     */
    public record Conversion(SceneNode node, int discardedNodes) {}

    // ==================== Helpers ====================

    private boolean updatePhysical(ItemNode item, NodeSpec spec) {
        String material = pick(item.material(), spec.attribute("material"));
        String color = pick(item.color(), spec.attribute("color"));
        String size = pick(item.size(), spec.attribute("size"));
        String condition = pick(item.condition(), spec.attribute("condition"));

        boolean changed = !material.equals(item.material()) || !color.equals(item.color())
            || !size.equals(item.size()) || !condition.equals(item.condition());
        if (changed) {
            item.setPhysical(material, color, size, condition);
        }
        return changed;
    }

    private String pick(String current, String candidate) {
        return updatePolicy.isValueUpdateWorthy(current, candidate) ? candidate.strip() : current;
    }

    private static void attachTo(ContainerNode parent, SceneNode node) {
        node.setLevel(parent.level() + 1);
        node.setParentPath(parent.fullPath());
        node.setTheme(parent.theme());
    }

    /**
     * Re-derives level, path and theme for everything below the node.
     */
    private static void rebaseChildren(SceneNode node) {
        if (!node.isContainer()) {
            return;
        }
        Deque<ContainerNode> stack = new ArrayDeque<>();
        stack.push(node.asContainer());
        while (!stack.isEmpty()) {
            ContainerNode container = stack.pop();
            for (SceneNode child : container.mutableChildren()) {
                attachTo(container, child);
                if (child.isContainer()) {
                    stack.push(child.asContainer());
                }
            }
        }
    }

    private static boolean subtreeTouchesScene(Scene scene, ContainerNode root) {
        Deque<ContainerNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            List<SceneNode> children = stack.pop().mutableChildren();
            for (SceneNode child : children) {
                if (scene.contains(child)) {
                    return true;
                }
                if (child.isContainer()) {
                    stack.push(child.asContainer());
                }
            }
        }
        return false;
    }
}
