package com.scenecraft.core.tree;

import com.scenecraft.core.model.NodeType;
import com.scenecraft.core.model.SceneContext;
import com.scenecraft.core.model.TreeStatistics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A generated scene: the ordered root nodes plus the context they were generated for.
 *
 * <p>The scene exclusively owns its tree. Statistics are never maintained
 * incrementally; {@link #calculateStatistics()} recomputes them from a full walk so
 * pruning and conversion cannot make them drift.
 *
 * <p>All walks here use an explicit stack, so a large user-configured depth budget
 * cannot exhaust the call stack.
 */
public final class Scene {

    private final String id;
    private final String name;
    private final SceneContext context;
    private final List<SceneNode> roots = new ArrayList<>();
    private TreeStatistics statistics = TreeStatistics.empty();

    public Scene(String id, String name, SceneContext context) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.context = context;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public SceneContext context() {
        return context;
    }

    /**
     * Returns the root nodes in insertion order.
     *
     * @return unmodifiable view of the roots
     */
    public List<SceneNode> roots() {
        return Collections.unmodifiableList(roots);
    }

    /**
     * Returns the statistics computed by the last {@link #calculateStatistics()} call.
     *
     * @return last computed statistics
     */
    public TreeStatistics statistics() {
        return statistics;
    }

    /**
     * Recomputes item count, container count and maximum depth from a full walk.
     *
     * @return fresh statistics, also retained for {@link #statistics()}
     */
    public TreeStatistics calculateStatistics() {
        int items = 0;
        int containers = 0;
        int maxDepth = 0;

        Deque<SceneNode> stack = new ArrayDeque<>(roots);
        while (!stack.isEmpty()) {
            SceneNode node = stack.pop();
            maxDepth = Math.max(maxDepth, node.level());
            switch (node.nodeType()) {
                case ITEM -> items++;
                case CONTAINER -> {
                    containers++;
                    node.asContainer().children().forEach(stack::push);
                }
            }
        }

        statistics = new TreeStatistics(items, containers, maxDepth);
        return statistics;
    }

    /**
     * Returns all nodes in preorder (parents before children, siblings in order).
     *
     * @return preorder snapshot of the tree
     */
    public List<SceneNode> flatten() {
        List<SceneNode> result = new ArrayList<>();
        Deque<SceneNode> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }
        while (!stack.isEmpty()) {
            SceneNode node = stack.pop();
            result.add(node);
            if (node.nodeType() == NodeType.CONTAINER) {
                List<SceneNode> children = node.asContainer().children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
        return result;
    }

    /**
     * Returns the number of nodes in the tree.
     *
     * @return node count
     */
    public int nodeCount() {
        return flatten().size();
    }

    /**
     * Finds the first node with the given name in preorder.
     *
     * @param nodeName name to look for
     * @return first match, or empty
     */
    public Optional<SceneNode> findFirstByName(String nodeName) {
        return flatten().stream()
            .filter(node -> node.name().equals(nodeName))
            .findFirst();
    }

    /**
     * Returns all containers that have not been expanded yet, in preorder.
     *
     * @return unexpanded containers
     */
    public List<ContainerNode> unexpandedContainers() {
        return flatten().stream()
            .filter(SceneNode::isContainer)
            .map(SceneNode::asContainer)
            .filter(container -> !container.isExpanded())
            .toList();
    }

    /**
     * Checks whether the node is part of this scene, by identity.
     *
     * @param node node to look for
     * @return true if reachable from the roots
     */
    public boolean contains(SceneNode node) {
        return locate(node).isPresent();
    }

    // ==================== Package-private structural access ====================

    List<SceneNode> mutableRoots() {
        return roots;
    }

    /**
     * Finds the slot holding the node by identity-based depth-first search.
     *
     * @param node node to locate
     * @return slot (owner, index and actual depth), or empty if the node is not in the tree
     */
    Optional<Slot> locate(SceneNode node) {
        for (int i = 0; i < roots.size(); i++) {
            if (roots.get(i) == node) {
                return Optional.of(new Slot(null, i, 0));
            }
        }

        Deque<Frame> stack = new ArrayDeque<>();
        roots.stream()
            .filter(SceneNode::isContainer)
            .forEach(root -> stack.push(new Frame(root.asContainer(), 0)));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            List<SceneNode> children = frame.container().mutableChildren();
            for (int i = 0; i < children.size(); i++) {
                SceneNode child = children.get(i);
                if (child == node) {
                    return Optional.of(new Slot(frame.container(), i, frame.depth() + 1));
                }
                if (child.isContainer()) {
                    stack.push(new Frame(child.asContainer(), frame.depth() + 1));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Position of a node in the tree.
     *
     * @param owner owning container, or null for a root
     * @param index index within the owner's children (or the root list)
     * @param depth actual depth of the node
     */
    record Slot(ContainerNode owner, int index, int depth) {

        List<SceneNode> siblings(Scene scene) {
            return owner == null ? scene.mutableRoots() : owner.mutableChildren();
        }
    }

    private record Frame(ContainerNode container, int depth) {}
}
