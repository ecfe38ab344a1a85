package com.scenecraft.core.tree;

import com.scenecraft.core.model.ContainerType;
import com.scenecraft.core.model.NodeType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Scene element that owns an ordered list of children: furniture, a person, a concept.
 *
 * <p>Children keep insertion order. Structural changes to the child list happen only
 * through {@link TreeMutator}. The {@code expanded} flag only ever goes from false to
 * true; a container is "reset" only by replacing it through type conversion.
 */
public final class ContainerNode extends SceneNode {

    private final ContainerType containerType;
    private final int maxDepth;
    private final List<SceneNode> children = new ArrayList<>();
    private boolean expanded;
    private boolean shouldExpand = true;

    public ContainerNode(String id, Instant createdAt, String name, String description,
                         ContainerType containerType, int maxDepth) {
        super(id, createdAt, name, description);
        this.containerType = Objects.requireNonNull(containerType, "containerType must not be null");
        this.maxDepth = maxDepth;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.CONTAINER;
    }

    public ContainerType containerType() {
        return containerType;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Returns the children in insertion order.
     *
     * @return unmodifiable view of the children
     */
    public List<SceneNode> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isExpanded() {
        return expanded;
    }

    /**
     * Marks this container as expanded. Idempotent.
     */
    public void markExpanded() {
        this.expanded = true;
    }

    public boolean shouldExpand() {
        return shouldExpand;
    }

    public void setShouldExpand(boolean shouldExpand) {
        this.shouldExpand = shouldExpand;
    }

    /**
     * Counts item nodes anywhere below this container.
     *
     * @return number of descendant items
     */
    public int countItems() {
        int count = 0;
        for (SceneNode child : children) {
            switch (child.nodeType()) {
                case ITEM -> count++;
                case CONTAINER -> count += child.asContainer().countItems();
            }
        }
        return count;
    }

    /**
     * Counts container nodes in this subtree, including this one.
     *
     * @return number of containers
     */
    public int countContainers() {
        int count = 1;
        for (SceneNode child : children) {
            if (child.nodeType() == NodeType.CONTAINER) {
                count += child.asContainer().countContainers();
            }
        }
        return count;
    }

    /**
     * Returns the deepest level present in this subtree.
     *
     * @return maximum level, at least this container's level
     */
    public int maxDepthBelow() {
        int deepest = level();
        for (SceneNode child : children) {
            int childDepth = child.nodeType() == NodeType.CONTAINER
                ? child.asContainer().maxDepthBelow()
                : child.level();
            deepest = Math.max(deepest, childDepth);
        }
        return deepest;
    }

    /**
     * Counts all nodes below this container, excluding itself.
     *
     * @return number of descendants
     */
    public int countDescendants() {
        int count = 0;
        for (SceneNode child : children) {
            count++;
            if (child.nodeType() == NodeType.CONTAINER) {
                count += child.asContainer().countDescendants();
            }
        }
        return count;
    }

    // Package-private structural access for TreeMutator

    List<SceneNode> mutableChildren() {
        return children;
    }
}
