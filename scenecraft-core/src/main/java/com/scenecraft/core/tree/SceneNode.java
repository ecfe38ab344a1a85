package com.scenecraft.core.tree;

import com.scenecraft.core.model.NodeType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class of the two scene node variants, {@link ItemNode} and {@link ContainerNode}.
 *
 * <p>A node never references its owner. Level, parent path and theme are assigned by
 * {@link TreeMutator} when the node is inserted; the setters are package-private for
 * that reason.
 *
 * <p>Callers branch on {@link #nodeType()} and narrow with {@link #asContainer()} or
 * {@link #asItem()}.
 */
public abstract class SceneNode {

    private final String id;
    private final Instant createdAt;

    private final String name;
    private String description;
    private int level;
    private String parentPath = "";
    private String theme = "";
    private String position;
    private final Map<String, String> attributes = new LinkedHashMap<>();

    protected SceneNode(String id, Instant createdAt, String name, String description) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.description = description == null ? "" : description;
    }

    /**
     * Returns the variant discriminant.
     *
     * @return node type
     */
    public abstract NodeType nodeType();

    public boolean isContainer() {
        return nodeType() == NodeType.CONTAINER;
    }

    /**
     * Narrows this node to a container.
     *
     * @return this node as a container
     * @throws StructuralException if this node is an item
     */
    public ContainerNode asContainer() {
        if (nodeType() != NodeType.CONTAINER) {
            throw new StructuralException("Node '" + name + "' is not a container");
        }
        return (ContainerNode) this;
    }

    /**
     * Narrows this node to an item.
     *
     * @return this node as an item
     * @throws StructuralException if this node is a container
     */
    public ItemNode asItem() {
        if (nodeType() != NodeType.ITEM) {
            throw new StructuralException("Node '" + name + "' is not an item");
        }
        return (ItemNode) this;
    }

    /**
     * Returns the slash-joined path from the root to this node.
     *
     * @return parent path plus name, or just the name for roots
     */
    public String fullPath() {
        if (parentPath.isEmpty()) {
            return name;
        }
        return parentPath + "/" + name;
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public int level() {
        return level;
    }

    public String parentPath() {
        return parentPath;
    }

    public String theme() {
        return theme;
    }

    public String position() {
        return position;
    }

    /**
     * Returns the free-form attributes; mutate them through {@link #putAttributes(Map)}.
     *
     * @return unmodifiable view of the attributes
     */
    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    void setLevel(int level) {
        this.level = level;
    }

    void setParentPath(String parentPath) {
        this.parentPath = parentPath == null ? "" : parentPath;
    }

    /**
     * Sets the theme. Insertion below a container overwrites it with the owner's theme.
     *
     * @param theme new theme
     */
    public void setTheme(String theme) {
        this.theme = theme == null ? "" : theme;
    }

    public void setPosition(String position) {
        this.position = position;
    }

    /**
     * Merges attributes into this node, skipping null values.
     *
     * @param values attributes to merge
     */
    public void putAttributes(Map<String, String> values) {
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                attributes.put(key, value);
            }
        });
    }

    @Override
    public String toString() {
        return nodeType().value() + "[" + fullPath() + "]";
    }
}
