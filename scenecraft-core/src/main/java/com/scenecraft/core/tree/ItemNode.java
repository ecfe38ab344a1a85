package com.scenecraft.core.tree;

import com.scenecraft.core.model.NodeType;

import java.time.Instant;

/**
 * Terminal scene element such as an apple, a cup or a key.
 */
public final class ItemNode extends SceneNode {

    private String material = "";
    private String color = "";
    private String size = "";
    private String condition = "";

    public ItemNode(String id, Instant createdAt, String name, String description) {
        super(id, createdAt, name, description);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.ITEM;
    }

    public String material() {
        return material;
    }

    public String color() {
        return color;
    }

    public String size() {
        return size;
    }

    public String condition() {
        return condition;
    }

    /**
     * Sets the physical properties; null values become empty strings.
     *
     * @param material material
     * @param color color
     * @param size size
     * @param condition condition (new, worn, broken, ...)
     */
    public void setPhysical(String material, String color, String size, String condition) {
        this.material = material == null ? "" : material;
        this.color = color == null ? "" : color;
        this.size = size == null ? "" : size;
        this.condition = condition == null ? "" : condition;
    }
}
