package com.scenecraft.core.tree;

import com.scenecraft.core.model.ContainerType;
import com.scenecraft.core.model.NodeSpec;
import com.scenecraft.core.model.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Turns service-provided {@link NodeSpec}s into detached tree nodes.
 *
 * <p>Unrecognized {@code node_type} or {@code container_type} values are not fatal:
 * they fall back to {@link NodeType#ITEM} and {@link ContainerType#PHYSICAL}, are
 * logged, and are reported to the validation listener.
 *
 * <p>Created nodes have level 0 and no parent path; {@link TreeMutator#insert}
 * assigns both.
 */
public final class NodeFactory {

    private static final Logger log = LoggerFactory.getLogger(NodeFactory.class);

    static final String UNNAMED_ITEM = "unnamed item";
    static final String UNNAMED_CONTAINER = "unnamed container";

    /** Attribute keys that map onto dedicated item fields. */
    static final Set<String> PHYSICAL_KEYS = Set.of("material", "color", "size", "condition");

    private final int maxDepth;
    private final Supplier<String> idSupplier;
    private final Clock clock;
    private final Consumer<String> validationListener;

    /**
     * Creates a factory.
     *
     * @param maxDepth depth budget copied into every new container
     * @param idSupplier source of unique node ids
     * @param clock clock for creation timestamps
     * @param validationListener receives a message for each recovered validation anomaly
     */
    public NodeFactory(int maxDepth, Supplier<String> idSupplier, Clock clock, Consumer<String> validationListener) {
        this.maxDepth = maxDepth;
        this.idSupplier = Objects.requireNonNull(idSupplier, "idSupplier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.validationListener = validationListener == null ? message -> { } : validationListener;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Creates a detached node from a spec.
     *
     * @param spec service-provided node data
     * @return new item or container
     */
    public SceneNode create(NodeSpec spec) {
        NodeType type = resolveNodeType(spec);
        String id = idSupplier.get();
        Instant now = clock.instant();

        SceneNode node = switch (type) {
            case ITEM -> {
                ItemNode item = new ItemNode(id, now, nameOrDefault(spec, UNNAMED_ITEM), spec.description());
                applyPhysical(item, spec);
                yield item;
            }
            case CONTAINER -> {
                ContainerNode container = new ContainerNode(id, now, nameOrDefault(spec, UNNAMED_CONTAINER),
                    spec.description(), resolveContainerType(spec), maxDepth);
                container.setShouldExpand(spec.shouldExpand() == null || spec.shouldExpand());
                yield container;
            }
        };
        node.setPosition(blankToNull(spec.position()));
        node.putAttributes(stringAttributes(spec));
        return node;
    }

    /**
     * Parses the candidate's node type, falling back to {@link NodeType#ITEM}.
     *
     * @param spec node data
     * @return parsed or fallback node type
     */
    public NodeType resolveNodeType(NodeSpec spec) {
        return NodeType.parse(spec.nodeType()).orElseGet(() -> {
            if (spec.nodeType() != null) {
                reportAnomaly("Unknown node_type '" + spec.nodeType() + "' for '" + spec.name() + "', using item");
            }
            return NodeType.ITEM;
        });
    }

    /**
     * Parses the candidate's container type, falling back to {@link ContainerType#PHYSICAL}.
     *
     * @param spec node data
     * @return parsed or fallback container type
     */
    public ContainerType resolveContainerType(NodeSpec spec) {
        return ContainerType.parse(spec.containerType()).orElseGet(() -> {
            if (spec.containerType() != null) {
                reportAnomaly("Unknown container_type '" + spec.containerType() + "' for '" + spec.name()
                    + "', using physical");
            }
            return ContainerType.PHYSICAL;
        });
    }

    /**
     * Converts the candidate's attributes to strings, dropping null values.
     *
     * @param spec node data
     * @return attributes as strings, in spec order
     */
    static Map<String, String> stringAttributes(NodeSpec spec) {
        Map<String, String> result = new LinkedHashMap<>();
        spec.attributes().forEach((key, value) -> {
            if (value != null) {
                result.put(key, String.valueOf(value));
            }
        });
        return result;
    }

    static void applyPhysical(ItemNode item, NodeSpec spec) {
        item.setPhysical(
            spec.attribute("material"),
            spec.attribute("color"),
            spec.attribute("size"),
            spec.attribute("condition")
        );
    }

    private void reportAnomaly(String message) {
        log.warn(message);
        validationListener.accept(message);
    }

    private static String nameOrDefault(NodeSpec spec, String fallback) {
        return spec.name().isBlank() ? fallback : spec.name().strip();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
