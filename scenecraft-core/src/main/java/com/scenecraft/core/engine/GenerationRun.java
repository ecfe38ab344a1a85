package com.scenecraft.core.engine;

import com.scenecraft.core.event.GenerationEvent;
import com.scenecraft.core.event.GenerationEventSink;
import com.scenecraft.core.event.GenerationEventType;
import com.scenecraft.core.model.FlatNode;
import com.scenecraft.core.model.NodeSpec;
import com.scenecraft.core.model.SceneContext;
import com.scenecraft.core.service.SceneService;
import com.scenecraft.core.tree.ContainerNode;
import com.scenecraft.core.tree.NodeFactory;
import com.scenecraft.core.tree.Scene;
import com.scenecraft.core.tree.SceneNode;
import com.scenecraft.core.tree.StructuralException;
import com.scenecraft.core.tree.TreeMutator;
import com.scenecraft.core.tree.UpdatePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * State shared by the phases of one generation run.
 *
 * <p>Only the controlling thread touches the scene; workers use the service,
 * factory, admission filter and event sink.
 */
final class GenerationRun {

    private static final Logger log = LoggerFactory.getLogger(GenerationRun.class);

    static final int ANALYSIS_DESCRIPTION_LIMIT = 60;
    static final String ROOT_THEME_PREFIX = "contents of ";
    static final String THEME_SEPARATOR = " > ";

    private final Scene scene;
    private final SceneService service;
    private final GeneratorConfig config;
    private final GenerationCounters counters;
    private final GenerationEventSink sink;
    private final NodeFactory factory;
    private final TreeMutator mutator;
    private final AdmissionFilter admission;

    private volatile int round;
    private int insertedThisRound;

    GenerationRun(Scene scene, SceneService service, GeneratorConfig config, GenerationCounters counters,
                  GenerationEventSink sink, Supplier<String> idSupplier, Clock clock) {
        this.scene = scene;
        this.service = service;
        this.config = config;
        this.counters = counters;
        this.sink = sink;
        this.factory = new NodeFactory(config.maxDepth(), idSupplier, clock,
            message -> emit(GenerationEventType.VALIDATION, message));
        this.mutator = new TreeMutator(factory,
            new UpdatePolicy(config.minDescriptionLength(), config.minDescriptionDelta()));
        this.admission = new AdmissionFilter(config, counters);
    }

    Scene scene() {
        return scene;
    }

    SceneContext context() {
        return scene.context();
    }

    SceneService service() {
        return service;
    }

    GeneratorConfig config() {
        return config;
    }

    GenerationCounters counters() {
        return counters;
    }

    NodeFactory factory() {
        return factory;
    }

    TreeMutator mutator() {
        return mutator;
    }

    AdmissionFilter admission() {
        return admission;
    }

    int round() {
        return round;
    }

    void startRound(int round) {
        this.round = round;
        this.insertedThisRound = 0;
    }

    int insertedThisRound() {
        return insertedThisRound;
    }

    boolean budgetExhausted() {
        return counters.nodesGenerated() >= config.maxTotalNodes();
    }

    void emit(GenerationEventType type, String message, Map<String, Object> data) {
        sink.accept(GenerationEvent.of(type, round, message, data));
    }

    void emit(GenerationEventType type, String message) {
        emit(type, message, Map.of());
    }

    /**
     * Inserts a node, reporting a structural violation instead of propagating it.
     *
     * @param parent owning container, or null for a root
     * @param node detached node
     * @return true if inserted
     */
    boolean insert(ContainerNode parent, SceneNode node) {
        try {
            mutator.insert(scene, parent, node);
            insertedThisRound++;
            return true;
        } catch (StructuralException e) {
            structuralError("insert " + node.name(), e);
            return false;
        }
    }

    /**
     * Inserts a node produced by expanding a container. The node's theme is the
     * container's theme followed by the node's own name.
     *
     * @param container expanded container
     * @param node child produced by the expansion
     * @return true if inserted
     */
    boolean insertExpanded(ContainerNode container, SceneNode node) {
        if (!insert(container, node)) {
            return false;
        }
        node.setTheme(container.theme() + THEME_SEPARATOR + node.name());
        return true;
    }

    /**
     * Creates and inserts a new root node, giving root containers their own theme.
     *
     * @param spec node data
     * @return the inserted node, or null if insertion failed
     */
    SceneNode insertRoot(NodeSpec spec) {
        SceneNode node = factory.create(spec);
        if (node.isContainer()) {
            node.setTheme(ROOT_THEME_PREFIX + node.name());
        }
        return insert(null, node) ? node : null;
    }

    void structuralError(String operation, StructuralException e) {
        log.error("Structural error during {}: {}", operation, e.getMessage());
        emit(GenerationEventType.STRUCTURAL_ERROR, e.getMessage(), Map.of("operation", operation));
    }

    /**
     * Flattens the tree for analysis and optimization prompts.
     *
     * @return flattened nodes in preorder, descriptions truncated
     */
    List<FlatNode> flatNodes() {
        return scene.flatten().stream()
            .map(GenerationRun::toFlatNode)
            .toList();
    }

    private static FlatNode toFlatNode(SceneNode node) {
        String description = node.description();
        if (description.length() > ANALYSIS_DESCRIPTION_LIMIT) {
            description = description.substring(0, ANALYSIS_DESCRIPTION_LIMIT);
        }
        return switch (node.nodeType()) {
            case ITEM -> new FlatNode(node.name(), node.nodeType(), null, node.level(), node.fullPath(),
                description, false, 0);
            case CONTAINER -> {
                ContainerNode container = node.asContainer();
                yield new FlatNode(node.name(), node.nodeType(), container.containerType(), node.level(),
                    node.fullPath(), description, container.isExpanded(), container.children().size());
            }
        };
    }
}
