package com.scenecraft.core.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scenecraft.core.model.GenerationStats;
import com.scenecraft.core.model.RoundInfo;
import com.scenecraft.core.model.SceneContext;
import com.scenecraft.core.model.TreeStatistics;
import com.scenecraft.core.tree.ContainerNode;
import com.scenecraft.core.tree.ItemNode;
import com.scenecraft.core.tree.Scene;
import com.scenecraft.core.tree.SceneNode;

/**
 * Writes scenes as pretty-printed JSON, readable again by {@link SceneJsonReader}.
 */
public class JsonSceneWriter implements SceneWriter {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public String render(SceneDocument document) {
        try {
            return mapper.writeValueAsString(toJson(document));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize scene " + document.scene().name(), e);
        }
    }

    ObjectNode toJson(SceneDocument document) {
        Scene scene = document.scene();
        ObjectNode root = mapper.createObjectNode();
        root.put("scene_id", scene.id());
        root.put("scene_name", scene.name());
        if (scene.context() != null) {
            root.set("context", contextJson(scene.context()));
        }

        ArrayNode roots = root.putArray("root_nodes");
        scene.roots().forEach(node -> roots.add(nodeJson(node)));

        TreeStatistics statistics = scene.calculateStatistics();
        ObjectNode stats = root.putObject("statistics");
        stats.put("total_items", statistics.totalItems());
        stats.put("total_containers", statistics.totalContainers());
        stats.put("max_depth_reached", statistics.maxDepthReached());

        if (document.stats() != null) {
            GenerationStats run = document.stats();
            ObjectNode generation = root.putObject("generation");
            generation.put("total_ai_calls", run.totalAiCalls());
            generation.put("total_nodes_generated", run.totalNodesGenerated());
            generation.put("total_containers_expanded", run.totalContainersExpanded());
            generation.put("generation_time_ms", run.generationTime().toMillis());
            if (document.stopReason() != null) {
                generation.put("stop_reason", document.stopReason().name());
            }
        }

        if (!document.rounds().isEmpty()) {
            ArrayNode rounds = root.putArray("rounds");
            document.rounds().forEach(round -> rounds.add(roundJson(round)));
        }
        return root;
    }

    private ObjectNode contextJson(SceneContext context) {
        ObjectNode json = mapper.createObjectNode();
        json.put("script", context.script());
        json.put("scene_requirement", context.requirement());
        json.put("era", context.era());
        json.put("location", context.location());
        json.put("atmosphere", context.atmosphere());
        json.put("style", context.style());
        ObjectNode extra = json.putObject("extra_context");
        context.extra().forEach(extra::put);
        return json;
    }

    private ObjectNode nodeJson(SceneNode node) {
        ObjectNode json = mapper.createObjectNode();
        json.put("name", node.name());
        json.put("node_type", node.nodeType().value());
        json.put("description", node.description());
        json.put("level", node.level());
        json.put("parent_path", node.parentPath());
        json.put("theme", node.theme());
        if (node.position() != null) {
            json.put("position", node.position());
        }
        ObjectNode attributes = json.putObject("attributes");
        node.attributes().forEach(attributes::put);
        json.put("node_id", node.id());
        json.put("created_at", node.createdAt().toString());
        json.put("full_path", node.fullPath());

        switch (node.nodeType()) {
            case ITEM -> {
                ItemNode item = node.asItem();
                json.put("material", item.material());
                json.put("color", item.color());
                json.put("size", item.size());
                json.put("condition", item.condition());
            }
            case CONTAINER -> {
                ContainerNode container = node.asContainer();
                json.put("container_type", container.containerType().value());
                json.put("is_expanded", container.isExpanded());
                json.put("should_expand", container.shouldExpand());
                json.put("max_depth", container.maxDepth());
                json.put("item_count", container.countItems());
                json.put("container_count", container.countContainers());
                ArrayNode children = json.putArray("children");
                container.children().forEach(child -> children.add(nodeJson(child)));
            }
        }
        return json;
    }

    private ObjectNode roundJson(RoundInfo round) {
        ObjectNode json = mapper.createObjectNode();
        json.put("round_number", round.roundNumber());
        ArrayNode expanded = json.putArray("expanded_containers");
        round.expandedContainers().forEach(expanded::add);
        json.put("nodes_added", round.nodesAdded());
        json.put("net_node_change", round.netNodeChange());
        json.put("summary", round.summary());
        json.put("completeness_score", round.completenessScore());
        ArrayNode issues = json.putArray("issues");
        round.issues().forEach(issues::add);
        json.set("suggestions", mapper.valueToTree(round.suggestions()));
        return json;
    }
}
