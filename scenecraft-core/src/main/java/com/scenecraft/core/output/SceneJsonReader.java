package com.scenecraft.core.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scenecraft.core.model.ContainerType;
import com.scenecraft.core.model.GenerationStats;
import com.scenecraft.core.model.NodeType;
import com.scenecraft.core.model.OptimizationSuggestion;
import com.scenecraft.core.model.RoundInfo;
import com.scenecraft.core.model.SceneContext;
import com.scenecraft.core.model.StopReason;
import com.scenecraft.core.tree.ContainerNode;
import com.scenecraft.core.tree.ItemNode;
import com.scenecraft.core.tree.NodeFactory;
import com.scenecraft.core.tree.Scene;
import com.scenecraft.core.tree.SceneNode;
import com.scenecraft.core.tree.TreeMutator;
import com.scenecraft.core.tree.UpdatePolicy;
import com.scenecraft.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads scenes written by {@link JsonSceneWriter}.
 *
 * <p>Levels and parent paths are re-derived from the nesting rather than trusted
 * from the file. Unknown node or container types fall back to item and physical.
 */
public class SceneJsonReader {

    private static final Logger log = LoggerFactory.getLogger(SceneJsonReader.class);

    private static final int UNBOUNDED_DEPTH = Integer.MAX_VALUE;

    private final ObjectMapper mapper = new ObjectMapper();
    private final TreeMutator mutator = new TreeMutator(
        new NodeFactory(UNBOUNDED_DEPTH, IdGenerator::newNodeId, Clock.systemUTC(), null),
        UpdatePolicy.defaults());

    /**
     * Reads a scene file.
     *
     * @param path JSON file
     * @return scene document
     * @throws IOException if the file cannot be read or is not valid JSON
     */
    public SceneDocument read(Path path) throws IOException {
        log.debug("Reading scene from {}", path);
        return parse(Files.readString(path));
    }

    /**
     * Parses scene JSON.
     *
     * @param json JSON text
     * @return scene document
     * @throws IOException if the text is not valid JSON
     */
    public SceneDocument parse(String json) throws IOException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("Scene JSON must be an object");
        }

        Scene scene = new Scene(
            root.path("scene_id").asText(IdGenerator.newSceneId()),
            root.path("scene_name").asText("scene"),
            readContext(root.path("context")));

        for (JsonNode nodeJson : root.path("root_nodes")) {
            SceneNode node = readNode(nodeJson);
            if (node.isContainer()) {
                node.setTheme(nodeJson.path("theme").asText(""));
            }
            mutator.insert(scene, null, node);
            readChildren(scene, node, nodeJson);
        }
        scene.calculateStatistics();

        List<RoundInfo> rounds = new ArrayList<>();
        for (JsonNode roundJson : root.path("rounds")) {
            rounds.add(readRound(roundJson));
        }

        GenerationStats stats = null;
        StopReason stopReason = null;
        JsonNode generation = root.path("generation");
        if (generation.isObject()) {
            stats = new GenerationStats(
                generation.path("total_ai_calls").asInt(),
                generation.path("total_nodes_generated").asInt(),
                generation.path("total_containers_expanded").asInt(),
                Duration.ofMillis(generation.path("generation_time_ms").asLong()),
                scene.statistics());
            stopReason = parseStopReason(generation.path("stop_reason").asText(null));
        }
        return new SceneDocument(scene, stats, rounds, stopReason);
    }

    private void readChildren(Scene scene, SceneNode parent, JsonNode parentJson) {
        if (!parent.isContainer()) {
            return;
        }
        for (JsonNode childJson : parentJson.path("children")) {
            SceneNode child = readNode(childJson);
            mutator.insert(scene, parent.asContainer(), child);
            readChildren(scene, child, childJson);
        }
    }

    private SceneNode readNode(JsonNode json) {
        String id = json.path("node_id").asText(IdGenerator.newNodeId());
        Instant createdAt = parseInstant(json.path("created_at").asText(null));
        String name = json.path("name").asText("");
        String description = json.path("description").asText("");
        NodeType type = NodeType.parse(json.path("node_type").asText(null)).orElse(NodeType.ITEM);

        SceneNode node = switch (type) {
            case ITEM -> {
                ItemNode item = new ItemNode(id, createdAt, name, description);
                item.setPhysical(
                    json.path("material").asText(""),
                    json.path("color").asText(""),
                    json.path("size").asText(""),
                    json.path("condition").asText(""));
                yield item;
            }
            case CONTAINER -> {
                ContainerType containerType = ContainerType.parse(json.path("container_type").asText(null))
                    .orElse(ContainerType.PHYSICAL);
                ContainerNode container = new ContainerNode(id, createdAt, name, description, containerType,
                    json.path("max_depth").asInt(UNBOUNDED_DEPTH));
                container.setShouldExpand(json.path("should_expand").asBoolean(true));
                if (json.path("is_expanded").asBoolean(false)) {
                    container.markExpanded();
                }
                yield container;
            }
        };

        String position = json.path("position").asText(null);
        if (position != null && !position.isBlank()) {
            node.setPosition(position);
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        json.path("attributes").fields().forEachRemaining(entry -> attributes.put(entry.getKey(), entry.getValue().asText()));
        node.putAttributes(attributes);
        return node;
    }

    private SceneContext readContext(JsonNode json) {
        if (!json.isObject()) {
            return null;
        }
        Map<String, String> extra = new LinkedHashMap<>();
        json.path("extra_context").fields().forEachRemaining(entry -> extra.put(entry.getKey(), entry.getValue().asText()));
        return new SceneContext(
            json.path("script").asText(""),
            json.path("scene_requirement").asText(""),
            json.path("era").asText(null),
            json.path("location").asText(""),
            json.path("atmosphere").asText(""),
            json.path("style").asText(""),
            extra);
    }

    private RoundInfo readRound(JsonNode json) throws IOException {
        List<String> expanded = new ArrayList<>();
        json.path("expanded_containers").forEach(name -> expanded.add(name.asText()));
        List<String> issues = new ArrayList<>();
        json.path("issues").forEach(issue -> issues.add(issue.asText()));
        List<OptimizationSuggestion> suggestions = new ArrayList<>();
        for (JsonNode suggestion : json.path("suggestions")) {
            suggestions.add(mapper.treeToValue(suggestion, OptimizationSuggestion.class));
        }
        return new RoundInfo(
            json.path("round_number").asInt(),
            expanded,
            json.path("nodes_added").asInt(),
            json.path("net_node_change").asInt(),
            json.path("summary").asText(""),
            json.path("completeness_score").asInt(),
            issues,
            suggestions);
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return Instant.now();
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Invalid created_at '{}', using current time", value);
            return Instant.now();
        }
    }

    private static StopReason parseStopReason(String value) {
        if (value == null) {
            return null;
        }
        try {
            return StopReason.valueOf(value);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown stop reason '{}'", value);
            return null;
        }
    }
}
