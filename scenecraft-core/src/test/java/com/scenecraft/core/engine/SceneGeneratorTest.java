package com.scenecraft.core.engine;

import com.scenecraft.core.event.GenerationEvent;
import com.scenecraft.core.event.GenerationEventType;
import com.scenecraft.core.model.ExpansionTarget;
import com.scenecraft.core.model.OptimizationSuggestion;
import com.scenecraft.core.model.RoundAnalysis;
import com.scenecraft.core.model.RoundInfo;
import com.scenecraft.core.model.StopReason;
import com.scenecraft.core.model.SuggestionAction;
import com.scenecraft.core.tree.ContainerNode;
import com.scenecraft.core.tree.SceneNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.scenecraft.core.engine.TestRuns.CONTEXT;
import static com.scenecraft.core.engine.TestRuns.container;
import static com.scenecraft.core.engine.TestRuns.item;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SceneGenerator}.
 */
class SceneGeneratorTest {

    private static final String DESK = "An oak writing desk with drawers";
    private static final String PEN = "A blue ballpoint pen";
    private static final String PAPER = "Lined paper, stacked";

    private final RecordingSink sink = new RecordingSink();

    private GenerationResult generate(ScriptedSceneService service, GeneratorConfig config) {
        try (SceneGenerator generator = new SceneGenerator(service, config, sink)) {
            return generator.generate(CONTEXT);
        }
    }

    private GenerationResult generateWithRounds(ScriptedSceneService service, GeneratorConfig config) {
        try (SceneGenerator generator = new SceneGenerator(service, config, sink)) {
            return generator.generateWithRounds(CONTEXT);
        }
    }

    private static ContainerNode desk(GenerationResult result) {
        return result.scene().findFirstByName("desk").orElseThrow().asContainer();
    }

    private static List<String> names(List<SceneNode> nodes) {
        return nodes.stream().map(SceneNode::name).toList();
    }

    // ==================== Exhaustive mode ====================

    @Test
    void generate_singleItemSeed_makesNoExpansionCalls() {
        ScriptedSceneService service = new ScriptedSceneService().seed(item("apple", "A red apple on a plate"));

        GenerationResult result = generate(service, GeneratorConfig.defaults());

        assertThat(service.expandCalls()).isZero();
        assertThat(result.stopReason()).isEqualTo(StopReason.ALL_CONTAINERS_EXPANDED);
        assertThat(result.stats().totalAiCalls()).isEqualTo(1);
        assertThat(result.stats().tree().totalItems()).isEqualTo(1);
        assertThat(result.stats().tree().totalContainers()).isZero();
        assertThat(result.stats().tree().maxDepthReached()).isZero();
    }

    @Test
    void generate_deskWithTwoItems_buildsTwoLevelTree() {
        ScriptedSceneService service = new ScriptedSceneService()
            .seed(container("desk", DESK))
            .onExpand("desk", item("pen", PEN), item("paper", PAPER));

        GenerationResult result = generate(service, GeneratorConfig.defaults());

        ContainerNode desk = desk(result);
        assertThat(desk.isExpanded()).isTrue();
        assertThat(names(desk.children())).containsExactly("pen", "paper");
        assertThat(desk.children()).allSatisfy(child -> {
            assertThat(child.level()).isEqualTo(1);
            assertThat(child.parentPath()).isEqualTo("desk");
        });
        assertThat(desk.children().get(0).fullPath()).isEqualTo("desk/pen");
        assertThat(desk.children()).extracting(SceneNode::theme)
            .containsExactly("contents of desk > pen", "contents of desk > paper");
        assertThat(result.stats().tree().totalItems()).isEqualTo(2);
        assertThat(result.stats().tree().totalContainers()).isEqualTo(1);
        assertThat(result.stats().tree().maxDepthReached()).isEqualTo(1);
        assertThat(result.stats().totalAiCalls()).isEqualTo(2);
        assertThat(result.stats().totalContainersExpanded()).isEqualTo(1);
        assertThat(result.stopReason()).isEqualTo(StopReason.ALL_CONTAINERS_EXPANDED);
    }

    @Test
    void generate_shortDescription_rejectsCandidate() {
        ScriptedSceneService service = new ScriptedSceneService()
            .seed(container("desk", DESK))
            .onExpand("desk", item("pen", "A pen"), item("paper", PAPER));

        GenerationResult result = generate(service, GeneratorConfig.defaults());

        assertThat(names(desk(result).children())).containsExactly("paper");
        List<GenerationEvent> rejected = sink.ofType(GenerationEventType.NODE_REJECTED);
        assertThat(rejected).hasSize(1);
        assertThat(rejected.get(0).data())
            .containsEntry("node", "pen")
            .containsEntry("reason", Admission.DESCRIPTION_TOO_SHORT.name());
    }

    @Test
    void generate_depthZero_neverExpandsContainer() {
        ScriptedSceneService service = new ScriptedSceneService()
            .seed(container("desk", DESK))
            .onExpand("desk", item("pen", PEN));

        GenerationResult result = generate(service, GeneratorConfig.builder().maxDepth(0).build());

        assertThat(service.expandCalls()).isZero();
        assertThat(desk(result).isExpanded()).isFalse();
        assertThat(result.stopReason()).isEqualTo(StopReason.DEPTH_LIMIT_REACHED);
    }

    @Test
    void generate_nestedContainers_stopsAtDepthLimit() {
        ScriptedSceneService service = new ScriptedSceneService()
            .seed(container("room", "A cramped scholar's room"))
            .onExpand("room", container("desk", DESK))
            .onExpand("desk", container("drawer", "A shallow drawer with a brass pull"))
            .onExpand("drawer", item("seal", "A jade seal wrapped in silk"));

        GenerationResult result = generate(service, GeneratorConfig.builder().maxDepth(2).build());

        SceneNode drawer = result.scene().findFirstByName("drawer").orElseThrow();
        assertThat(drawer.level()).isEqualTo(2);
        assertThat(drawer.fullPath()).isEqualTo("room/desk/drawer");
        assertThat(drawer.theme()).isEqualTo("contents of room > desk > drawer");
        assertThat(drawer.asContainer().isExpanded()).isFalse();
        assertThat(result.stopReason()).isEqualTo(StopReason.DEPTH_LIMIT_REACHED);
        assertThat(service.expansionRequests).extracting(r -> r.containerName()).containsExactly("room", "desk");
        assertThat(service.expansionRequests).extracting(r -> r.theme())
            .containsExactly("contents of room", "contents of room > desk");
    }

    @Test
    void generate_budgetReached_admitsOnlyRemainingSlots() {
        ScriptedSceneService service = new ScriptedSceneService()
            .seed(container("room", "A cramped scholar's room"))
            .onExpand("room",
                item("inkstone", "An inkstone carved from slate"),
                item("brush", "A wolf-hair writing brush"),
                item("scroll", "A half-unrolled silk scroll"),
                item("lamp", "An oil lamp with a cracked shade"),
                item("teacup", "A celadon teacup, still warm"));

        GenerationResult result = generate(service, GeneratorConfig.builder().maxTotalNodes(3).build());

        assertThat(result.stats().totalNodesGenerated()).isEqualTo(3);
        assertThat(names(result.scene().roots().get(0).asContainer().children())).containsExactly("inkstone", "brush");
        assertThat(sink.ofType(GenerationEventType.NODE_REJECTED))
            .extracting(event -> event.data().get("reason"))
            .containsOnly(Admission.BUDGET_EXHAUSTED.name());
    }

    @Test
    void generate_costControlDisabled_acceptsShortDescriptions() {
        ScriptedSceneService service = new ScriptedSceneService()
            .seed(container("desk", DESK))
            .onExpand("desk", item("pen", "A pen"), item("door", "A door"));

        GenerationResult result = generate(service, GeneratorConfig.builder().costControl(false).build());

        assertThat(names(desk(result).children())).containsExactly("pen", "door");
        assertThat(result.stats().totalNodesGenerated()).isEqualTo(3);
    }

    @Test
    void generate_failedExpansion_marksContainerExpandedWithoutChildren() {
        ScriptedSceneService service = new ScriptedSceneService()
            .seed(container("desk", DESK), container("shelf", "A tall bookshelf of dark wood"))
            .failExpand("desk")
            .onExpand("shelf", item("book", "A worn copy of the Analects"));

        GenerationResult result = generate(service, GeneratorConfig.defaults());

        assertThat(desk(result).isExpanded()).isTrue();
        assertThat(desk(result).children()).isEmpty();
        assertThat(result.stats().totalContainersExpanded()).isEqualTo(1);
        assertThat(result.stopReason()).isEqualTo(StopReason.ALL_CONTAINERS_EXPANDED);
        assertThat(service.expandCalls()).isEqualTo(2);
        assertThat(sink.ofType(GenerationEventType.EXPANSION_FAILED)).hasSize(1);
    }

    @Test
    void generate_parallelWave_respectsConcurrencyLimit() {
        ScriptedSceneService service = new ScriptedSceneService().expandDelay(50);
        for (int i = 1; i <= 6; i++) {
            service.seed(container("box" + i, "A lacquered storage box number " + i));
            service.onExpand("box" + i, item("scroll" + i, "A rolled scroll tied with red cord"));
        }
        GeneratorConfig config = GeneratorConfig.builder().maxConcurrent(2).parallelBatchSize(6).build();

        GenerationResult result = generate(service, config);

        assertThat(service.maxInFlight.get()).isBetween(1, 2);
        assertThat(result.stats().tree().totalItems()).isEqualTo(6);
        assertThat(result.stats().totalContainersExpanded()).isEqualTo(6);
        List<String> rootOrder = names(result.scene().roots());
        assertThat(rootOrder).containsExactly("box1", "box2", "box3", "box4", "box5", "box6");
    }

    @Test
    void generate_seedFailure_returnsEmptyScene() {
        ScriptedSceneService service = new ScriptedSceneService().failSeed();

        GenerationResult result = generate(service, GeneratorConfig.defaults());

        assertThat(result.scene().roots()).isEmpty();
        assertThat(result.stopReason()).isEqualTo(StopReason.ALL_CONTAINERS_EXPANDED);
        assertThat(sink.ofType(GenerationEventType.RUN_COMPLETED)).hasSize(1);
    }

    // ==================== Round mode ====================

    @Test
    void generateWithRounds_singleItem_stopsForInsufficientProgress() {
        ScriptedSceneService service = new ScriptedSceneService().seed(item("apple", "A red apple on a plate"));

        GenerationResult result = generateWithRounds(service, GeneratorConfig.defaults());

        assertThat(service.expandCalls()).isZero();
        assertThat(result.stopReason()).isEqualTo(StopReason.INSUFFICIENT_PROGRESS);
        assertThat(result.rounds()).extracting(RoundInfo::roundNumber).containsExactly(0, 1, 2);
        assertThat(result.rounds().get(0).nodesAdded()).isEqualTo(1);
    }

    @Test
    void generateWithRounds_depthZero_neverExpandsContainer() {
        ScriptedSceneService service = new ScriptedSceneService().seed(container("desk", DESK));

        GenerationResult result = generateWithRounds(service, GeneratorConfig.builder().maxDepth(0).build());

        assertThat(service.expandCalls()).isZero();
        assertThat(desk(result).isExpanded()).isFalse();
        assertThat(result.stopReason()).isEqualTo(StopReason.INSUFFICIENT_PROGRESS);
    }

    @Test
    void generateWithRounds_scoreAboveThreshold_stopsAfterRound() {
        RoundAnalysis analysis = new RoundAnalysis("Desk is nearly complete", 95, List.of(), List.of(),
            List.of(new ExpansionTarget("desk", "still empty", 5)), List.of(), "");
        ScriptedSceneService service = new ScriptedSceneService()
            .seed(container("desk", DESK))
            .onExpand("desk", item("pen", PEN), item("paper", PAPER))
            .thenAnalysis(analysis);

        GenerationResult result = generateWithRounds(service, GeneratorConfig.defaults());

        assertThat(result.stopReason()).isEqualTo(StopReason.COMPLETENESS_REACHED);
        assertThat(service.analyzeCalls.get()).isEqualTo(1);
        assertThat(result.rounds()).hasSize(2);
        RoundInfo round = result.rounds().get(1);
        assertThat(round.completenessScore()).isEqualTo(95);
        assertThat(round.expandedContainers()).containsExactly("desk");
        assertThat(round.nodesAdded()).isEqualTo(2);
        assertThat(round.netNodeChange()).isEqualTo(2);
    }

    @Test
    void generateWithRounds_containerNamedInTwoRounds_isExpandedOnce() {
        List<ExpansionTarget> expandDesk = List.of(new ExpansionTarget("desk", "needs contents", 5));
        ScriptedSceneService service = new ScriptedSceneService()
            .seed(container("desk", DESK))
            .onExpand("desk", item("pen", PEN), item("paper", PAPER))
            .thenAnalysis(new RoundAnalysis("Empty desk", 20, List.of(), List.of(), expandDesk, List.of(), ""))
            .thenAnalysis(new RoundAnalysis("Desk has a pen", 40, List.of(), List.of(), expandDesk, List.of(), ""));

        GenerationResult result = generateWithRounds(service, GeneratorConfig.builder().maxRounds(2).build());

        assertThat(service.analyzeCalls.get()).isEqualTo(2);
        assertThat(service.expandCalls()).isEqualTo(1);
        assertThat(names(desk(result).children())).containsExactly("pen", "paper");
        assertThat(result.rounds()).hasSize(3);
        assertThat(result.rounds().get(1).expandedContainers()).containsExactly("desk");
        assertThat(result.rounds().get(2).expandedContainers()).isEmpty();
    }

    @Test
    void generateWithRounds_maxRoundsZero_onlySeeds() {
        ScriptedSceneService service = new ScriptedSceneService().seed(container("desk", DESK));

        GenerationResult result = generateWithRounds(service, GeneratorConfig.builder().maxRounds(0).build());

        assertThat(result.stopReason()).isEqualTo(StopReason.MAX_ROUNDS_REACHED);
        assertThat(result.rounds()).hasSize(1);
        assertThat(service.analyzeCalls.get()).isZero();
    }

    @Test
    void generateWithRounds_suggestions_reconcileBeforeExpanding() {
        OptimizationSuggestion removeLamp = new OptimizationSuggestion(SuggestionAction.REMOVE, "lamp",
            "lamp does not fit the era", null);
        RoundAnalysis analysis = new RoundAnalysis("Lamp is anachronistic", 40, List.of("anachronism"),
            List.of(removeLamp), List.of(), List.of(), "desk contents");
        ScriptedSceneService service = new ScriptedSceneService()
            .seed(container("desk", DESK), item("lamp", "An electric desk lamp"))
            .onExpand("desk", item("pen", PEN), item("paper", PAPER))
            .thenAnalysis(analysis)
            .thenOptimize(List.of(container("desk", DESK)));

        GenerationResult result = generateWithRounds(service, GeneratorConfig.builder().maxRounds(1).build());

        assertThat(result.stopReason()).isEqualTo(StopReason.MAX_ROUNDS_REACHED);
        assertThat(names(result.scene().roots())).containsExactly("desk");
        assertThat(names(desk(result).children())).containsExactly("pen", "paper");
        assertThat(service.optimizeCalls.get()).isEqualTo(1);
        assertThat(result.stats().totalAiCalls()).isEqualTo(4);
        RoundInfo round = result.rounds().get(1);
        assertThat(round.netNodeChange()).isEqualTo(1);
        assertThat(round.suggestions()).containsExactly(removeLamp);
    }

    @Test
    void generateWithRounds_passesPreviousSummaryToNextAnalysis() {
        RoundAnalysis first = new RoundAnalysis("Round one summary", 10, List.of(), List.of(), List.of(), List.of(), "");
        ScriptedSceneService service = new ScriptedSceneService()
            .seed(item("apple", "A red apple on a plate"))
            .thenAnalysis(first);

        generateWithRounds(service, GeneratorConfig.defaults());

        assertThat(service.previousSummaries).containsExactly("", "Round one summary");
    }

    @Test
    void generateWithRounds_emitsLifecycleEvents() {
        ScriptedSceneService service = new ScriptedSceneService().seed(container("desk", DESK));

        generateWithRounds(service, GeneratorConfig.builder().maxRounds(1).build());

        List<GenerationEvent> events = sink.all();
        assertThat(events.get(0).type()).isEqualTo(GenerationEventType.RUN_STARTED);
        assertThat(events.get(events.size() - 1).type()).isEqualTo(GenerationEventType.RUN_COMPLETED);
        assertThat(sink.ofType(GenerationEventType.ROUND_COMPLETED)).hasSize(1);
        assertThat(sink.ofType(GenerationEventType.SEEDED)).hasSize(1);
    }
}
