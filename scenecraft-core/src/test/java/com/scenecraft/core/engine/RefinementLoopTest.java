package com.scenecraft.core.engine;

import com.scenecraft.core.model.ExpansionTarget;
import com.scenecraft.core.model.RoundAnalysis;
import com.scenecraft.core.model.StopReason;
import com.scenecraft.core.tree.ContainerNode;
import com.scenecraft.core.tree.SceneNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.scenecraft.core.engine.TestRuns.container;
import static com.scenecraft.core.engine.TestRuns.item;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RefinementLoop} wave selection and stop evaluation.
 */
class RefinementLoopTest {

    private final GeneratorConfig config = GeneratorConfig.builder().maxDepth(2).build();
    private GenerationRun run;
    private ContainerNode desk;
    private ContainerNode shelf;
    private ContainerNode drawer;

    @BeforeEach
    void setUp() {
        run = TestRuns.newRun(new ScriptedSceneService(), config);
        desk = run.insertRoot(container("desk", "An oak writing desk")).asContainer();
        shelf = run.insertRoot(container("shelf", "A bookshelf of dark wood")).asContainer();
        run.insertRoot(item("lamp", "An oil lamp with a glass chimney"));
        drawer = run.factory().create(container("drawer", "A shallow drawer")).asContainer();
        run.insert(desk, drawer);
        desk.markExpanded();
    }

    private static RoundAnalysis analysis(List<ExpansionTarget> targets, List<String> stop) {
        return new RoundAnalysis("", 50, List.of(), List.of(), targets, stop, "");
    }

    private static List<String> names(List<ContainerNode> wave) {
        return wave.stream().map(SceneNode::name).toList();
    }

    // ==================== selectWave ====================

    @Test
    void selectWave_noTargets_fallsBackToExpandableContainers() {
        List<ContainerNode> wave = RefinementLoop.selectWave(run.scene(), analysis(List.of(), List.of()), config);

        assertThat(names(wave)).containsExactly("drawer", "shelf");
    }

    @Test
    void selectWave_noTargets_skipsStoppedAndUnwantedContainers() {
        shelf.setShouldExpand(false);

        List<ContainerNode> wave = RefinementLoop.selectWave(run.scene(),
            analysis(List.of(), List.of("drawer")), config);

        assertThat(wave).isEmpty();
    }

    @Test
    void selectWave_targets_orderedByPriorityAndDeduplicated() {
        List<ExpansionTarget> targets = List.of(
            new ExpansionTarget("shelf", "books", 2),
            new ExpansionTarget("drawer", "hidden letters", 5),
            new ExpansionTarget("shelf", "again", 4),
            new ExpansionTarget("lamp", "not a container", 3),
            new ExpansionTarget("ghost", "does not exist", 5),
            new ExpansionTarget("desk", "already expanded", 5));

        List<ContainerNode> wave = RefinementLoop.selectWave(run.scene(), analysis(targets, List.of()), config);

        assertThat(names(wave)).containsExactly("drawer", "shelf");
    }

    @Test
    void selectWave_onlyExpandedTarget_yieldsEmptyWave() {
        List<ContainerNode> wave = RefinementLoop.selectWave(run.scene(),
            analysis(List.of(new ExpansionTarget("desk", "more stationery", 5)), List.of()), config);

        assertThat(wave).isEmpty();
    }

    @Test
    void selectWave_targetAtDepthLimit_isSkipped() {
        List<ContainerNode> wave = RefinementLoop.selectWave(run.scene(),
            analysis(List.of(new ExpansionTarget("drawer", "", 5)), List.of()),
            config.toBuilder().maxDepth(1).build());

        assertThat(wave).isEmpty();
    }

    @Test
    void selectWave_stoppedTarget_isSkipped() {
        List<ContainerNode> wave = RefinementLoop.selectWave(run.scene(),
            analysis(List.of(new ExpansionTarget("shelf", "", 5)), List.of("shelf")), config);

        assertThat(wave).isEmpty();
    }

    // ==================== evaluate ====================

    @Test
    void evaluate_scoreAtThreshold_reachesCompleteness() {
        assertThat(RefinementLoop.evaluate(run, 1, 90, 0)).contains(StopReason.COMPLETENESS_REACHED);
    }

    @Test
    void evaluate_firstRound_ignoresLowProgress() {
        assertThat(RefinementLoop.evaluate(run, 1, 10, 0)).isEmpty();
    }

    @Test
    void evaluate_laterRoundWithLowProgress_stops() {
        assertThat(RefinementLoop.evaluate(run, 2, 10, 2)).contains(StopReason.INSUFFICIENT_PROGRESS);
    }

    @Test
    void evaluate_lastRound_reachesMaxRounds() {
        assertThat(RefinementLoop.evaluate(run, 5, 10, 10)).contains(StopReason.MAX_ROUNDS_REACHED);
    }

    @Test
    void evaluate_budgetExhausted_takesPriorityOverMaxRounds() {
        GenerationRun small = TestRuns.newRun(new ScriptedSceneService(),
            GeneratorConfig.builder().maxTotalNodes(1).maxRounds(1).build());
        small.counters().recordNode();

        assertThat(RefinementLoop.evaluate(small, 1, 10, 10)).contains(StopReason.NODE_BUDGET_EXHAUSTED);
    }
}
