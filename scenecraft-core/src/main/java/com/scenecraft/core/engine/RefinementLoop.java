package com.scenecraft.core.engine;

import com.scenecraft.core.event.GenerationEventType;
import com.scenecraft.core.model.ExpansionTarget;
import com.scenecraft.core.model.RoundAnalysis;
import com.scenecraft.core.model.RoundInfo;
import com.scenecraft.core.model.StopReason;
import com.scenecraft.core.service.ServiceException;
import com.scenecraft.core.tree.ContainerNode;
import com.scenecraft.core.tree.Scene;
import com.scenecraft.core.tree.SceneNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Round-based generation: seed once, then analyze, optimize, prune, expand and
 * evaluate until a stop condition holds.
 *
 * <p>Stop conditions, in priority order:
 * <ol>
 *   <li>completeness score at or above the threshold</li>
 *   <li>net new nodes below the minimum (from round 2)</li>
 *   <li>node budget exhausted</li>
 *   <li>round limit reached</li>
 * </ol>
 */
final class RefinementLoop {

    private static final Logger log = LoggerFactory.getLogger(RefinementLoop.class);

    private final ExpansionScheduler scheduler;
    private final SceneSeeder seeder = new SceneSeeder();
    private final NodeReconciler reconciler = new NodeReconciler();
    private final NodePruner pruner = new NodePruner();

    RefinementLoop(ExpansionScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Runs the loop to completion.
     *
     * @param run current run
     * @param rounds round log to append to
     * @return why the loop stopped
     */
    StopReason run(GenerationRun run, List<RoundInfo> rounds) {
        GeneratorConfig config = run.config();
        Scene scene = run.scene();

        run.startRound(0);
        phase(run, LoopPhase.SEED);
        int seeded = seeder.seed(run);
        rounds.add(new RoundInfo(0, List.of(), seeded, seeded, "Initial nodes generated", 0, List.of(), List.of()));

        if (config.maxRounds() == 0) {
            phase(run, LoopPhase.DONE);
            return StopReason.MAX_ROUNDS_REACHED;
        }

        String previousSummary = "";
        for (int round = 1; ; round++) {
            run.startRound(round);
            int sizeBefore = scene.nodeCount();
            log.info("Round {} started with {} node(s)", round, sizeBefore);

            phase(run, LoopPhase.ANALYZE);
            RoundAnalysis analysis = analyze(run, round, previousSummary);

            phase(run, LoopPhase.OPTIMIZE);
            if (!analysis.optimizationSuggestions().isEmpty()) {
                reconciler.reconcile(run, analysis.optimizationSuggestions());
            }

            phase(run, LoopPhase.PRUNE);
            if (config.aggressivePruning() && round % 2 == 0) {
                pruner.prune(run);
            }

            phase(run, LoopPhase.EXPAND);
            List<String> expanded = List.of();
            if (run.budgetExhausted()) {
                log.info("Node budget of {} exhausted, skipping expansion", config.maxTotalNodes());
            } else {
                List<ContainerNode> wave = selectWave(scene, analysis, config);
                expanded = scheduler.runWave(run, wave).expandedContainers();
            }

            phase(run, LoopPhase.EVALUATE);
            int netChange = scene.nodeCount() - sizeBefore;
            rounds.add(new RoundInfo(round, expanded, run.insertedThisRound(), netChange, analysis.summary(),
                analysis.completenessScore(), analysis.issuesFound(), analysis.optimizationSuggestions()));
            run.emit(GenerationEventType.ROUND_COMPLETED, "Round " + round + " completed", Map.of(
                "score", analysis.completenessScore(),
                "expanded", expanded.size(),
                "nodesAdded", run.insertedThisRound(),
                "netChange", netChange));

            Optional<StopReason> stop = evaluate(run, round, analysis.completenessScore(), netChange);
            if (stop.isPresent()) {
                log.info("Stopping after round {}: {}", round, stop.get());
                phase(run, LoopPhase.DONE);
                return stop.get();
            }
            previousSummary = analysis.summary();
        }
    }

    private RoundAnalysis analyze(GenerationRun run, int round, String previousSummary) {
        try {
            run.counters().recordAiCall();
            RoundAnalysis analysis = run.service().analyzeRound(round, run.flatNodes(), run.context(), previousSummary);
            if (analysis == null) {
                return RoundAnalysis.empty();
            }
            run.emit(GenerationEventType.ANALYSIS_COMPLETED, "Completeness " + analysis.completenessScore(), Map.of(
                "score", analysis.completenessScore(),
                "issues", analysis.issuesFound().size(),
                "suggestions", analysis.optimizationSuggestions().size()));
            return analysis;
        } catch (ServiceException | RuntimeException e) {
            log.warn("Round {} analysis failed, continuing with an empty analysis: {}", round, e.getMessage());
            return RoundAnalysis.empty();
        }
    }

    static Optional<StopReason> evaluate(GenerationRun run, int round, int score, int netChange) {
        GeneratorConfig config = run.config();
        if (score >= config.completenessThreshold()) {
            return Optional.of(StopReason.COMPLETENESS_REACHED);
        }
        if (round > 1 && netChange < config.minNewNodesPerRound()) {
            return Optional.of(StopReason.INSUFFICIENT_PROGRESS);
        }
        if (run.budgetExhausted()) {
            return Optional.of(StopReason.NODE_BUDGET_EXHAUSTED);
        }
        if (round >= config.maxRounds()) {
            return Optional.of(StopReason.MAX_ROUNDS_REACHED);
        }
        return Optional.empty();
    }

    /**
     * Resolves the containers to expand this round.
     *
     * @param scene current scene
     * @param analysis analysis of this round
     * @param config run configuration
     * @return containers in descending priority, or every expandable container when
     *         the analysis names none
     */
    static List<ContainerNode> selectWave(Scene scene, RoundAnalysis analysis, GeneratorConfig config) {
        Set<String> stop = Set.copyOf(analysis.containersToStop());

        if (analysis.containersToExpandNext().isEmpty()) {
            return scene.unexpandedContainers().stream()
                .filter(ContainerNode::shouldExpand)
                .filter(container -> container.level() < config.maxDepth())
                .filter(container -> !stop.contains(container.name()))
                .toList();
        }

        List<ExpansionTarget> targets = new ArrayList<>(analysis.containersToExpandNext());
        targets.sort(Comparator.comparingInt(ExpansionTarget::priority).reversed());

        Set<ContainerNode> selected = Collections.newSetFromMap(new IdentityHashMap<>());
        List<ContainerNode> wave = new ArrayList<>();
        for (ExpansionTarget target : targets) {
            Optional<SceneNode> match = scene.findFirstByName(target.name());
            if (match.isEmpty() || !match.get().isContainer()) {
                log.warn("Cannot expand '{}': no such container", target.name());
                continue;
            }
            ContainerNode container = match.get().asContainer();
            if (container.isExpanded() || stop.contains(container.name()) || container.level() >= config.maxDepth()) {
                continue;
            }
            if (selected.add(container)) {
                wave.add(container);
            }
        }
        return wave;
    }

    private static void phase(GenerationRun run, LoopPhase phase) {
        log.debug("Round {} phase {}", run.round(), phase);
        run.emit(GenerationEventType.PHASE_STARTED, phase.name(), Map.of("phase", phase.name()));
    }
}
