package com.scenecraft.core.engine;

import com.scenecraft.core.model.StopReason;
import com.scenecraft.core.tree.ContainerNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Expands every container, level by level, until nothing is left to expand.
 *
 * <p>Each iteration collects the unexpanded containers below the depth limit and
 * expands them in waves of {@code parallelBatchSize}.
 */
final class ExhaustiveExpansion {

    private static final Logger log = LoggerFactory.getLogger(ExhaustiveExpansion.class);

    private final ExpansionScheduler scheduler;
    private final SceneSeeder seeder = new SceneSeeder();

    ExhaustiveExpansion(ExpansionScheduler scheduler) {
        this.scheduler = scheduler;
    }

    StopReason run(GenerationRun run) {
        GeneratorConfig config = run.config();
        run.startRound(0);
        seeder.seed(run);

        for (int iteration = 1; iteration <= config.maxIterations(); iteration++) {
            List<ContainerNode> unexpanded = run.scene().unexpandedContainers();
            if (unexpanded.isEmpty()) {
                log.info("All containers expanded after {} iteration(s)", iteration - 1);
                return StopReason.ALL_CONTAINERS_EXPANDED;
            }
            List<ContainerNode> expandable = unexpanded.stream()
                .filter(container -> container.level() < config.maxDepth())
                .toList();
            if (expandable.isEmpty()) {
                log.info("Remaining {} container(s) are at the depth limit of {}", unexpanded.size(), config.maxDepth());
                return StopReason.DEPTH_LIMIT_REACHED;
            }
            if (config.costControl() && run.budgetExhausted()) {
                log.info("Node budget of {} exhausted", config.maxTotalNodes());
                return StopReason.NODE_BUDGET_EXHAUSTED;
            }

            log.info("Iteration {}: expanding {} container(s)", iteration, expandable.size());
            int batchSize = config.parallelBatchSize();
            for (int start = 0; start < expandable.size(); start += batchSize) {
                List<ContainerNode> batch = expandable.subList(start, Math.min(start + batchSize, expandable.size()));
                scheduler.runWave(run, batch);
            }
        }
        log.info("Reached iteration limit of {}", config.maxIterations());
        return StopReason.MAX_ITERATIONS_REACHED;
    }
}
