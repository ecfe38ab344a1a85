package com.scenecraft.core.engine;

import com.scenecraft.core.event.GenerationEventSink;
import com.scenecraft.core.event.GenerationEventType;
import com.scenecraft.core.model.GenerationStats;
import com.scenecraft.core.model.RoundInfo;
import com.scenecraft.core.model.SceneContext;
import com.scenecraft.core.model.StopReason;
import com.scenecraft.core.service.SceneService;
import com.scenecraft.core.tree.Scene;
import com.scenecraft.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for generating scenes.
 *
 * <p>Two modes are offered: {@link #generate} expands every container down to the
 * depth limit, {@link #generateWithRounds} runs the analyze-optimize-prune-expand
 * refinement loop. A generator owns a worker pool and must be closed; it may run
 * several generations one after another but not concurrently.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (SceneGenerator generator = new SceneGenerator(service, GeneratorConfig.defaults(), new Slf4jEventSink())) {
 *     GenerationResult result = generator.generateWithRounds(SceneContext.of(script, requirement));
 *     System.out.println(result.stats().getSummary());
 * }
 * }</pre>
 */
public final class SceneGenerator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SceneGenerator.class);

    private final SceneService service;
    private final GeneratorConfig config;
    private final GenerationEventSink sink;
    private final Clock clock;
    private final ExpansionScheduler scheduler;

    public SceneGenerator(SceneService service, GeneratorConfig config, GenerationEventSink sink) {
        this(service, config, sink, Clock.systemDefaultZone());
    }

    public SceneGenerator(SceneService service, GeneratorConfig config, GenerationEventSink sink, Clock clock) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.sink = sink == null ? GenerationEventSink.NOOP : sink;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.scheduler = new ExpansionScheduler(config);
    }

    public GeneratorConfig config() {
        return config;
    }

    /**
     * Seeds the scene and expands every container until none is left below the depth
     * limit, the iteration cap is hit or the node budget runs out.
     *
     * @param context scene context
     * @return generated scene and statistics
     */
    public GenerationResult generate(SceneContext context) {
        GenerationRun run = newRun(context);
        StopReason reason = new ExhaustiveExpansion(scheduler).run(run);
        return finish(run, List.of(), reason);
    }

    /**
     * Seeds the scene and refines it round by round.
     *
     * @param context scene context
     * @return generated scene, statistics and round log
     */
    public GenerationResult generateWithRounds(SceneContext context) {
        GenerationRun run = newRun(context);
        List<RoundInfo> rounds = new ArrayList<>();
        StopReason reason = new RefinementLoop(scheduler).run(run, rounds);
        return finish(run, rounds, reason);
    }

    private GenerationRun newRun(SceneContext context) {
        Objects.requireNonNull(context, "context must not be null");
        Scene scene = new Scene(IdGenerator.newSceneId(), IdGenerator.sceneName(LocalDateTime.now(clock)), context);
        GenerationCounters counters = new GenerationCounters(clock);

        GenerationRun run = new GenerationRun(scene, service, config, counters, sink, IdGenerator::newNodeId, clock);

        log.info("Starting generation of scene '{}'", scene.name());
        run.emit(GenerationEventType.RUN_STARTED, "Generation started", Map.of(
            "scene", scene.name(),
            "maxDepth", config.maxDepth(),
            "maxTotalNodes", config.maxTotalNodes()));
        return run;
    }

    private GenerationResult finish(GenerationRun run, List<RoundInfo> rounds, StopReason reason) {
        GenerationStats stats = run.counters().snapshot(run.scene());
        log.info("Generation finished ({}): {}", reason, stats.getSummary());
        run.emit(GenerationEventType.RUN_COMPLETED, "Generation finished", Map.of(
            "stopReason", reason.name(),
            "aiCalls", stats.totalAiCalls(),
            "nodesGenerated", stats.totalNodesGenerated(),
            "containersExpanded", stats.totalContainersExpanded(),
            "items", stats.tree().totalItems(),
            "containers", stats.tree().totalContainers(),
            "maxDepth", stats.tree().maxDepthReached()));
        return new GenerationResult(run.scene(), stats, rounds, reason);
    }

    @Override
    public void close() {
        scheduler.close();
    }
}
