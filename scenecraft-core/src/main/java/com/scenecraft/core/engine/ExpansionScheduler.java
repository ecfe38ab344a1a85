package com.scenecraft.core.engine;

import com.scenecraft.core.event.GenerationEventType;
import com.scenecraft.core.model.ExpansionRequest;
import com.scenecraft.core.model.NodeSpec;
import com.scenecraft.core.service.ServiceException;
import com.scenecraft.core.tree.ContainerNode;
import com.scenecraft.core.tree.SceneNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Expands a wave of containers, optionally in parallel.
 *
 * <p>Each container gets one service call. Workers call the service, filter the
 * candidates and build detached nodes; nothing else. Once every call of the wave
 * has returned, the controlling thread inserts the nodes and marks the containers
 * expanded, in wave order. A failed call leaves the container childless but still
 * marks it expanded, so it is never retried.
 */
public final class ExpansionScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExpansionScheduler.class);

    private final ExecutorService executor;
    private final Semaphore permits;
    private final boolean parallel;

    public ExpansionScheduler(GeneratorConfig config) {
        this.parallel = config.parallelExpansion();
        this.permits = new Semaphore(config.maxConcurrent());
        this.executor = Executors.newCachedThreadPool(new WorkerThreadFactory());
    }

    /**
     * Expands the given containers as one wave.
     *
     * @param run current run
     * @param wave containers to expand; already-expanded ones are skipped
     * @return names of the expanded containers and node counts
     */
    WaveResult runWave(GenerationRun run, List<ContainerNode> wave) {
        List<ContainerNode> pending = wave.stream()
            .filter(container -> !container.isExpanded())
            .toList();
        if (pending.isEmpty()) {
            return WaveResult.EMPTY;
        }

        List<ExpansionOutcome> outcomes = pending.size() == 1 || !parallel
            ? runInline(run, pending)
            : runParallel(run, pending);

        List<String> expanded = new ArrayList<>();
        int inserted = 0;
        int failures = 0;
        for (ExpansionOutcome outcome : outcomes) {
            ContainerNode container = outcome.container();
            for (SceneNode child : outcome.nodes()) {
                if (run.insertExpanded(container, child)) {
                    inserted++;
                }
            }
            container.markExpanded();
            expanded.add(container.name());

            if (outcome.succeeded()) {
                run.counters().recordContainerExpanded();
                run.emit(GenerationEventType.CONTAINER_EXPANDED, "Expanded " + container.fullPath(), Map.of(
                    "container", container.fullPath(),
                    "added", outcome.nodes().size(),
                    "rejected", outcome.rejected()));
            } else {
                failures++;
                run.emit(GenerationEventType.EXPANSION_FAILED, "Expansion failed for " + container.fullPath(),
                    Map.of("container", container.fullPath(), "error", outcome.error()));
            }
        }

        run.emit(GenerationEventType.WAVE_COMPLETED, "Wave of " + pending.size() + " container(s) completed", Map.of(
            "containers", pending.size(),
            "nodesAdded", inserted,
            "failures", failures));
        log.info("Wave completed: {} container(s), {} node(s) added, {} failure(s)", pending.size(), inserted, failures);
        return new WaveResult(expanded, inserted, failures);
    }

    private List<ExpansionOutcome> runInline(GenerationRun run, List<ContainerNode> pending) {
        List<ExpansionOutcome> outcomes = new ArrayList<>();
        for (ContainerNode container : pending) {
            outcomes.add(expand(run, container, requestFor(container)));
        }
        return outcomes;
    }

    private List<ExpansionOutcome> runParallel(GenerationRun run, List<ContainerNode> pending) {
        List<Future<ExpansionOutcome>> futures = new ArrayList<>();
        for (ContainerNode container : pending) {
            ExpansionRequest request = requestFor(container);
            futures.add(executor.submit(() -> expand(run, container, request)));
        }

        List<ExpansionOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            ContainerNode container = pending.get(i);
            try {
                outcomes.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.add(ExpansionOutcome.failed(container, "interrupted"));
            } catch (ExecutionException e) {
                log.warn("Expansion task for '{}' failed: {}", container.name(), e.getCause().getMessage());
                outcomes.add(ExpansionOutcome.failed(container, String.valueOf(e.getCause().getMessage())));
            }
        }
        return outcomes;
    }

    /**
     * Worker body. Reads only the immutable request, never the tree.
     */
    private ExpansionOutcome expand(GenerationRun run, ContainerNode container, ExpansionRequest request) {
        List<NodeSpec> candidates;
        try {
            candidates = callService(run, request);
        } catch (ServiceException | RuntimeException e) {
            log.warn("Expansion of '{}' failed: {}", request.containerName(), e.getMessage());
            return ExpansionOutcome.failed(container, String.valueOf(e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExpansionOutcome.failed(container, "interrupted");
        }

        int limit = run.config().maxNodesPerContainer();
        List<SceneNode> nodes = new ArrayList<>();
        int rejected = 0;
        for (int i = 0; i < candidates.size(); i++) {
            if (nodes.size() >= limit) {
                rejected += candidates.size() - i;
                break;
            }
            NodeSpec spec = candidates.get(i);
            Admission verdict = run.admission().evaluate(spec);
            if (verdict.isAccepted()) {
                nodes.add(run.factory().create(spec));
            } else {
                rejected++;
                run.emit(GenerationEventType.NODE_REJECTED, "Rejected '" + spec.name() + "'", Map.of(
                    "container", request.containerName(),
                    "node", spec.name(),
                    "reason", verdict.name()));
            }
        }
        return new ExpansionOutcome(container, nodes, rejected, true, "");
    }

    private List<NodeSpec> callService(GenerationRun run, ExpansionRequest request)
            throws ServiceException, InterruptedException {
        permits.acquire();
        try {
            run.counters().recordAiCall();
            List<NodeSpec> result = run.service().expandContainer(request, run.context());
            return result == null ? List.of() : result;
        } finally {
            permits.release();
        }
    }

    private static ExpansionRequest requestFor(ContainerNode container) {
        return new ExpansionRequest(container.name(), container.containerType(), container.description(),
            container.theme(), container.level());
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * Result of one wave.
     *
     * @param expandedContainers names of the containers marked expanded, in wave order
     * @param nodesAdded nodes inserted into the tree
     * @param failures containers whose service call failed
     */
    record WaveResult(List<String> expandedContainers, int nodesAdded, int failures) {
        static final WaveResult EMPTY = new WaveResult(List.of(), 0, 0);
    }

    private record ExpansionOutcome(ContainerNode container, List<SceneNode> nodes, int rejected,
                                    boolean succeeded, String error) {
        static ExpansionOutcome failed(ContainerNode container, String error) {
            return new ExpansionOutcome(container, List.of(), 0, false, error);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "scene-expander-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
