package com.scenecraft.core.engine;

import com.scenecraft.core.model.GenerationStats;
import com.scenecraft.core.tree.Scene;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run-wide counters, safe to update from scheduler workers.
 *
 * <p>Node admission against the total budget is an atomic reservation, so two
 * concurrent expansions can never both take the last slot.
 */
public final class GenerationCounters {

    private final AtomicInteger aiCalls = new AtomicInteger();
    private final AtomicInteger nodesGenerated = new AtomicInteger();
    private final AtomicInteger containersExpanded = new AtomicInteger();
    private final Clock clock;
    private final Instant startedAt;

    public GenerationCounters(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void recordAiCall() {
        aiCalls.incrementAndGet();
    }

    public void recordContainerExpanded() {
        containersExpanded.incrementAndGet();
    }

    /**
     * Counts a node without checking the budget.
     */
    public void recordNode() {
        nodesGenerated.incrementAndGet();
    }

    /**
     * Reserves one slot of the node budget.
     *
     * @param budget total node budget
     * @return true if a slot was reserved, false if the budget is exhausted
     */
    public boolean tryReserveNode(int budget) {
        while (true) {
            int current = nodesGenerated.get();
            if (current >= budget) {
                return false;
            }
            if (nodesGenerated.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public int aiCalls() {
        return aiCalls.get();
    }

    public int nodesGenerated() {
        return nodesGenerated.get();
    }

    public int containersExpanded() {
        return containersExpanded.get();
    }

    /**
     * Captures the counters together with freshly computed tree statistics.
     *
     * @param scene scene of this run
     * @return immutable stats
     */
    public GenerationStats snapshot(Scene scene) {
        return new GenerationStats(
            aiCalls.get(),
            nodesGenerated.get(),
            containersExpanded.get(),
            Duration.between(startedAt, clock.instant()),
            scene.calculateStatistics()
        );
    }
}
