package com.scenecraft.core.event;

/**
 * Receives structured generation events.
 *
 * <p>The sink is owned by the caller and injected into the generator, so each run
 * decides where its records go. Implementations must tolerate calls from worker
 * threads.
 */
@FunctionalInterface
public interface GenerationEventSink {

    /** Sink that drops every event. */
    GenerationEventSink NOOP = event -> { };

    /**
     * Accepts one event. Must not throw.
     *
     * @param event event to record
     */
    void accept(GenerationEvent event);
}
