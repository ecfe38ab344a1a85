package com.scenecraft.core.event;

import java.util.List;

/**
 * Fans each event out to several sinks, in order.
 */
public final class CompositeEventSink implements GenerationEventSink {

    private final List<GenerationEventSink> sinks;

    public CompositeEventSink(List<GenerationEventSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public static CompositeEventSink of(GenerationEventSink... sinks) {
        return new CompositeEventSink(List.of(sinks));
    }

    @Override
    public void accept(GenerationEvent event) {
        for (GenerationEventSink sink : sinks) {
            sink.accept(event);
        }
    }
}
