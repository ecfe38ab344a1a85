package com.scenecraft.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Writes events through SLF4J, attaching the event payload as key/value pairs.
 *
 * <p>Structural errors log at ERROR, failed expansions and validation anomalies at
 * WARN, rejected candidates at DEBUG, everything else at INFO.
 */
public final class Slf4jEventSink implements GenerationEventSink {

    private final Logger log;

    public Slf4jEventSink() {
        this(LoggerFactory.getLogger("com.scenecraft.events"));
    }

    public Slf4jEventSink(Logger log) {
        this.log = log;
    }

    @Override
    public void accept(GenerationEvent event) {
        Level level = levelOf(event.type());
        if (!log.isEnabledForLevel(level)) {
            return;
        }
        LoggingEventBuilder builder = log.atLevel(level)
            .addKeyValue("event", event.type().name())
            .addKeyValue("round", event.round());
        event.data().forEach(builder::addKeyValue);
        builder.log(event.message());
    }

    static Level levelOf(GenerationEventType type) {
        return switch (type) {
            case STRUCTURAL_ERROR -> Level.ERROR;
            case EXPANSION_FAILED, VALIDATION -> Level.WARN;
            case NODE_REJECTED -> Level.DEBUG;
            default -> Level.INFO;
        };
    }
}
