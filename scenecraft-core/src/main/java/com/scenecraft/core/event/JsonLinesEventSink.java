package com.scenecraft.core.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one JSON object per event to a caller-chosen file.
 *
 * <p>A failed write is reported through SLF4J once per failure and the event is
 * dropped; a broken event log never aborts a generation run.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (JsonLinesEventSink sink = JsonLinesEventSink.open(Path.of("run-events.jsonl"))) {
 *     generator = new SceneGenerator(service, config, sink);
 *     ...
 * }
 * }</pre>
 */
public final class JsonLinesEventSink implements GenerationEventSink, Closeable {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesEventSink.class);

    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path path;
    private final BufferedWriter writer;

    private JsonLinesEventSink(Path path, BufferedWriter writer) {
        this.path = path;
        this.writer = writer;
    }

    /**
     * Opens (or creates) the event log, appending to existing content.
     *
     * @param path event log file
     * @return open sink
     * @throws IOException if the file cannot be opened
     */
    public static JsonLinesEventSink open(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        return new JsonLinesEventSink(path, writer);
    }

    @Override
    public synchronized void accept(GenerationEvent event) {
        try {
            writer.write(mapper.writeValueAsString(event));
            writer.newLine();
            writer.flush();
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize {} event: {}", event.type(), e.getOriginalMessage());
        } catch (IOException e) {
            log.warn("Could not write event log {}: {}", path, e.getMessage());
        }
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
