package com.scenecraft.core.output;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Lookup of the registered {@link SceneWriter}s.
 */
public final class SceneWriters {

    private SceneWriters() {
        // Utility class
    }

    /**
     * Returns all registered writers ordered by id.
     *
     * @return writers
     */
    public static List<SceneWriter> available() {
        List<SceneWriter> writers = new ArrayList<>();
        ServiceLoader.load(SceneWriter.class).forEach(writers::add);
        writers.sort(Comparator.comparing(SceneWriter::getId));
        return writers;
    }

    /**
     * Finds a writer by format id, case-insensitive. "md" is accepted for markdown
     * and "txt" for text.
     *
     * @param id format id
     * @return writer, or empty if none is registered under that id
     */
    public static Optional<SceneWriter> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = switch (id.strip().toLowerCase(Locale.ROOT)) {
            case "md" -> "markdown";
            case "txt" -> "text";
            default -> id.strip().toLowerCase(Locale.ROOT);
        };
        return available().stream()
            .filter(writer -> writer.getId().equals(normalized))
            .findFirst();
    }
}
