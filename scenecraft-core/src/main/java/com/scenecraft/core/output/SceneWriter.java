package com.scenecraft.core.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a scene to one output format.
 *
 * <p>Writers are discovered via {@link java.util.ServiceLoader}; register
 * implementations in {@code META-INF/services/com.scenecraft.core.output.SceneWriter}.
 *
 * @see SceneWriters
 */
public interface SceneWriter {

    /**
     * Returns the format identifier used on the command line ("json", "markdown", ...).
     *
     * @return lowercase format id
     */
    String getId();

    /**
     * Returns the file extension for this format, without the dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Renders the document.
     *
     * @param document scene document
     * @return rendered content
     */
    String render(SceneDocument document);

    /**
     * Renders the document into a file, creating parent directories as needed.
     *
     * @param document scene document
     * @param target file to write
     * @throws IllegalStateException if the file cannot be written
     */
    default void write(SceneDocument document, Path target) {
        Logger log = LoggerFactory.getLogger(getClass());
        String content = render(document);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
            log.info("Wrote {} scene to {} ({} chars)", getId(), target, content.length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write scene file: " + target, e);
        }
    }
}
