package com.scenecraft.core.example;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.scenecraft.core.model.SceneContext;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in example scene contexts, loaded from {@code examples.yaml} on the classpath.
 */
public final class ExampleScenes {

    private static final String RESOURCE = "examples.yaml";

    private final Map<String, SceneContext> scenes;

    private ExampleScenes(Map<String, SceneContext> scenes) {
        this.scenes = Collections.unmodifiableMap(scenes);
    }

    /**
     * Loads the bundled examples.
     *
     * @return examples in file order
     * @throws UncheckedIOException if the bundled resource is missing or malformed
     */
    public static ExampleScenes load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream in = ExampleScenes.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Missing resource " + RESOURCE));
            }
            ExampleFile file = mapper.readValue(in, ExampleFile.class);
            Map<String, SceneContext> scenes = new LinkedHashMap<>();
            file.scenes().forEach((name, entry) -> scenes.put(name, entry.toContext()));
            return new ExampleScenes(scenes);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + RESOURCE, e);
        }
    }

    public Map<String, SceneContext> all() {
        return scenes;
    }

    public Optional<SceneContext> find(String name) {
        return Optional.ofNullable(scenes.get(name));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExampleFile(@JsonProperty("scenes") LinkedHashMap<String, ExampleEntry> scenes) {
        ExampleFile {
            if (scenes == null) {
                scenes = new LinkedHashMap<>();
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExampleEntry(
        @JsonProperty("script") String script,
        @JsonProperty("requirement") String requirement,
        @JsonProperty("era") String era,
        @JsonProperty("location") String location,
        @JsonProperty("atmosphere") String atmosphere,
        @JsonProperty("style") String style
    ) {
        SceneContext toContext() {
            return new SceneContext(script == null ? "" : script, requirement == null ? "" : requirement,
                era, location, atmosphere, style, Map.of());
        }
    }
}
