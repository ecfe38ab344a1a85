package com.scenecraft.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Background information for one generation run.
 *
 * <p>The engine treats this as an opaque value and passes it through to the
 * generative service, which renders it into prompt text.
 *
 * @param script script or story excerpt the scene belongs to
 * @param requirement what the scene must contain or convey
 * @param era historical or fictional era (e.g. "Ming dynasty", "modern")
 * @param location where the scene takes place
 * @param atmosphere mood of the scene
 * @param style visual or narrative style
 * @param extra additional free-form context
 */
public record SceneContext(
    String script,
    String requirement,
    String era,
    String location,
    String atmosphere,
    String style,
    Map<String, String> extra
) {
    /**
     * Default era used when none is given.
     */
    public static final String DEFAULT_ERA = "modern";

    /**
     * Compact constructor with validation.
     */
    public SceneContext {
        Objects.requireNonNull(script, "script must not be null");
        Objects.requireNonNull(requirement, "requirement must not be null");
        if (era == null || era.isBlank()) {
            era = DEFAULT_ERA;
        }
        if (location == null) {
            location = "";
        }
        if (atmosphere == null) {
            atmosphere = "";
        }
        if (style == null) {
            style = "";
        }
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    /**
     * Creates a context with only script and requirement set.
     *
     * @param script script text
     * @param requirement scene requirement
     * @return context with default tone fields
     */
    public static SceneContext of(String script, String requirement) {
        return new SceneContext(script, requirement, DEFAULT_ERA, "", "", "", Map.of());
    }
}
