package com.blueprint.depgraph.api;

import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Drawing shape of a node: boxes for definitions, ellipses for theorems. */
public enum NodeShape {
    BOX,
    ELLIPSE;

    private static final Set<String> DEFINITION_LIKE = Set.of(
            "definition", "def", "abbrev", "structure", "inductive", "class", "instance", "axiom", "notation");

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeShape fromString(String s) {
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Derives the shape from an environment type such as {@code definition} or
     * {@code theorem}. Unknown or missing types are drawn as theorems.
     */
    public static NodeShape forEnvType(String envType) {
        if (envType == null)
            return ELLIPSE;
        return DEFINITION_LIKE.contains(envType.trim().toLowerCase(Locale.ROOT)) ? BOX : ELLIPSE;
    }
}
