package com.blueprint.depgraph.api;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of dependency. Statement dependencies are drawn dashed, proof
 * dependencies solid.
 */
public enum EdgeKind {
    STATEMENT("dashed"),
    PROOF("solid");

    private final String style;

    EdgeKind(String style) {
        this.style = style;
    }

    public String style() {
        return style;
    }

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EdgeKind fromString(String s) {
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
