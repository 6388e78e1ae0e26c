package com.blueprint.depgraph.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Display status of a declaration in the dependency graph.
 *
 * <p>
 * Each status carries the hex color used by the site styling. The table is
 * fixed: stylesheets and the renderer match these values exactly.
 */
public enum NodeStatus {
    NOT_READY("notReady", "#F4A460"),
    READY("ready", "#20B2AA"),
    SORRY("sorry", "#8B0000"),
    PROVEN("proven", "#90EE90"),
    FULLY_PROVEN("fullyProven", "#228B22"),
    MATHLIB_READY("mathlibReady", "#87CEEB");

    private final String jsonName;
    private final String color;

    NodeStatus(String jsonName, String color) {
        this.jsonName = jsonName;
        this.color = color;
    }

    @JsonValue
    public String jsonName() {
        return jsonName;
    }

    public String color() {
        return color;
    }

    @JsonCreator
    public static NodeStatus fromString(String s) {
        for (NodeStatus status : values()) {
            if (status.jsonName.equalsIgnoreCase(s) || status.name().equalsIgnoreCase(s))
                return status;
        }
        throw new IllegalArgumentException("Unknown node status: " + s);
    }
}
