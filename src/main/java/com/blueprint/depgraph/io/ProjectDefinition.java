package com.blueprint.depgraph.io;

import java.util.ArrayList;
import java.util.List;

import com.blueprint.depgraph.api.Declaration;
import com.blueprint.depgraph.layout.LayoutConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of the extraction output: the project's declarations
 * and optional layout overrides.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ProjectDefinition {
    private String project;
    private List<Declaration> declarations = new ArrayList<>();
    private LayoutConfig layout;
}
