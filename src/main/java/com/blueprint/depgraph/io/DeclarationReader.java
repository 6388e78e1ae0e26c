package com.blueprint.depgraph.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.blueprint.depgraph.api.Declaration;
import com.blueprint.depgraph.layout.LayoutConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

/**
 * Reads declaration files.
 *
 * <p>
 * Accepts either a {@link ProjectDefinition} object or a bare JSON array of
 * declarations. {@code null} entries in the declaration list are skipped.
 */
@Log4j2
public final class DeclarationReader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DeclarationReader() {
        // Utility class
    }

    public static ProjectDefinition readFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public static ProjectDefinition parse(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        if (root == null || root.isMissingNode())
            throw new IOException("Empty declaration document");
        if (root.isArray()) {
            ProjectDefinition def = new ProjectDefinition();
            List<Declaration> decls = MAPPER.readerFor(new TypeReference<List<Declaration>>() {
            }).readValue(root);
            def.setDeclarations(new ArrayList<>(decls));
            return withoutNulls(def);
        }
        if (!root.isObject())
            throw new IOException("Expected an object or array of declarations, got " + root.getNodeType());
        ProjectDefinition def = MAPPER.treeToValue(root, ProjectDefinition.class);
        if (def.getDeclarations() == null)
            def.setDeclarations(new ArrayList<>());
        return withoutNulls(def);
    }

    private static ProjectDefinition withoutNulls(ProjectDefinition def) {
        List<Declaration> decls = new ArrayList<>(def.getDeclarations());
        int before = decls.size();
        decls.removeIf(d -> d == null);
        if (decls.size() < before)
            log.warn("Skipping {} null declaration(s)", before - decls.size());
        def.setDeclarations(decls);
        return def;
    }

    /** Reads a standalone layout configuration file. */
    public static LayoutConfig readConfig(Path path) throws IOException {
        return MAPPER.readValue(Files.readString(path), LayoutConfig.class);
    }
}
