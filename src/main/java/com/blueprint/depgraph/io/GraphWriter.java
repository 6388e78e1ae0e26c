package com.blueprint.depgraph.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.blueprint.depgraph.PipelineResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/** Serializes pipeline output for the site generator. */
public final class GraphWriter {
    public static final String GRAPH_FILE = "dep-graph.json";
    public static final String MANIFEST_FILE = "manifest.json";

    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private GraphWriter() {
        // Utility class
    }

    public static String toJson(Object description) throws JsonProcessingException {
        return WRITER.writeValueAsString(description);
    }

    /** Writes {@code dep-graph.json} and {@code manifest.json} into {@code outDir}. */
    public static void write(String project, PipelineResult result, Path outDir) throws IOException {
        Files.createDirectories(outDir);
        Files.writeString(outDir.resolve(GRAPH_FILE), toJson(GraphDescription.from(result)));
        Files.writeString(outDir.resolve(MANIFEST_FILE), toJson(Manifest.from(project, result)));
    }
}
