package com.blueprint.depgraph.io;

import static com.blueprint.depgraph.Fixtures.decl;
import static com.blueprint.depgraph.Fixtures.definition;
import static com.blueprint.depgraph.Fixtures.proven;
import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.blueprint.depgraph.DepGraph;
import com.blueprint.depgraph.PipelineResult;
import com.blueprint.depgraph.api.Declaration;
import com.blueprint.depgraph.api.NodeStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class GraphWriterTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static PipelineResult sample() {
        Declaration key = Declaration.builder().id("main").envType("theorem").autoStatus(NodeStatus.PROVEN)
                .keyDeclaration(true).message("almost there").proofUses(List.of("lem", "cyc1"))
                .statementUses(List.of("def")).build();
        return DepGraph.run(List.of(
                key,
                decl("lem", NodeStatus.SORRY, "def"),
                definition("def"),
                proven("cyc1", "cyc2"),
                proven("cyc2", "cyc1"),
                proven("island")));
    }

    @Test
    public void testWritesGraphAndManifest() throws IOException {
        Path out = tmp.getRoot().toPath().resolve("site");
        GraphWriter.write("Demo", sample(), out);

        JsonNode graph = MAPPER.readTree(out.resolve(GraphWriter.GRAPH_FILE).toFile());
        assertTrue(graph.get("width").asDouble() > 0);
        assertEquals(6, graph.get("nodes").size());
        assertEquals(6, graph.get("edges").size());

        JsonNode main = graph.get("nodes").get(0);
        assertEquals("main", main.get("id").asText());
        assertEquals("ellipse", main.get("shape").asText());
        assertEquals("proven", main.get("status").asText());
        assertEquals("#90EE90", main.get("color").asText());
        assertEquals("#main", main.get("url").asText());
        assertEquals(0, main.get("layer").asInt());
        JsonNode def = graph.get("nodes").get(2);
        assertEquals("box", def.get("shape").asText());
        assertEquals("fullyProven", def.get("status").asText());
        assertEquals("#228B22", def.get("color").asText());

        JsonNode statement = graph.get("edges").get(0);
        assertEquals("main", statement.get("source").asText());
        assertEquals("def", statement.get("target").asText());
        assertEquals("statement", statement.get("kind").asText());
        assertEquals("dashed", statement.get("style").asText());
        assertFalse(statement.get("reversed").asBoolean());
        assertEquals(1, statement.get("points").size() % 3);
        assertEquals(2, statement.get("points").get(0).size());
        assertEquals("solid", graph.get("edges").get(1).get("style").asText());

        JsonNode manifest = MAPPER.readTree(out.resolve(GraphWriter.MANIFEST_FILE).toFile());
        assertEquals("Demo", manifest.get("project").asText());
        JsonNode stats = manifest.get("stats");
        assertEquals(6, stats.get("total").asInt());
        assertEquals(1, stats.get("sorry").asInt());
        assertEquals(3, stats.get("proven").asInt());
        assertEquals(2, stats.get("fullyProven").asInt());
        assertEquals(0, stats.get("mathlibReady").asInt());
        assertEquals(1, stats.get("hasSorry").asInt());

        // every graph node has an anchor, and key declarations resolve through it
        JsonNode anchors = manifest.get("nodes");
        assertEquals(6, anchors.size());
        for (JsonNode node : graph.get("nodes"))
            assertEquals(node.get("url").asText(), anchors.get(node.get("id").asText()).asText());
        assertEquals("#lem", anchors.get("lem").asText());

        JsonNode checks = manifest.get("checkResults");
        assertFalse(checks.get("isConnected").asBoolean());
        assertEquals(2, checks.get("numComponents").asInt());
        assertEquals(1, checks.get("cycles").size());
        assertEquals("cyc1", checks.get("cycles").get(0).get(0).get("source").asText());
        assertEquals("proof", checks.get("cycles").get(0).get(0).get("kind").asText());

        assertEquals("main", manifest.get("keyDeclarations").get(0).asText());
        assertTrue(anchors.has(manifest.get("keyDeclarations").get(0).asText()));
        assertEquals("almost there", manifest.get("messages").get(0).get("message").asText());
    }

    @Test
    public void testCoordinatesRounded() {
        assertEquals(1.23, GraphDescription.round(1.23456), 0);
        assertEquals(-0.5, GraphDescription.round(-0.5), 0);
    }

    @Test
    public void testDescriptionIsTopLeft() {
        PipelineResult result = sample();
        GraphDescription desc = GraphDescription.from(result);
        double minX = Double.POSITIVE_INFINITY;
        for (GraphDescription.NodeDesc n : desc.getNodes())
            minX = Math.min(minX, n.getX());
        assertEquals(20, minX, 0);
    }
}
