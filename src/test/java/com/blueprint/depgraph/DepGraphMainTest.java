package com.blueprint.depgraph;

import static org.junit.Assert.*;

import java.nio.file.Files;
import java.nio.file.Path;

import com.blueprint.depgraph.io.GraphWriter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class DepGraphMainTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path input() throws Exception {
        Path in = tmp.newFile("decls.json").toPath();
        Files.writeString(in, "{\"project\":\"cli\",\"declarations\":["
                + "{\"id\":\"a\",\"autoStatus\":\"proven\",\"proofUses\":[\"b\"]},"
                + "{\"id\":\"b\",\"envType\":\"definition\",\"autoStatus\":\"proven\"}],"
                + "\"layout\":{\"padding\":10}}");
        return in;
    }

    @Test
    public void testWritesOutputs() throws Exception {
        Path out = tmp.getRoot().toPath().resolve("out");
        int code = DepGraphMain.run(new String[] { input().toString(), out.toString(), "--mermaid" });
        assertEquals(0, code);
        assertTrue(Files.exists(out.resolve(GraphWriter.GRAPH_FILE)));
        assertTrue(Files.exists(out.resolve(GraphWriter.MANIFEST_FILE)));
        assertTrue(Files.readString(out.resolve(DepGraphMain.MERMAID_FILE)).contains("n0 --> n1;"));

        JsonNode graph = new ObjectMapper().readTree(out.resolve(GraphWriter.GRAPH_FILE).toFile());
        // padding from the input's layout section
        assertEquals(10, graph.get("nodes").get(0).get("y").asDouble(), 0);
    }

    @Test
    public void testConfigFileWins() throws Exception {
        Path config = tmp.newFile("layout.json").toPath();
        Files.writeString(config, "{\"padding\": 33}");
        Path out = tmp.getRoot().toPath().resolve("out2");
        int code = DepGraphMain.run(new String[] { input().toString(), out.toString(), "--config", config.toString() });
        assertEquals(0, code);
        assertFalse(Files.exists(out.resolve(DepGraphMain.MERMAID_FILE)));
        JsonNode graph = new ObjectMapper().readTree(out.resolve(GraphWriter.GRAPH_FILE).toFile());
        assertEquals(33, graph.get("nodes").get(0).get("y").asDouble(), 0);
    }

    @Test
    public void testNullDeclarationIgnored() throws Exception {
        Path in = tmp.newFile("nulls.json").toPath();
        Files.writeString(in, "{\"declarations\":[null,{\"id\":\"a\",\"autoStatus\":\"proven\"}]}");
        Path out = tmp.getRoot().toPath().resolve("out3");
        assertEquals(0, DepGraphMain.run(new String[] { in.toString(), out.toString() }));
        JsonNode graph = new ObjectMapper().readTree(out.resolve(GraphWriter.GRAPH_FILE).toFile());
        assertEquals(1, graph.get("nodes").size());
    }

    @Test
    public void testMissingInputFails() {
        Path out = tmp.getRoot().toPath().resolve("never");
        assertEquals(1, DepGraphMain.run(new String[] { "/nonexistent/decls.json", out.toString() }));
    }

    @Test
    public void testUsageErrors() {
        assertEquals(2, DepGraphMain.run(new String[0]));
        assertEquals(2, DepGraphMain.run(new String[] { "in.json" }));
        assertEquals(2, DepGraphMain.run(new String[] { "in.json", "out", "--bogus" }));
        assertEquals(2, DepGraphMain.run(new String[] { "in.json", "out", "--config" }));
    }
}
