package com.blueprint.depgraph.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.blueprint.depgraph.PipelineResult;
import com.blueprint.depgraph.api.NodeStatus;
import com.blueprint.depgraph.model.CheckResults;
import com.blueprint.depgraph.model.GraphEdge;
import com.blueprint.depgraph.model.GraphNode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;

/**
 * Project summary for the dashboard ({@code manifest.json}): status counts,
 * structural check results, key declarations and author messages.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "project", "stats", "nodes", "checkResults", "keyDeclarations", "messages" })
public final class Manifest {
    /** Alias of the {@code sorry} count read by the dashboard. */
    static final String HAS_SORRY = "hasSorry";

    private String project;
    private Map<String, Integer> stats = new LinkedHashMap<>();
    /** Node id to its anchor on the generated site. */
    private Map<String, String> nodes = new LinkedHashMap<>();
    private Checks checkResults;
    private List<String> keyDeclarations = new ArrayList<>();
    private List<Message> messages = new ArrayList<>();

    @Data
    @JsonPropertyOrder({ "isConnected", "numComponents", "componentSizes", "cycles" })
    public static final class Checks {
        @JsonProperty("isConnected")
        private boolean connected;
        private int numComponents;
        private List<Integer> componentSizes;
        private List<List<CycleEdge>> cycles;
    }

    public record CycleEdge(String source, String target, String kind) {
    }

    public record Message(String id, String message) {
    }

    public static Manifest from(String project, PipelineResult result) {
        Manifest m = new Manifest();
        m.setProject(project);
        m.stats.put("total", result.statusCounts().total());
        for (NodeStatus s : NodeStatus.values())
            m.stats.put(s.jsonName(), result.statusCounts().get(s));
        m.stats.put(HAS_SORRY, result.statusCounts().get(NodeStatus.SORRY));

        CheckResults cr = result.checkResults();
        Checks checks = new Checks();
        checks.setConnected(cr.connected());
        checks.setNumComponents(cr.numComponents());
        checks.setComponentSizes(cr.componentSizes());
        List<List<CycleEdge>> cycles = new ArrayList<>();
        for (List<GraphEdge> cycle : cr.cycles()) {
            List<CycleEdge> c = new ArrayList<>(cycle.size());
            for (GraphEdge e : cycle)
                c.add(new CycleEdge(e.source(), e.target(), e.kind().jsonName()));
            cycles.add(c);
        }
        checks.setCycles(cycles);
        m.setCheckResults(checks);

        for (GraphNode node : result.graph().nodes()) {
            m.nodes.put(node.id(), GraphDescription.anchor(node.id()));
            if (node.declaration().isKeyDeclaration())
                m.keyDeclarations.add(node.id());
            String msg = node.declaration().getMessage();
            if (msg != null && !msg.isBlank())
                m.messages.add(new Message(node.id(), msg));
        }
        return m;
    }
}
