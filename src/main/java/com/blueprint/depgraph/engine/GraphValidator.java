package com.blueprint.depgraph.engine;

import java.util.ArrayList;
import java.util.List;

import com.blueprint.depgraph.model.Adjacency;
import com.blueprint.depgraph.model.CheckResults;
import com.blueprint.depgraph.model.DependencyGraph;
import com.blueprint.depgraph.model.GraphEdge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Structural checks over the logical graph: weak connectivity and cycles.
 *
 * <p>
 * Both checks are O(V + E), both always run, and neither fails the build.
 * Cycles are reported one per DFS back-edge, so independent cycles are all
 * listed; enumerating every elementary cycle is not attempted.
 */
public final class GraphValidator {
    private static final Logger log = LogManager.getLogger(GraphValidator.class);

    private GraphValidator() {
        // Utility class
    }

    public static CheckResults check(DependencyGraph graph) {
        List<Integer> sizes = componentSizes(graph.adjacency());
        List<List<GraphEdge>> cycles = new ArrayList<>();
        for (List<Integer> cycle : DepthFirstSearch.findCycles(graph.adjacency())) {
            List<GraphEdge> edges = new ArrayList<>(cycle.size());
            for (int e : cycle)
                edges.add(graph.edge(e));
            cycles.add(edges);
        }
        boolean connected = sizes.size() == 1;
        if (!cycles.isEmpty())
            log.warn("Dependency graph contains {} cycle(s), first: {}", cycles.size(), cycles.get(0));
        return new CheckResults(connected, sizes.size(), sizes, cycles);
    }

    /**
     * Sizes of weakly connected components, in order of discovery from the
     * lowest unvisited node index. Edge direction is ignored.
     */
    static List<Integer> componentSizes(Adjacency adj) {
        int n = adj.nodeCount();
        boolean[] visited = new boolean[n];
        int[] queue = new int[n];
        List<Integer> sizes = new ArrayList<>();
        for (int start = 0; start < n; start++) {
            if (visited[start])
                continue;
            int head = 0, tail = 0;
            queue[tail++] = start;
            visited[start] = true;
            while (head < tail) {
                int u = queue[head++];
                for (int i = 0; i < adj.outDegree(u); i++) {
                    int v = adj.to(adj.outEdge(u, i));
                    if (!visited[v]) {
                        visited[v] = true;
                        queue[tail++] = v;
                    }
                }
                for (int i = 0; i < adj.inDegree(u); i++) {
                    int v = adj.from(adj.inEdge(u, i));
                    if (!visited[v]) {
                        visited[v] = true;
                        queue[tail++] = v;
                    }
                }
            }
            sizes.add(tail);
        }
        return sizes;
    }
}
