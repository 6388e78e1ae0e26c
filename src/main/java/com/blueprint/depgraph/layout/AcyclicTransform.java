package com.blueprint.depgraph.layout;

import java.util.List;

import com.blueprint.depgraph.engine.DepthFirstSearch;
import com.blueprint.depgraph.model.DependencyGraph;

import lombok.extern.log4j.Log4j2;

/**
 * Acyclic Transform -- builds the layout view and breaks its cycles.
 *
 * The logical graph is never modified. On the layout copy the first DFS
 * back-edge is reversed, then detection runs again, one edge at a time, for at
 * most {@code edgeCount + 1} rounds. Should the cap be reached with a cycle
 * left, every back-edge of a single traversal is reversed at once, which
 * always yields an acyclic view (all remaining edges then follow DFS finishing
 * order).
 */
@Log4j2
public final class AcyclicTransform {

    private AcyclicTransform() {
        // Utility class
    }

    public static LayoutGraph apply(DependencyGraph graph, LayoutStats stats) {
        LayoutGraph lg = new LayoutGraph(graph);
        int cap = lg.edgeCount() + 1;
        int rounds = 0;
        boolean acyclic = false;
        while (rounds < cap) {
            int e = DepthFirstSearch.firstBackEdge(lg.adjacency(), lg.loops());
            if (e < 0) {
                acyclic = true;
                break;
            }
            lg.reverse(e);
            rounds++;
        }
        if (!acyclic && DepthFirstSearch.firstBackEdge(lg.adjacency(), lg.loops()) >= 0) {
            List<Integer> rest = DepthFirstSearch.backEdges(lg.adjacency(), lg.loops());
            log.warn("Acyclic transform hit its safety cap of {} rounds, reversing {} remaining back-edge(s)", cap,
                    rest.size());
            for (int e : rest)
                lg.reverse(e);
        }

        int reversed = 0;
        for (int e = 0; e < lg.edgeCount(); e++)
            if (lg.isReversed(e))
                reversed++;
        stats.onReversedEdges(reversed);
        log.debug("Acyclic transform: {} round(s), {} edge(s) reversed", rounds, reversed);
        return lg;
    }

    /** True if the layout view has no back-edge reachable from any node. */
    public static boolean isAcyclic(LayoutGraph lg) {
        return DepthFirstSearch.firstBackEdge(lg.adjacency(), lg.loops()) < 0;
    }
}
