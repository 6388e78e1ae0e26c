package com.blueprint.depgraph.engine;

import com.blueprint.depgraph.api.NodeStatus;
import com.blueprint.depgraph.model.Adjacency;
import com.blueprint.depgraph.model.DependencyGraph;
import com.blueprint.depgraph.model.GraphNode;
import com.blueprint.depgraph.model.StatusCounts;

import lombok.extern.log4j.Log4j2;

/**
 * Status Propagator -- computes the derived fully-proven verdict and writes
 * the resolved status of every node.
 *
 * A node is fully proven iff its own status is proven and every node it
 * depends on (everything reachable along outgoing edges, both kinds) is fully
 * proven in turn.
 *
 * Algorithm: a worklist over dependency order (Kahn's algorithm on the
 * reversed edges). A node is ready once all of its dependencies have a
 * verdict; its verdict is then fixed and pushed to its dependents. Nodes on a
 * cycle, and nodes that depend on one, never become ready and keep the verdict
 * "not fully proven". O(V + E), no recursion.
 */
@Log4j2
public final class StatusPropagator {

    private StatusPropagator() {
        // Utility class
    }

    /**
     * Resolves and stores every node's status.
     *
     * @return the per-node fully-proven verdicts, indexed by node index
     */
    public static boolean[] propagate(DependencyGraph graph) {
        Adjacency adj = graph.adjacency();
        int n = graph.nodeCount();

        boolean[] verdict = new boolean[n];
        boolean[] depsOk = new boolean[n];
        int[] pending = new int[n];
        int[] queue = new int[n];
        int head = 0, tail = 0;

        for (int v = 0; v < n; v++) {
            depsOk[v] = true;
            pending[v] = adj.outDegree(v);
            if (pending[v] == 0)
                queue[tail++] = v;
        }

        while (head < tail) {
            int v = queue[head++];
            GraphNode node = graph.node(v);
            verdict[v] = depsOk[v] && StatusPriority.resolve(node.declaration(), false) == NodeStatus.PROVEN;
            for (int i = 0; i < adj.inDegree(v); i++) {
                int u = adj.from(adj.inEdge(v, i));
                if (!verdict[v])
                    depsOk[u] = false;
                if (--pending[u] == 0)
                    queue[tail++] = u;
            }
        }
        if (tail < n)
            log.debug("{} node(s) sit on or depend on a cycle and stay not fully proven", n - tail);

        for (int v = 0; v < n; v++) {
            GraphNode node = graph.node(v);
            node.setStatus(StatusPriority.resolve(node.declaration(), verdict[v]));
        }
        return verdict;
    }

    /** Propagates and tallies in one step. */
    public static StatusCounts propagateAndCount(DependencyGraph graph) {
        propagate(graph);
        return StatusCounts.of(graph);
    }
}
