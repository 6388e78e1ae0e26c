package com.blueprint.depgraph.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.blueprint.depgraph.api.Declaration;
import com.blueprint.depgraph.api.EdgeKind;
import com.blueprint.depgraph.model.DependencyGraph;
import com.blueprint.depgraph.model.GraphEdge;
import com.blueprint.depgraph.model.GraphNode;

import lombok.extern.log4j.Log4j2;

/**
 * Graph Builder -- resolves declarations and their references into a
 * {@link DependencyGraph}.
 *
 * Construction is two-pass so that references resolve regardless of input
 * order:
 * 1. Register every declaration as a node and index its secondary labels.
 * 2. Resolve every {@code uses} reference (id or label, minus excludes) and
 * emit an edge from the using declaration to the referenced one.
 *
 * Malformed input never aborts the build. Unknown references and duplicate
 * ids are dropped with a warning; duplicate (source, target, kind) edges are
 * collapsed, keeping the first. A self reference is kept as a loop edge so
 * validation reports it as a one-edge cycle.
 */
@Log4j2
public final class GraphBuilder {
    private final List<Declaration> declarations = new ArrayList<>();
    private int droppedReferences;
    private boolean built;

    private GraphBuilder() {
    }

    public static GraphBuilder create() {
        return new GraphBuilder();
    }

    public GraphBuilder add(Declaration declaration) {
        checkNotBuilt();
        if (declaration == null)
            throw new IllegalArgumentException("Null declaration");
        declarations.add(declaration);
        return this;
    }

    public GraphBuilder addAll(List<Declaration> decls) {
        for (Declaration d : decls)
            add(d);
        return this;
    }

    /** Number of references dropped by the last {@link #build()}. */
    public int droppedReferences() {
        return droppedReferences;
    }

    public DependencyGraph build() {
        checkNotBuilt();
        built = true;

        // Pass 1: nodes and label index
        List<GraphNode> nodes = new ArrayList<>(declarations.size());
        Map<String, Integer> idToIndex = new LinkedHashMap<>(declarations.size() * 2);
        Map<String, Integer> labelToIndex = new LinkedHashMap<>();
        for (Declaration d : declarations) {
            if (d.getId() == null || d.getId().isBlank()) {
                log.warn("Skipping declaration without id: {}", d);
                continue;
            }
            if (idToIndex.containsKey(d.getId())) {
                log.warn("Duplicate declaration id '{}', keeping first occurrence", d.getId());
                continue;
            }
            int idx = nodes.size();
            nodes.add(new GraphNode(idx, d));
            idToIndex.put(d.getId(), idx);
        }
        for (GraphNode node : nodes) {
            for (String label : orEmpty(node.declaration().getLabels())) {
                if (label == null || label.isBlank())
                    continue;
                Integer prev = labelToIndex.putIfAbsent(label, node.index());
                if (prev != null && prev != node.index())
                    log.warn("Label '{}' claimed by '{}' and '{}', keeping '{}'", label,
                            nodes.get(prev).id(), node.id(), nodes.get(prev).id());
            }
        }

        // Pass 2: resolve references
        List<int[]> raw = new ArrayList<>();
        droppedReferences = 0;
        for (GraphNode node : nodes) {
            Declaration d = node.declaration();
            resolve(node, d.getStatementUses(), d.getStatementExcludes(), EdgeKind.STATEMENT, idToIndex,
                    labelToIndex, raw);
            resolve(node, d.getProofUses(), d.getProofExcludes(), EdgeKind.PROOF, idToIndex, labelToIndex, raw);
        }

        // Post-pass: endpoint filter and (source, target, kind) dedup
        List<GraphEdge> edges = new ArrayList<>(raw.size());
        Set<Long> seen = new HashSet<>(raw.size() * 2);
        int n = nodes.size();
        for (int[] r : raw) {
            int s = r[0], t = r[1];
            EdgeKind kind = EdgeKind.values()[r[2]];
            if (s < 0 || s >= n || t < 0 || t >= n)
                continue;
            long key = ((long) s * n + t) * 2 + r[2];
            if (!seen.add(key))
                continue;
            edges.add(new GraphEdge(edges.size(), s, nodes.get(s).id(), t, nodes.get(t).id(), kind));
        }

        log.debug("Built graph: {} nodes, {} edges, {} dropped references", nodes.size(), edges.size(),
                droppedReferences);
        return new DependencyGraph(nodes, edges, idToIndex, labelToIndex);
    }

    private void resolve(GraphNode node, List<String> uses, List<String> excludes, EdgeKind kind,
            Map<String, Integer> idToIndex, Map<String, Integer> labelToIndex, List<int[]> out) {
        Set<Integer> excluded = new HashSet<>();
        Set<String> excludedRefs = new HashSet<>();
        for (String ref : orEmpty(excludes)) {
            if (ref == null)
                continue;
            excludedRefs.add(ref);
            int idx = lookup(ref, idToIndex, labelToIndex);
            if (idx >= 0)
                excluded.add(idx);
        }
        for (String ref : orEmpty(uses)) {
            if (ref == null || ref.isBlank() || excludedRefs.contains(ref))
                continue;
            int target = lookup(ref, idToIndex, labelToIndex);
            if (target < 0) {
                droppedReferences++;
                log.warn("Declaration '{}' uses unknown reference '{}', dropping {} edge", node.id(), ref,
                        kind.jsonName());
                continue;
            }
            if (excluded.contains(target))
                continue;
            if (target == node.index())
                log.warn("Declaration '{}' references itself", node.id());
            out.add(new int[] { node.index(), target, kind.ordinal() });
        }
    }

    private static int lookup(String ref, Map<String, Integer> idToIndex, Map<String, Integer> labelToIndex) {
        Integer idx = idToIndex.get(ref);
        if (idx == null)
            idx = labelToIndex.get(ref);
        return idx != null ? idx : -1;
    }

    private static List<String> orEmpty(List<String> list) {
        return list != null ? list : List.of();
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("GraphBuilder already built");
    }
}
