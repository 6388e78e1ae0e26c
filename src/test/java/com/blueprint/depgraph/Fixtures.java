package com.blueprint.depgraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.blueprint.depgraph.api.Declaration;
import com.blueprint.depgraph.api.NodeStatus;
import com.blueprint.depgraph.engine.GraphBuilder;
import com.blueprint.depgraph.model.DependencyGraph;

/** Declaration factories shared by the tests. */
public final class Fixtures {

    private Fixtures() {
        // Utility class
    }

    /** A theorem-like declaration that proof-uses {@code uses}. */
    public static Declaration decl(String id, NodeStatus auto, String... uses) {
        return Declaration.builder()
                .id(id)
                .label(id)
                .envType("theorem")
                .autoStatus(auto)
                .proofUses(Arrays.asList(uses))
                .build();
    }

    public static Declaration proven(String id, String... uses) {
        return decl(id, NodeStatus.PROVEN, uses);
    }

    public static Declaration definition(String id, String... uses) {
        return Declaration.builder()
                .id(id)
                .label(id)
                .envType("definition")
                .autoStatus(NodeStatus.PROVEN)
                .statementUses(Arrays.asList(uses))
                .build();
    }

    /** n0 uses n1 uses ... uses n(count-1). */
    public static List<Declaration> chain(int count) {
        List<Declaration> decls = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            if (i + 1 < count)
                decls.add(proven("n" + i, "n" + (i + 1)));
            else
                decls.add(proven("n" + i));
        }
        return decls;
    }

    /**
     * A small layered graph with fan-in, fan-out, a long edge and both edge
     * kinds.
     */
    public static List<Declaration> lattice() {
        return List.of(
                proven("main", "lemA", "lemB", "lemC"),
                proven("lemA", "defX", "defY"),
                proven("lemB", "defY", "defZ"),
                proven("lemC", "defX", "defZ", "base"),
                definition("defX", "base"),
                definition("defY", "base"),
                definition("defZ", "base"),
                definition("base"));
    }

    public static DependencyGraph build(Declaration... decls) {
        return GraphBuilder.create().addAll(Arrays.asList(decls)).build();
    }

    public static DependencyGraph build(List<Declaration> decls) {
        return GraphBuilder.create().addAll(decls).build();
    }
}
