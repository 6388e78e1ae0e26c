package com.blueprint.depgraph.layout;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Call counters of one layout run. They make the large-graph policy
 * observable: a degraded run shows zero transpose passes and zero
 * visibility-routed edges.
 */
public final class LayoutStats {
    private final AtomicInteger medianSweeps = new AtomicInteger();
    private final AtomicInteger transposePasses = new AtomicInteger();
    private final AtomicInteger refinementIterations = new AtomicInteger();
    private final AtomicInteger reversedEdges = new AtomicInteger();
    private final AtomicInteger visibilityRoutes = new AtomicInteger();
    private final AtomicInteger directRoutes = new AtomicInteger();
    private volatile boolean largeGraph;

    void onMedianSweep() {
        medianSweeps.incrementAndGet();
    }

    void onTransposePass() {
        transposePasses.incrementAndGet();
    }

    void onRefinementIteration() {
        refinementIterations.incrementAndGet();
    }

    void onReversedEdges(int count) {
        reversedEdges.set(count);
    }

    void onVisibilityRoute() {
        visibilityRoutes.incrementAndGet();
    }

    void onDirectRoute() {
        directRoutes.incrementAndGet();
    }

    void setLargeGraph(boolean largeGraph) {
        this.largeGraph = largeGraph;
    }

    public int medianSweeps() {
        return medianSweeps.get();
    }

    public int transposePasses() {
        return transposePasses.get();
    }

    public int refinementIterations() {
        return refinementIterations.get();
    }

    public int reversedEdges() {
        return reversedEdges.get();
    }

    public int visibilityRoutes() {
        return visibilityRoutes.get();
    }

    public int directRoutes() {
        return directRoutes.get();
    }

    public boolean largeGraph() {
        return largeGraph;
    }

    @Override
    public String toString() {
        return "LayoutStats[large=" + largeGraph + ", medianSweeps=" + medianSweeps + ", transposePasses="
                + transposePasses + ", refinementIterations=" + refinementIterations + ", reversedEdges="
                + reversedEdges + ", visibilityRoutes=" + visibilityRoutes + ", directRoutes=" + directRoutes + "]";
    }
}
