package com.blueprint.depgraph.layout;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Tunables of the hierarchical layout.
 *
 * <p>
 * {@link #largeGraphThreshold} is the single switch for all large-graph
 * simplifications: above it the transpose pass is skipped, median sweeps and
 * coordinate refinement are capped, and edges are drawn as direct curves
 * instead of being routed around obstacles.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LayoutConfig {
    /** Upper bound on median sweeps and refinement passes above the threshold. */
    public static final int LARGE_GRAPH_MAX_ITERATIONS = 2;

    /** Graphs with more nodes than this are laid out in degraded mode. */
    private int largeGraphThreshold = 100;

    private double padding = 20;
    private double layerSpacing = 100;
    private double nodeSpacing = 40;
    private double nodeHeight = 36;
    private double minNodeWidth = 60;
    private double charWidth = 7.5;
    private double labelPadding = 24;

    private int crossingIterations = 8;
    private int largeGraphCrossingIterations = 2;
    private int maxRefinementIterations = 64;
    private int largeGraphRefinementIterations = 2;

    private double obstacleMargin = 8;
    private int ellipseSamples = 8;

    /** Worker threads for per-edge routing; 1 routes on the calling thread. */
    private int routingThreads = 1;

    public static LayoutConfig defaults() {
        return new LayoutConfig();
    }

    public boolean isLarge(int nodeCount) {
        return nodeCount > largeGraphThreshold;
    }

    /** Median sweep iterations for a graph of the given size. */
    public int crossingIterationsFor(int nodeCount) {
        return isLarge(nodeCount) ? Math.min(crossingIterations, largeGraphCrossingIterations) : crossingIterations;
    }

    /** Refinement iterations for a graph of the given size. */
    public int refinementIterationsFor(int nodeCount) {
        return isLarge(nodeCount) ? Math.min(maxRefinementIterations, largeGraphRefinementIterations)
                : maxRefinementIterations;
    }

    public LayoutConfig validate() {
        if (largeGraphThreshold < 0)
            throw new IllegalArgumentException("largeGraphThreshold must be >= 0: " + largeGraphThreshold);
        if (padding < 0)
            throw new IllegalArgumentException("padding must be >= 0: " + padding);
        if (layerSpacing <= nodeHeight)
            throw new IllegalArgumentException("layerSpacing must exceed nodeHeight: " + layerSpacing);
        if (nodeSpacing <= 0 || nodeHeight <= 0 || minNodeWidth <= 0 || charWidth < 0 || labelPadding < 0)
            throw new IllegalArgumentException("Node dimensions must be positive");
        if (crossingIterations < 0 || largeGraphCrossingIterations < 0 || maxRefinementIterations < 0
                || largeGraphRefinementIterations < 0)
            throw new IllegalArgumentException("Iteration counts must be >= 0");
        if (largeGraphCrossingIterations > LARGE_GRAPH_MAX_ITERATIONS
                || largeGraphRefinementIterations > LARGE_GRAPH_MAX_ITERATIONS)
            throw new IllegalArgumentException("Large-graph iteration counts must be <= "
                    + LARGE_GRAPH_MAX_ITERATIONS);
        if (obstacleMargin < 0)
            throw new IllegalArgumentException("obstacleMargin must be >= 0: " + obstacleMargin);
        if (ellipseSamples < 4)
            throw new IllegalArgumentException("ellipseSamples must be >= 4: " + ellipseSamples);
        if (routingThreads < 1)
            throw new IllegalArgumentException("routingThreads must be >= 1: " + routingThreads);
        return this;
    }
}
