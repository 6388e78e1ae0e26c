package com.blueprint.depgraph.layout;

import com.blueprint.depgraph.model.DependencyGraph;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Runs the layout stages in order on one graph and writes the results back
 * into it: acyclic transform, layering, crossing reduction, coordinates,
 * routing.
 */
@Log4j2
@Getter
public final class HierarchicalLayout {
    private final LayoutGraph layoutGraph;
    private final LayoutStats stats;
    private final double width;
    private final double height;

    private HierarchicalLayout(LayoutGraph layoutGraph, LayoutStats stats, double width, double height) {
        this.layoutGraph = layoutGraph;
        this.stats = stats;
        this.width = width;
        this.height = height;
    }

    public static HierarchicalLayout run(DependencyGraph graph, LayoutConfig config) {
        config.validate();
        LayoutStats stats = new LayoutStats();
        stats.setLargeGraph(config.isLarge(graph.nodeCount()));

        long t0 = System.nanoTime();
        LayoutGraph lg = AcyclicTransform.apply(graph, stats);
        LayerAssigner.assign(lg);
        long t1 = System.nanoTime();
        CrossingReducer.reduce(lg, config, stats);
        long t2 = System.nanoTime();
        CoordinateAssigner.assign(lg, config, stats);
        long t3 = System.nanoTime();
        EdgeRouter.route(lg, config, stats);
        long t4 = System.nanoTime();
        lg.applyTo();

        log.debug("Layout timings (ms): layering {}, crossings {}, coordinates {}, routing {}",
                (t1 - t0) / 1_000_000, (t2 - t1) / 1_000_000, (t3 - t2) / 1_000_000, (t4 - t3) / 1_000_000);
        return new HierarchicalLayout(lg, stats, lg.totalWidth(config.getPadding()),
                lg.totalHeight(config.getPadding()));
    }
}
