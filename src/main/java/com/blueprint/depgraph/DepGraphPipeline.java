package com.blueprint.depgraph;

import java.util.List;

import com.blueprint.depgraph.api.Declaration;
import com.blueprint.depgraph.engine.GraphBuilder;
import com.blueprint.depgraph.engine.GraphValidator;
import com.blueprint.depgraph.engine.StatusPropagator;
import com.blueprint.depgraph.layout.HierarchicalLayout;
import com.blueprint.depgraph.layout.LayoutConfig;
import com.blueprint.depgraph.model.CheckResults;
import com.blueprint.depgraph.model.DependencyGraph;
import com.blueprint.depgraph.model.StatusCounts;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The dependency graph pipeline.
 *
 * <p>
 * Builder, Validator, Status Propagator, then the layout stages, each reading
 * only what the previous one produced. A run is single-threaded (apart from
 * optional parallel edge routing), owns its graph exclusively, and never fails
 * on malformed data: anomalies end up in {@link CheckResults} and the log.
 */
public final class DepGraphPipeline {
    private static final Logger log = LogManager.getLogger(DepGraphPipeline.class);

    private LayoutConfig config = LayoutConfig.defaults();

    DepGraphPipeline() {
    }

    public DepGraphPipeline withConfig(LayoutConfig config) {
        if (config == null)
            throw new IllegalArgumentException("Null layout config");
        this.config = config.validate();
        return this;
    }

    public LayoutConfig config() {
        return config;
    }

    public PipelineResult run(List<Declaration> declarations) {
        GraphBuilder builder = GraphBuilder.create().addAll(declarations);
        DependencyGraph graph = builder.build();
        CheckResults checks = GraphValidator.check(graph);
        StatusCounts counts = StatusPropagator.propagateAndCount(graph);
        HierarchicalLayout layout = HierarchicalLayout.run(graph, config);

        log.info("Dependency graph: {} nodes, {} edges, {} component(s), {} cycle(s), large={}, reversed={}",
                graph.nodeCount(), graph.edgeCount(), checks.numComponents(), checks.cycles().size(),
                layout.getStats().largeGraph(), layout.getStats().reversedEdges());
        return new PipelineResult(graph, checks, counts, layout, builder.droppedReferences());
    }
}
