package com.blueprint.depgraph;

import com.blueprint.depgraph.layout.HierarchicalLayout;
import com.blueprint.depgraph.layout.LayoutStats;
import com.blueprint.depgraph.model.CheckResults;
import com.blueprint.depgraph.model.DependencyGraph;
import com.blueprint.depgraph.model.StatusCounts;

/**
 * Everything one pipeline run produces: the status-annotated, laid-out graph
 * and the structural findings.
 */
public record PipelineResult(DependencyGraph graph, CheckResults checkResults, StatusCounts statusCounts,
        HierarchicalLayout layout, int droppedReferences) {

    public LayoutStats layoutStats() {
        return layout.getStats();
    }

    public double width() {
        return layout.getWidth();
    }

    public double height() {
        return layout.getHeight();
    }
}
