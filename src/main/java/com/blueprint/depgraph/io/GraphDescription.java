package com.blueprint.depgraph.io;

import java.util.ArrayList;
import java.util.List;

import com.blueprint.depgraph.PipelineResult;
import com.blueprint.depgraph.model.GraphEdge;
import com.blueprint.depgraph.model.GraphNode;
import com.blueprint.depgraph.model.Point;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;

/**
 * The laid-out graph as handed to the renderer ({@code dep-graph.json}).
 *
 * <p>
 * Node {@code x}/{@code y} are the top-left corner of the node box. Edge
 * {@code points} run from source to target as cubic Bezier segments.
 * Coordinates are rounded to hundredths.
 */
@Data
@JsonPropertyOrder({ "width", "height", "nodes", "edges" })
public final class GraphDescription {
    private double width;
    private double height;
    private List<NodeDesc> nodes = new ArrayList<>();
    private List<EdgeDesc> edges = new ArrayList<>();

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "id", "label", "url", "envType", "shape", "status", "color", "layer", "order", "x",
            "y", "width", "height" })
    public static final class NodeDesc {
        private String id, label, url, envType, shape, status, color;
        private int layer, order;
        private double x, y, width, height;
    }

    @Data
    @JsonPropertyOrder({ "source", "target", "kind", "style", "reversed", "points" })
    public static final class EdgeDesc {
        private String source, target, kind, style;
        private boolean reversed;
        private List<double[]> points;
    }

    public static GraphDescription from(PipelineResult result) {
        GraphDescription desc = new GraphDescription();
        desc.setWidth(round(result.width()));
        desc.setHeight(round(result.height()));
        for (GraphNode node : result.graph().nodes()) {
            NodeDesc nd = new NodeDesc();
            nd.setId(node.id());
            nd.setLabel(node.label());
            nd.setUrl(anchor(node.id()));
            nd.setEnvType(node.declaration().getEnvType());
            nd.setShape(node.shape().jsonName());
            nd.setStatus(node.status().jsonName());
            nd.setColor(node.status().color());
            nd.setLayer(node.layer());
            nd.setOrder(node.order());
            nd.setX(round(node.x()));
            nd.setY(round(node.y()));
            nd.setWidth(round(node.width()));
            nd.setHeight(round(node.height()));
            desc.nodes.add(nd);
        }
        for (GraphEdge edge : result.graph().edges()) {
            EdgeDesc ed = new EdgeDesc();
            ed.setSource(edge.source());
            ed.setTarget(edge.target());
            ed.setKind(edge.kind().jsonName());
            ed.setStyle(edge.kind().style());
            ed.setReversed(edge.reversed());
            List<double[]> pts = new ArrayList<>(edge.points().size());
            for (Point p : edge.points())
                pts.add(new double[] { round(p.x()), round(p.y()) });
            ed.setPoints(pts);
            desc.edges.add(ed);
        }
        return desc;
    }

    /** Fragment link to the declaration on the generated site. */
    static String anchor(String id) {
        return "#" + id;
    }

    static double round(double v) {
        return Math.round(v * 100) / 100.0;
    }
}
