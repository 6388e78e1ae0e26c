package com.blueprint.depgraph.engine;

import com.blueprint.depgraph.api.Declaration;
import com.blueprint.depgraph.api.NodeStatus;

/**
 * Ranking of status sources, highest first. A node's status is the status of
 * the highest-ranked source that applies to it, resolved once per node.
 *
 * <p>
 * Manual flags outrank everything detected automatically. Among automatic
 * findings a computed fully-proven verdict outranks an unresolved gap, which
 * outranks a plain proof.
 */
public enum StatusPriority {
    MANUAL_MATHLIB_READY(NodeStatus.MATHLIB_READY),
    MANUAL_READY(NodeStatus.READY),
    MANUAL_NOT_READY(NodeStatus.NOT_READY),
    AUTO_FULLY_PROVEN(NodeStatus.FULLY_PROVEN),
    AUTO_SORRY(NodeStatus.SORRY),
    AUTO_PROVEN(NodeStatus.PROVEN),
    DEFAULT(NodeStatus.NOT_READY);

    private final NodeStatus status;

    StatusPriority(NodeStatus status) {
        this.status = status;
    }

    public NodeStatus status() {
        return status;
    }

    /**
     * Highest-ranked applicable source for a declaration.
     *
     * @param fullyProven the propagated verdict for this node
     */
    public static StatusPriority rank(Declaration d, boolean fullyProven) {
        NodeStatus auto = d.getAutoStatus() != null ? d.getAutoStatus() : NodeStatus.NOT_READY;
        if (d.isMathlibReady() || auto == NodeStatus.MATHLIB_READY)
            return MANUAL_MATHLIB_READY;
        if (d.isReady() || auto == NodeStatus.READY)
            return MANUAL_READY;
        if (d.isNotReady())
            return MANUAL_NOT_READY;
        if (fullyProven)
            return AUTO_FULLY_PROVEN;
        return switch (auto) {
            case SORRY -> AUTO_SORRY;
            case PROVEN, FULLY_PROVEN -> AUTO_PROVEN;
            default -> DEFAULT;
        };
    }

    public static NodeStatus resolve(Declaration d, boolean fullyProven) {
        return rank(d, fullyProven).status();
    }
}
