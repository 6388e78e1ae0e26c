package com.blueprint.depgraph.api;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One annotated declaration as delivered by the extraction step.
 *
 * <p>
 * References in the {@code uses} lists name either a declaration id or one of
 * the secondary {@link #getLabels() labels} of a declaration. References listed
 * in the matching {@code excludes} list are removed before edges are emitted.
 *
 * <p>
 * {@link #getAutoStatus()} is what the extraction detected ({@code proven},
 * {@code sorry} or {@code notReady}); the three boolean flags are manual
 * overrides set by the author.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Declaration {
    String id;
    String label;
    @Builder.Default
    List<String> labels = List.of();
    String envType;
    NodeShape shape;
    @Builder.Default
    NodeStatus autoStatus = NodeStatus.NOT_READY;
    boolean mathlibReady;
    boolean ready;
    boolean notReady;
    boolean keyDeclaration;
    String message;
    @Builder.Default
    List<String> statementUses = List.of();
    @Builder.Default
    List<String> statementExcludes = List.of();
    @Builder.Default
    List<String> proofUses = List.of();
    @Builder.Default
    List<String> proofExcludes = List.of();

    /** Explicit shape if given, otherwise derived from the environment type. */
    public NodeShape resolvedShape() {
        return shape != null ? shape : NodeShape.forEnvType(envType);
    }

    /** Display label, falling back to the id. */
    public String displayLabel() {
        return label != null && !label.isBlank() ? label : id;
    }
}
