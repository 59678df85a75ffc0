package com.diagramparser.core.model.flowchart;

import java.util.Objects;

/**
 * Link between two flowchart nodes.
 *
 * @param from source node id
 * @param to target node id
 * @param edgeType link style
 * @param label text from {@code |label|} or {@code -- label -->}, or {@code null}
 * @param minLength extra rank length from additional link characters, or {@code null}
 */
public record FlowEdge(
    String from,
    String to,
    EdgeType edgeType,
    String label,
    Integer minLength
) {
    public FlowEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(edgeType, "edgeType must not be null");
    }
}
