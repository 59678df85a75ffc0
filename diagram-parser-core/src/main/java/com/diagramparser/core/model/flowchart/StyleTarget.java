package com.diagramparser.core.model.flowchart;

import java.util.Objects;

/**
 * Element a {@code style} statement applies to.
 *
 * @param type whether {@code id} names a node or a subgraph
 * @param id element id
 */
public record StyleTarget(
    TargetType type,
    String id
) {
    public StyleTarget {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(id, "id must not be null");
    }

    public enum TargetType {
        NODE,
        SUBGRAPH
    }
}
