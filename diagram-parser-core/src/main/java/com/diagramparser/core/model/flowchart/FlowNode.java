package com.diagramparser.core.model.flowchart;

import java.util.List;
import java.util.Objects;

/**
 * Flowchart node.
 *
 * @param id node identifier
 * @param text label inside the shape brackets, or {@code null} for bare or auto-created nodes
 * @param shape node shape, {@link NodeShape#RECTANGLE} by default
 * @param classes style classes from {@code :::name} or {@code class} statements
 * @param icon icon reference, or {@code null}
 */
public record FlowNode(
    String id,
    String text,
    NodeShape shape,
    List<String> classes,
    String icon
) {
    public FlowNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        classes = classes == null ? List.of() : List.copyOf(classes);
    }

    /**
     * @param id node id
     * @return rectangle node without label
     */
    public static FlowNode bare(String id) {
        return new FlowNode(id, null, NodeShape.RECTANGLE, List.of(), null);
    }
}
