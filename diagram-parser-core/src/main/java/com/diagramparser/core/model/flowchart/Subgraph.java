package com.diagramparser.core.model.flowchart;

import java.util.List;
import java.util.Objects;

/**
 * {@code subgraph id [title] ... end}
 *
 * @param id explicit id, or a generated one for anonymous subgraphs
 * @param title display title, or {@code null}
 * @param nodes ids of nodes referenced inside the block, first-seen order
 * @param edges edges declared inside the block
 * @param subgraphs nested subgraphs
 * @param direction {@code direction} override inside the block, or {@code null}
 */
public record Subgraph(
    String id,
    String title,
    List<String> nodes,
    List<FlowEdge> edges,
    List<Subgraph> subgraphs,
    FlowDirection direction
) {
    public Subgraph {
        Objects.requireNonNull(id, "id must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        subgraphs = subgraphs == null ? List.of() : List.copyOf(subgraphs);
    }
}
