package com.diagramparser.core.model.flowchart;

import com.diagramparser.core.model.AccessibilityInfo;
import com.diagramparser.core.model.DiagramAst;
import com.diagramparser.core.model.DiagramKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Syntax tree of a flowchart ({@code flowchart} or {@code graph} header).
 *
 * <p>Every edge endpoint is a key of {@link #nodes()}. Node order follows first
 * appearance in the source.
 *
 * @param title diagram title, or {@code null}
 * @param accessibility accessibility metadata
 * @param direction layout direction
 * @param nodes nodes keyed by id
 * @param edges all edges, including those declared inside subgraphs
 * @param subgraphs top-level subgraphs
 * @param styles {@code style} statements
 * @param classDefs {@code classDef} statements keyed by class name
 * @param clicks {@code click} statements
 */
public record FlowchartDiagram(
    String title,
    AccessibilityInfo accessibility,
    FlowDirection direction,
    Map<String, FlowNode> nodes,
    List<FlowEdge> edges,
    List<Subgraph> subgraphs,
    List<StyleDefinition> styles,
    Map<String, ClassDef> classDefs,
    List<ClickEvent> clicks
) implements DiagramAst {

    public FlowchartDiagram {
        Objects.requireNonNull(direction, "direction must not be null");
        accessibility = accessibility == null ? AccessibilityInfo.empty() : accessibility;
        nodes = nodes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        edges = edges == null ? List.of() : List.copyOf(edges);
        subgraphs = subgraphs == null ? List.of() : List.copyOf(subgraphs);
        styles = styles == null ? List.of() : List.copyOf(styles);
        classDefs = classDefs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(classDefs));
        clicks = clicks == null ? List.of() : List.copyOf(clicks);
    }

    @Override
    public DiagramKind kind() {
        return DiagramKind.FLOWCHART;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFlowchart(this);
    }
}
