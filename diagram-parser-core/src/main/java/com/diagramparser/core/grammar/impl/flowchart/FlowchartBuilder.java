package com.diagramparser.core.grammar.impl.flowchart;

import com.diagramparser.core.model.AccessibilityInfo;
import com.diagramparser.core.model.flowchart.ClassDef;
import com.diagramparser.core.model.flowchart.ClickEvent;
import com.diagramparser.core.model.flowchart.FlowDirection;
import com.diagramparser.core.model.flowchart.FlowEdge;
import com.diagramparser.core.model.flowchart.FlowNode;
import com.diagramparser.core.model.flowchart.FlowchartDiagram;
import com.diagramparser.core.model.flowchart.NodeShape;
import com.diagramparser.core.model.flowchart.StyleDefinition;
import com.diagramparser.core.model.flowchart.Subgraph;
import com.diagramparser.core.util.SyntheticIdGenerator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable flowchart under construction for a single parse.
 *
 * <p>Nodes keep first-seen order. While a subgraph is open every node and edge touched
 * is also recorded in it; nodes of a nested subgraph are not repeated in its parent.
 */
final class FlowchartBuilder {

    private final Map<String, NodeDraft> nodes = new LinkedHashMap<>();
    private final List<FlowEdge> edges = new ArrayList<>();
    private final List<Subgraph> subgraphs = new ArrayList<>();
    private final Deque<SubgraphFrame> openSubgraphs = new ArrayDeque<>();
    private final Set<String> subgraphIds = new HashSet<>();
    private final List<StyleDefinition> styles = new ArrayList<>();
    private final Map<String, ClassDef> classDefs = new LinkedHashMap<>();
    private final List<ClickEvent> clicks = new ArrayList<>();
    private final SyntheticIdGenerator subgraphIdGenerator;

    FlowchartBuilder(SyntheticIdGenerator subgraphIdGenerator) {
        this.subgraphIdGenerator = subgraphIdGenerator;
    }

    /**
     * Registers a reference to a node, creating a bare rectangle if it is new.
     */
    void ensureNode(String id) {
        nodes.computeIfAbsent(id, NodeDraft::new);
        SubgraphFrame frame = openSubgraphs.peek();
        if (frame != null) {
            frame.nodes.add(id);
        }
    }

    /**
     * Sets shape and label of a node; later definitions override earlier ones.
     */
    void defineNode(String id, NodeShape shape, String text) {
        ensureNode(id);
        NodeDraft draft = nodes.get(id);
        draft.shape = shape;
        draft.text = text;
    }

    /**
     * Adds a style class to a node, creating the node if needed.
     */
    void addClass(String id, String className) {
        ensureNode(id);
        List<String> classes = nodes.get(id).classes;
        if (!classes.contains(className)) {
            classes.add(className);
        }
    }

    boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    void addEdge(FlowEdge edge) {
        ensureNode(edge.from());
        ensureNode(edge.to());
        edges.add(edge);
        SubgraphFrame frame = openSubgraphs.peek();
        if (frame != null) {
            frame.edges.add(edge);
        }
    }

    /**
     * Opens a subgraph; a {@code null} id gets a generated one.
     *
     * @return id of the opened subgraph
     */
    String openSubgraph(String id, String title) {
        String resolved = id == null ? subgraphIdGenerator.next() : id;
        subgraphIds.add(resolved);
        openSubgraphs.push(new SubgraphFrame(resolved, title));
        return resolved;
    }

    /**
     * Closes the innermost subgraph.
     *
     * @return false if none was open
     */
    boolean closeSubgraph() {
        SubgraphFrame frame = openSubgraphs.poll();
        if (frame == null) {
            return false;
        }
        Subgraph subgraph = frame.freeze();
        SubgraphFrame parent = openSubgraphs.peek();
        if (parent == null) {
            subgraphs.add(subgraph);
        } else {
            parent.children.add(subgraph);
        }
        return true;
    }

    /**
     * Sets the direction of the innermost open subgraph.
     *
     * @return false if no subgraph is open
     */
    boolean setSubgraphDirection(FlowDirection direction) {
        SubgraphFrame frame = openSubgraphs.peek();
        if (frame == null) {
            return false;
        }
        frame.direction = direction;
        return true;
    }

    boolean isSubgraph(String id) {
        return subgraphIds.contains(id);
    }

    void addStyle(StyleDefinition style) {
        styles.add(style);
    }

    void addClassDef(ClassDef classDef) {
        classDefs.put(classDef.name(), classDef);
    }

    void addClick(ClickEvent click) {
        clicks.add(click);
    }

    int openSubgraphCount() {
        return openSubgraphs.size();
    }

    FlowchartDiagram build(String title, AccessibilityInfo accessibility, FlowDirection direction) {
        while (!openSubgraphs.isEmpty()) {
            closeSubgraph();
        }
        Map<String, FlowNode> frozen = new LinkedHashMap<>();
        for (NodeDraft draft : nodes.values()) {
            frozen.put(draft.id, new FlowNode(draft.id, draft.text, draft.shape, draft.classes, null));
        }
        return new FlowchartDiagram(title, accessibility, direction, frozen, edges, subgraphs,
            styles, classDefs, clicks);
    }

    private static final class NodeDraft {
        private final String id;
        private String text;
        private NodeShape shape = NodeShape.RECTANGLE;
        private final List<String> classes = new ArrayList<>();

        private NodeDraft(String id) {
            this.id = id;
        }
    }

    private static final class SubgraphFrame {
        private final String id;
        private final String title;
        private FlowDirection direction;
        private final Set<String> nodes = new LinkedHashSet<>();
        private final List<FlowEdge> edges = new ArrayList<>();
        private final List<Subgraph> children = new ArrayList<>();

        private SubgraphFrame(String id, String title) {
            this.id = id;
            this.title = title;
        }

        private Subgraph freeze() {
            return new Subgraph(id, title, List.copyOf(nodes), edges, children, direction);
        }
    }
}
