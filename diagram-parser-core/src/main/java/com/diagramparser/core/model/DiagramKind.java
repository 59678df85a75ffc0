package com.diagramparser.core.model;

/**
 * Diagram families recognised by the dispatcher.
 *
 * <p>Only {@link #STATE}, {@link #SEQUENCE} and {@link #FLOWCHART} have grammars in this
 * library; the remaining kinds are detected so that callers can distinguish a known
 * diagram type from unrecognised text.
 */
public enum DiagramKind {
    SANKEY("sankey"),
    TIMELINE("timeline"),
    JOURNEY("journey"),
    SEQUENCE("sequence"),
    CLASS("class"),
    STATE("state"),
    FLOWCHART("flowchart"),
    GANTT("gantt"),
    PIE("pie"),
    GIT("git"),
    INFO("info"),
    ER("er"),
    C4("c4"),
    MINDMAP("mindmap"),
    QUADRANT("quadrant"),
    XY_CHART("xychart"),
    KANBAN("kanban"),
    BLOCK("block"),
    ARCHITECTURE("architecture"),
    PACKET("packet"),
    REQUIREMENT("requirement"),
    TREEMAP("treemap"),
    RADAR("radar");

    private final String id;

    DiagramKind(String id) {
        this.id = id;
    }

    /**
     * Stable lowercase identifier, also used in configuration files.
     *
     * @return kind identifier
     */
    public String getId() {
        return id;
    }

    /**
     * Looks up a kind by its identifier, ignoring case.
     *
     * @param id identifier such as {@code "sankey"}
     * @return matching kind, or {@code null} if none matches
     */
    public static DiagramKind fromId(String id) {
        if (id == null) {
            return null;
        }
        for (DiagramKind kind : values()) {
            if (kind.id.equalsIgnoreCase(id.trim())) {
                return kind;
            }
        }
        return null;
    }
}
