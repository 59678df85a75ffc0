package com.diagramparser.core.grammar.base;

import java.util.List;

/**
 * Header keywords accepted by the grammars in this library, in source case.
 */
public final class HeaderLiterals {

    public static final String STATE_V1 = "stateDiagram";
    public static final String STATE_V2 = "stateDiagram-v2";
    public static final List<String> STATE = List.of(STATE_V1, STATE_V2);

    public static final String SEQUENCE_DIAGRAM = "sequenceDiagram";
    public static final List<String> SEQUENCE = List.of(SEQUENCE_DIAGRAM);

    public static final String FLOWCHART_KEYWORD = "flowchart";
    public static final String GRAPH_KEYWORD = "graph";
    public static final List<String> FLOWCHART = List.of(FLOWCHART_KEYWORD, GRAPH_KEYWORD);

    private HeaderLiterals() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
