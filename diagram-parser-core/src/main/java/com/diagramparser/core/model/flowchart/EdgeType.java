package com.diagramparser.core.model.flowchart;

/**
 * Link styles between flowchart nodes.
 */
public enum EdgeType {
    /** {@code -->} */
    ARROW,
    /** {@code -.->} */
    DOTTED_ARROW,
    /** {@code ==>} */
    THICK_ARROW,
    /** {@code ---} */
    OPEN_LINK,
    /** {@code -.-} */
    DOTTED_LINK,
    /** {@code ===} */
    THICK_LINK,
    /** {@code ~~~} */
    INVISIBLE,
    /** {@code --o} */
    CIRCLE_EDGE,
    /** {@code --x} */
    CROSS_EDGE,
    /** {@code <-->} */
    MULTI_DIRECTIONAL
}
