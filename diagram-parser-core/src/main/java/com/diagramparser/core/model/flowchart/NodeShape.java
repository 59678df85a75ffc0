package com.diagramparser.core.model.flowchart;

/**
 * Node shapes and the bracket pairs that produce them.
 */
public enum NodeShape {
    /** {@code [text]} */
    RECTANGLE,
    /** {@code (text)} */
    ROUNDED_RECTANGLE,
    /** {@code ([text])} */
    STADIUM,
    /** {@code [[text]]} */
    SUBROUTINE,
    /** {@code [(text)]} */
    CYLINDER,
    /** {@code ((text))} */
    CIRCLE,
    /** {@code (((text)))} */
    DOUBLE_CIRCLE,
    /** {@code >text]} */
    ASYMMETRIC,
    /** {@code {text}} */
    RHOMBUS,
    /** {@code {{text}}} */
    HEXAGON,
    /** {@code [/text/]} */
    PARALLELOGRAM,
    /** {@code [\text\]} */
    PARALLELOGRAM_ALT,
    /** {@code [/text\]} */
    TRAPEZOID,
    /** {@code [\text/]} */
    TRAPEZOID_ALT
}
