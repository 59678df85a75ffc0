package com.diagramparser.core.model.sequence;

/**
 * Message arrow styles.
 *
 * <p>Source literals in the order they must be tried:
 * <pre>
 * &lt;&lt;--&gt;&gt;  BI_DIRECTIONAL_DOTTED
 * &lt;&lt;-&gt;&gt;   BI_DIRECTIONAL_SOLID
 * --&gt;&gt;    DOTTED_CLOSED
 * -&gt;&gt;     SOLID_CLOSED
 * --&gt;     DOTTED_OPEN
 * -&gt;      SOLID_OPEN
 * --x, -x  CROSS
 * --), -)  POINT
 * </pre>
 */
public enum ArrowType {
    SOLID_OPEN,
    SOLID_CLOSED,
    DOTTED_OPEN,
    DOTTED_CLOSED,
    CROSS,
    POINT,
    BI_DIRECTIONAL_SOLID,
    BI_DIRECTIONAL_DOTTED
}
