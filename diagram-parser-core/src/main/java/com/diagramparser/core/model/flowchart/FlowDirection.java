package com.diagramparser.core.model.flowchart;

import java.util.Locale;

/**
 * Layout direction of a flowchart or subgraph.
 */
public enum FlowDirection {
    /** Top to bottom */
    TB,
    /** Top down, same layout as {@link #TB} */
    TD,
    /** Bottom to top */
    BT,
    /** Right to left */
    RL,
    /** Left to right */
    LR;

    /**
     * Parses a direction literal, case-insensitively.
     *
     * @param value literal such as {@code "LR"}
     * @return direction, or {@code null} for anything else
     */
    public static FlowDirection fromLiteral(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "TB" -> TB;
            case "TD" -> TD;
            case "BT" -> BT;
            case "RL" -> RL;
            case "LR" -> LR;
            default -> null;
        };
    }
}
