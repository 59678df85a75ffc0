package com.diagramparser.core.model.sequence;

/**
 * Message numbering set by an {@code autonumber} directive.
 *
 * @param start first number, or {@code null} if absent or not numeric
 * @param step increment, or {@code null} if absent or not numeric
 * @param visible false for {@code autonumber off}
 */
public record AutoNumber(
    Integer start,
    Integer step,
    boolean visible
) {
}
