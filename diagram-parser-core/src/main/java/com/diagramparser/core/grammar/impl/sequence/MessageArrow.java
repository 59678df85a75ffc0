package com.diagramparser.core.grammar.impl.sequence;

import com.diagramparser.core.model.sequence.ArrowType;

import java.util.List;

/**
 * Arrow literals of sequence messages, longest first.
 *
 * <p>Order matters: {@code ->} is a prefix of {@code ->>} and {@code -->}, so the
 * shorter literals are only tried after every longer one failed to match.
 *
 * @param literal arrow text
 * @param type arrow style
 */
record MessageArrow(
    String literal,
    ArrowType type
) {
    static final List<MessageArrow> LONGEST_FIRST = List.of(
        new MessageArrow("<<-->>", ArrowType.BI_DIRECTIONAL_DOTTED),
        new MessageArrow("<<->>", ArrowType.BI_DIRECTIONAL_SOLID),
        new MessageArrow("-->>", ArrowType.DOTTED_CLOSED),
        new MessageArrow("->>", ArrowType.SOLID_CLOSED),
        new MessageArrow("-->", ArrowType.DOTTED_OPEN),
        new MessageArrow("->", ArrowType.SOLID_OPEN),
        new MessageArrow("--x", ArrowType.CROSS),
        new MessageArrow("-x", ArrowType.CROSS),
        new MessageArrow("--)", ArrowType.POINT),
        new MessageArrow("-)", ArrowType.POINT)
    );
}
