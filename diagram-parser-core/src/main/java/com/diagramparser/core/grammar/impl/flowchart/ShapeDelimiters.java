package com.diagramparser.core.grammar.impl.flowchart;

import com.diagramparser.core.model.flowchart.NodeShape;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Opener and closer literals of node shapes.
 *
 * <p>Most openers have a single closer. {@code [/} and <code>[\</code> each accept two,
 * which tells parallelograms apart from trapezoids.
 */
final class ShapeDelimiters {

    private static final Map<String, Map<String, NodeShape>> CLOSERS = new LinkedHashMap<>();

    static {
        // Longest openers first: the lexer tries them in this order
        register("(((", ")))", NodeShape.DOUBLE_CIRCLE);
        register("((", "))", NodeShape.CIRCLE);
        register("([", "])", NodeShape.STADIUM);
        register("[(", ")]", NodeShape.CYLINDER);
        register("[[", "]]", NodeShape.SUBROUTINE);
        register("{{", "}}", NodeShape.HEXAGON);
        register("[/", "/]", NodeShape.PARALLELOGRAM);
        register("[/", "\\]", NodeShape.TRAPEZOID);
        register("[\\", "\\]", NodeShape.PARALLELOGRAM_ALT);
        register("[\\", "/]", NodeShape.TRAPEZOID_ALT);
        register("[", "]", NodeShape.RECTANGLE);
        register("(", ")", NodeShape.ROUNDED_RECTANGLE);
        register("{", "}", NodeShape.RHOMBUS);
        register(">", "]", NodeShape.ASYMMETRIC);
    }

    private ShapeDelimiters() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    private static void register(String opener, String closer, NodeShape shape) {
        CLOSERS.computeIfAbsent(opener, key -> new LinkedHashMap<>()).put(closer, shape);
    }

    /**
     * @return opener literals, longest first
     */
    static List<String> openers() {
        return List.copyOf(CLOSERS.keySet());
    }

    /**
     * @param opener opener literal
     * @return closer literals accepted for this opener, longest first
     */
    static List<String> closersFor(String opener) {
        Map<String, NodeShape> closers = CLOSERS.get(opener);
        if (closers == null) {
            return List.of();
        }
        return closers.keySet().stream()
            .sorted((a, b) -> Integer.compare(b.length(), a.length()))
            .toList();
    }

    /**
     * @return shape for an opener/closer pair, or {@code null} if they do not pair up
     */
    static NodeShape shapeOf(String opener, String closer) {
        Map<String, NodeShape> closers = CLOSERS.get(opener);
        return closers == null ? null : closers.get(closer);
    }
}
