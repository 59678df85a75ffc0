package com.diagramparser.core.grammar.impl.flowchart;

import com.diagramparser.core.model.flowchart.EdgeType;

/**
 * Edge type and length decoded from a link lexeme.
 *
 * <p>A link drawn with more characters than its shortest form spans more ranks.
 * The shortest form has {@code minLength == null}; each extra character adds one,
 * starting from 2 ({@code --->} is 2, {@code ---->} is 3).
 *
 * @param edgeType link style
 * @param minLength rank length, or {@code null} for the shortest form
 */
record LinkSpec(
    EdgeType edgeType,
    Integer minLength
) {
    /**
     * Decodes a complete link lexeme produced by {@link FlowchartLexer}.
     *
     * @param lexeme link text such as {@code -->} or {@code -..->}
     * @return decoded link, or {@code null} if the lexeme is not a link
     */
    static LinkSpec parse(String lexeme) {
        if (lexeme.length() >= 4 && lexeme.startsWith("<") && lexeme.endsWith(">")) {
            return new LinkSpec(EdgeType.MULTI_DIRECTIONAL, null);
        }
        if (lexeme.startsWith(".")) {
            // Closing half of "-. text .->"
            return lexeme.endsWith(">")
                ? new LinkSpec(EdgeType.DOTTED_ARROW, null)
                : new LinkSpec(EdgeType.DOTTED_LINK, null);
        }
        int dots = count(lexeme, '.');
        if (dots > 0) {
            EdgeType type = lexeme.endsWith(">") ? EdgeType.DOTTED_ARROW : EdgeType.DOTTED_LINK;
            return new LinkSpec(type, extra(dots, 1));
        }
        char first = lexeme.charAt(0);
        char last = lexeme.charAt(lexeme.length() - 1);
        int run = count(lexeme, first);
        return switch (first) {
            case '-' -> switch (last) {
                case '>' -> new LinkSpec(EdgeType.ARROW, extra(run, 2));
                case 'o' -> new LinkSpec(EdgeType.CIRCLE_EDGE, extra(run, 2));
                case 'x' -> new LinkSpec(EdgeType.CROSS_EDGE, extra(run, 2));
                case '-' -> new LinkSpec(EdgeType.OPEN_LINK, extra(run, 3));
                default -> null;
            };
            case '=' -> last == '>'
                ? new LinkSpec(EdgeType.THICK_ARROW, extra(run, 2))
                : new LinkSpec(EdgeType.THICK_LINK, extra(run, 3));
            case '~' -> new LinkSpec(EdgeType.INVISIBLE, extra(run, 3));
            default -> null;
        };
    }

    private static Integer extra(int actual, int shortest) {
        return actual > shortest ? actual - shortest + 1 : null;
    }

    private static int count(String text, char c) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                count++;
            }
        }
        return count;
    }
}
