package com.diagramparser.core.grammar.impl.flowchart;

import java.util.Objects;

/**
 * One lexical token of a flowchart statement.
 *
 * @param type token category
 * @param lexeme exact source text
 * @param text semantic text: string content for {@link FlowTokenType#STRING}, otherwise the lexeme
 * @param spaceBefore true if whitespace preceded the token, used to rebuild label text
 * @param column 1-based column in the source line
 */
public record FlowToken(
    FlowTokenType type,
    String lexeme,
    String text,
    boolean spaceBefore,
    int column
) {
    public FlowToken {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(lexeme, "lexeme must not be null");
        if (text == null) {
            text = lexeme;
        }
    }

    public boolean is(FlowTokenType expected) {
        return type == expected;
    }
}
