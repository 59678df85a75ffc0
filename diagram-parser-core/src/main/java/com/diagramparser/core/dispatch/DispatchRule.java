package com.diagramparser.core.dispatch;

import com.diagramparser.core.grammar.DiagramGrammar;
import com.diagramparser.core.model.DiagramKind;

import java.util.List;
import java.util.Objects;

/**
 * One row of the dispatch table: header literals, the kind they identify, and the
 * grammar that parses it.
 *
 * @param literals lowercase header literals, matched as prefixes of the lowercased first line
 * @param kind diagram kind identified by the literals
 * @param grammar grammar bound to the kind, or {@code null} if this library has none
 */
public record DispatchRule(
    List<String> literals,
    DiagramKind kind,
    DiagramGrammar<?> grammar
) {
    public DispatchRule {
        Objects.requireNonNull(kind, "kind must not be null");
        if (literals == null || literals.isEmpty()) {
            throw new IllegalArgumentException("At least one literal required for " + kind);
        }
        literals = List.copyOf(literals);
    }

    /**
     * Returns the first literal the header starts with.
     *
     * @param header lowercased, trimmed first line
     * @return matching literal, or {@code null}
     */
    public String match(String header) {
        for (String literal : literals) {
            if (header.startsWith(literal)) {
                return literal;
            }
        }
        return null;
    }

    public boolean hasGrammar() {
        return grammar != null;
    }
}
