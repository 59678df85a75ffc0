package com.diagramparser.core.grammar;

import com.diagramparser.core.error.DiagramParseException;
import com.diagramparser.core.model.DiagramAst;
import com.diagramparser.core.model.DiagramKind;

import java.util.List;

/**
 * Parser for one diagram family.
 *
 * <p>A grammar turns the full source text of a diagram, header line included, into an
 * immutable syntax tree. Grammars hold no per-parse state, so a single instance may be
 * shared between threads.
 *
 * <p>Grammars are built explicitly by {@link com.diagramparser.core.dispatch.DiagramParser};
 * there is no service registry.
 *
 * @param <T> syntax tree type produced by this grammar
 * @see com.diagramparser.core.grammar.base.AbstractLineGrammar
 */
public interface DiagramGrammar<T extends DiagramAst> {

    /**
     * @return diagram family this grammar parses
     */
    DiagramKind getKind();

    /**
     * Returns a human-readable name used in logs (e.g., "State Diagram Grammar").
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the case-sensitive header literals the first meaningful line must start with.
     *
     * @return accepted header literals
     */
    List<String> getHeaderLiterals();

    /**
     * Parses diagram source text.
     *
     * <p>Only empty input and header problems (and, for token-based grammars, lexical
     * errors) are reported as exceptions. Malformed body lines are skipped and the
     * rest of the diagram is still returned.
     *
     * @param text full diagram source
     * @return syntax tree
     * @throws DiagramParseException on the first hard failure
     */
    T parse(String text) throws DiagramParseException;
}
