package com.diagramparser.core.dispatch;

import com.diagramparser.core.error.EmptyInputException;
import com.diagramparser.core.error.UnknownDiagramTypeException;
import com.diagramparser.core.grammar.base.LexicalRules;

import java.util.Locale;
import java.util.Objects;

/**
 * Finds the header line of a diagram and matches it against a {@link DispatchTable}.
 *
 * <p>Blank lines and comments ({@code %%}, {@code //} and {@code #}) before the header
 * are skipped. The header is trimmed and lowercased before matching.
 *
 * @since 1.0.0
 */
public final class DiagramTypeSniffer {

    private final DispatchTable table;

    public DiagramTypeSniffer(DispatchTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    /**
     * Selects the rule for a diagram.
     *
     * @param text full diagram text
     * @return rule matching the header
     * @throws EmptyInputException if the text has no header line
     * @throws UnknownDiagramTypeException if no rule matches the header
     */
    public DispatchRule sniff(String text) throws EmptyInputException, UnknownDiagramTypeException {
        String header = headerLine(text);
        if (header == null) {
            throw new EmptyInputException();
        }
        String normalized = header.toLowerCase(Locale.ROOT);
        return table.ruleFor(normalized)
            .orElseThrow(() -> new UnknownDiagramTypeException(header));
    }

    /**
     * @param text diagram text
     * @return first line that is neither blank nor a comment, trimmed; {@code null} if none
     */
    static String headerLine(String text) {
        return text.lines()
            .map(String::trim)
            .filter(line -> !LexicalRules.isPreambleLine(line))
            .findFirst()
            .orElse(null);
    }
}
