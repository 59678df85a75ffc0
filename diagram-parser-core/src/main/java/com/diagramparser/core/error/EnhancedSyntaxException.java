package com.diagramparser.core.error;

import java.util.List;

/**
 * Syntax error that also carries actionable hints, e.g. {@code did you mean 'stateDiagram'?},
 * and a caret snippet pointing at the offending text.
 *
 * <p>It is a {@link DiagramSyntaxException}, so callers that only handle plain syntax
 * errors still see the expected literals and location.
 */
public class EnhancedSyntaxException extends DiagramSyntaxException {

    private final List<String> suggestions;
    private final String snippet;

    public EnhancedSyntaxException(String detail, List<String> expected, String found, int line, int column,
                                   List<String> suggestions, String snippet) {
        super(detail, expected, found, line, column);
        this.suggestions = List.copyOf(suggestions);
        this.snippet = snippet == null ? "" : snippet;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public String getSnippet() {
        return snippet;
    }

    @Override
    public String getMessage() {
        StringBuilder message = new StringBuilder(super.getMessage());
        if (!snippet.isEmpty()) {
            message.append(System.lineSeparator()).append(snippet);
        }
        for (String suggestion : suggestions) {
            message.append(System.lineSeparator()).append(" = help: ").append(suggestion);
        }
        return message.toString();
    }

    @Override
    public ParseErrorKind getKind() {
        return ParseErrorKind.ENHANCED_SYNTAX_ERROR;
    }

    /**
     * Renders a source line with a caret marker underneath.
     *
     * <pre>{@code
     * 1 | statediagram
     *     ^^^^^^^^^^^^ expected
     * }</pre>
     *
     * @param sourceLine raw text of the offending line
     * @param line 1-based line number
     * @param column 1-based start column
     * @param length number of characters to underline (at least one caret is drawn)
     * @return formatted snippet
     */
    public static String formatSnippet(String sourceLine, int line, int column, int length) {
        String gutter = line + " | ";
        return gutter + sourceLine + System.lineSeparator()
            + " ".repeat(gutter.length() + Math.max(0, column - 1))
            + "^".repeat(Math.max(1, length))
            + " expected";
    }
}
