package com.diagramparser.core.grammar.base;

/**
 * Result of running one source line through a {@link HeaderValidator}.
 *
 * @param text trimmed line
 * @param lineNumber 1-based line number
 * @param skip true if the grammar should not treat the line as a body statement
 * @param header the matched header literal when this line is the header, otherwise {@code null}
 */
public record ValidatedLine(
    String text,
    int lineNumber,
    boolean skip,
    String header
) {
    public boolean isHeader() {
        return header != null;
    }

    /**
     * @return text following the header literal, trimmed; empty for body lines
     */
    public String headerRemainder() {
        return header == null ? "" : text.substring(header.length()).trim();
    }
}
