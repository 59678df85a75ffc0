package com.diagramparser.core.error;

import java.util.Objects;

/**
 * Thrown when the first meaningful line matches no header literal.
 */
public class UnknownDiagramTypeException extends DiagramParseException {

    private final String header;

    public UnknownDiagramTypeException(String header) {
        super("Unknown diagram type: '" + header + "'");
        this.header = Objects.requireNonNull(header, "header must not be null");
    }

    /**
     * @return the (trimmed, lowercased) header line that failed to match
     */
    public String getHeader() {
        return header;
    }

    @Override
    public ParseErrorKind getKind() {
        return ParseErrorKind.UNKNOWN_DIAGRAM_TYPE;
    }
}
