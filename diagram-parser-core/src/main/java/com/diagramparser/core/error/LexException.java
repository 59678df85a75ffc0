package com.diagramparser.core.error;

/**
 * Tokenization failure, e.g. a quoted label that never closes.
 */
public class LexException extends DiagramParseException {

    private final String detail;
    private final int line;
    private final int column;

    public LexException(String detail, int line, int column) {
        super(String.format("Lexical error at line %d, column %d: %s", line, column, detail));
        this.detail = detail;
        this.line = line;
        this.column = column;
    }

    public String getDetail() {
        return detail;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public ParseErrorKind getKind() {
        return ParseErrorKind.LEX_ERROR;
    }
}
