package com.diagramparser.core.error;

import java.util.List;

/**
 * Structural grammar violation, raised mainly when a diagram header does not match
 * the literals its grammar accepts.
 *
 * <p>Line and column are 1-based.
 */
public class DiagramSyntaxException extends DiagramParseException {

    private final String detail;
    private final List<String> expected;
    private final String found;
    private final int line;
    private final int column;

    public DiagramSyntaxException(String detail, List<String> expected, String found, int line, int column) {
        super(String.format("Syntax error at line %d, column %d: %s. Expected one of: [%s], but found: '%s'",
            line, column, detail, String.join(", ", expected), found));
        this.detail = detail;
        this.expected = List.copyOf(expected);
        this.found = found;
        this.line = line;
        this.column = column;
    }

    /**
     * @return short description without location or expectation details
     */
    public String getDetail() {
        return detail;
    }

    public List<String> getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public ParseErrorKind getKind() {
        return ParseErrorKind.SYNTAX_ERROR;
    }
}
