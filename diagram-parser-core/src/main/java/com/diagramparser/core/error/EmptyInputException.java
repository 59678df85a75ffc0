package com.diagramparser.core.error;

/**
 * Thrown when the input contains nothing but whitespace and comments.
 */
public class EmptyInputException extends DiagramParseException {

    public EmptyInputException() {
        super("Input is empty or contains no valid diagram content");
    }

    @Override
    public ParseErrorKind getKind() {
        return ParseErrorKind.EMPTY_INPUT;
    }
}
