package com.diagramparser.core.error;

/**
 * Base class for every hard failure raised while parsing diagram text.
 *
 * <p>Parsing reports at most one error: the first hard failure aborts the parse.
 * Malformed body lines never surface here; grammars skip them and keep going.
 *
 * @see ParseErrorKind
 */
public abstract class DiagramParseException extends Exception {

    protected DiagramParseException(String message) {
        super(message);
    }

    /**
     * Returns the kind of failure, one per concrete subclass.
     *
     * @return error kind
     */
    public abstract ParseErrorKind getKind();
}
