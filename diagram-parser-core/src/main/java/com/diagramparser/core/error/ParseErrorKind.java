package com.diagramparser.core.error;

/**
 * Kinds of failure a parse can report.
 *
 * <p>Each kind corresponds to exactly one {@link DiagramParseException} subclass,
 * so callers can {@code switch} on {@link DiagramParseException#getKind()} instead
 * of chaining {@code instanceof} checks.
 */
public enum ParseErrorKind {
    /** Input has no content besides blank and comment lines */
    EMPTY_INPUT,

    /** First meaningful line matches no known header literal */
    UNKNOWN_DIAGRAM_TYPE,

    /** Header is recognised but no grammar is bound to its kind */
    UNSUPPORTED_DIAGRAM_TYPE,

    /** Structural grammar violation, mostly header mismatches */
    SYNTAX_ERROR,

    /** Tokenization failure */
    LEX_ERROR,

    /** Syntax error carrying suggestions and a source snippet */
    ENHANCED_SYNTAX_ERROR
}
