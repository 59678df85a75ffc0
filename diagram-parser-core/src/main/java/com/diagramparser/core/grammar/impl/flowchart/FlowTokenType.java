package com.diagramparser.core.grammar.impl.flowchart;

/**
 * Token categories produced by {@link FlowchartLexer}.
 */
public enum FlowTokenType {
    /** Node id or plain word: letters, digits and underscores */
    IDENTIFIER,
    /** Double-quoted string; {@link FlowToken#text()} holds the content without quotes */
    STRING,
    /** Shape opener directly following an identifier, e.g. {@code [}, {@code ((} or {@code [/} */
    SHAPE_OPEN,
    /** Closer matching the currently open shape */
    SHAPE_CLOSE,
    /** Complete link such as {@code -->}, {@code -.->} or {@code ==>} */
    LINK,
    /** Opening half of a text link: {@code --}, {@code ==} or {@code -.} */
    LINK_TEXT_START,
    /** {@code |} around edge labels */
    PIPE,
    /** {@code &} joining several nodes */
    AMPERSAND,
    /** {@code :::} before a class name */
    CLASS_SEPARATOR,
    /** {@code ;} separating statements on one line */
    SEMICOLON,
    /** Any other single character */
    TEXT
}
