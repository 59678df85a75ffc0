package com.diagramparser.core.error;

import com.diagramparser.core.model.DiagramKind;

import java.util.Objects;

/**
 * Thrown when a header is recognised but this library has no grammar for its kind,
 * or the kind was disabled through configuration.
 */
public class UnsupportedDiagramTypeException extends DiagramParseException {

    private final DiagramKind kind;

    public UnsupportedDiagramTypeException(DiagramKind kind) {
        super("Diagram type '" + kind.getId() + "' is not supported");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public DiagramKind getDiagramKind() {
        return kind;
    }

    @Override
    public ParseErrorKind getKind() {
        return ParseErrorKind.UNSUPPORTED_DIAGRAM_TYPE;
    }
}
