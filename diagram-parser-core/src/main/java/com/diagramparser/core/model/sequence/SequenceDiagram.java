package com.diagramparser.core.model.sequence;

import com.diagramparser.core.model.AccessibilityInfo;
import com.diagramparser.core.model.DiagramAst;
import com.diagramparser.core.model.DiagramKind;

import java.util.List;

/**
 * Syntax tree of a sequence diagram.
 *
 * <p>Every message, activation and destroy endpoint names a participant in
 * {@link #participants()} by its canonical name.
 *
 * @param title diagram title, or {@code null}
 * @param accessibility accessibility metadata
 * @param participants participants in first-seen order, unique by {@link Participant#actor()}
 * @param statements top-level statements in source order
 * @param autonumber numbering settings, or {@code null} without an {@code autonumber} directive
 */
public record SequenceDiagram(
    String title,
    AccessibilityInfo accessibility,
    List<Participant> participants,
    List<SequenceStatement> statements,
    AutoNumber autonumber
) implements DiagramAst {

    public SequenceDiagram {
        accessibility = accessibility == null ? AccessibilityInfo.empty() : accessibility;
        participants = participants == null ? List.of() : List.copyOf(participants);
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    @Override
    public DiagramKind kind() {
        return DiagramKind.SEQUENCE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSequence(this);
    }
}
