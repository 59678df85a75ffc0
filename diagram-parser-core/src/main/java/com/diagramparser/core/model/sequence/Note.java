package com.diagramparser.core.model.sequence;

import java.util.Objects;

/**
 * Note placed next to or over participants.
 *
 * @param position placement
 * @param actor canonical participant name; for {@code over A,B} the names joined with a comma
 * @param text note text
 */
public record Note(
    NotePosition position,
    String actor,
    String text
) implements SequenceStatement {

    public Note {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(actor, "actor must not be null");
        text = text == null ? "" : text;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitNote(this);
    }
}
