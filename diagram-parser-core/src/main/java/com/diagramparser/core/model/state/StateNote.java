package com.diagramparser.core.model.state;

import java.util.Objects;

/**
 * Note attached to a state.
 *
 * @param position placement of the note
 * @param target id of the annotated state
 * @param text note text, multi-line notes joined with newlines
 */
public record StateNote(
    StateNotePosition position,
    String target,
    String text
) {
    public StateNote {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}
