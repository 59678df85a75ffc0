package com.diagramparser.core.model.sequence;

import java.util.Objects;

/**
 * {@code create participant X} declared mid-sequence.
 *
 * @param participant the created participant, also registered in the diagram's participant list
 */
public record Create(
    Participant participant
) implements SequenceStatement {

    public Create {
        Objects.requireNonNull(participant, "participant must not be null");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCreate(this);
    }
}
