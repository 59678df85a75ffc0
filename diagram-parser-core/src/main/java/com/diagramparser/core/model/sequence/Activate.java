package com.diagramparser.core.model.sequence;

import java.util.Objects;

/**
 * {@code activate actor}
 *
 * @param actor canonical participant name
 */
public record Activate(
    String actor
) implements SequenceStatement {

    public Activate {
        Objects.requireNonNull(actor, "actor must not be null");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitActivate(this);
    }
}
