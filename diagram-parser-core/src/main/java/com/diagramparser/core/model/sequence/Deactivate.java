package com.diagramparser.core.model.sequence;

import java.util.Objects;

/**
 * {@code deactivate actor}
 *
 * @param actor canonical participant name
 */
public record Deactivate(
    String actor
) implements SequenceStatement {

    public Deactivate {
        Objects.requireNonNull(actor, "actor must not be null");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDeactivate(this);
    }
}
