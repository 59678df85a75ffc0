package com.diagramparser.core.model.sequence;

import java.util.Objects;

/**
 * {@code destroy actor}
 *
 * @param actor canonical participant name
 */
public record Destroy(
    String actor
) implements SequenceStatement {

    public Destroy {
        Objects.requireNonNull(actor, "actor must not be null");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDestroy(this);
    }
}
