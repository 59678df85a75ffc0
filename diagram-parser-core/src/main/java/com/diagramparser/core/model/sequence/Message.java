package com.diagramparser.core.model.sequence;

import java.util.Objects;

/**
 * Message between two participants.
 *
 * @param from canonical name of the sender
 * @param to canonical name of the receiver
 * @param text message text, empty when the line has no {@code :}
 * @param arrowType arrow style
 */
public record Message(
    String from,
    String to,
    String text,
    ArrowType arrowType
) implements SequenceStatement {

    public Message {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(arrowType, "arrowType must not be null");
        text = text == null ? "" : text;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMessage(this);
    }
}
