package com.diagramparser.core.model.sequence;

import java.util.List;

/**
 * {@code loop condition ... end}
 *
 * @param condition loop label, may be empty
 * @param statements body
 */
public record Loop(
    String condition,
    List<SequenceStatement> statements
) implements SequenceStatement {

    public Loop {
        condition = condition == null ? "" : condition;
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLoop(this);
    }
}
