package com.diagramparser.core.model.sequence;

import java.util.List;

/**
 * {@code opt condition ... end}
 *
 * @param condition option label, may be empty
 * @param statements body
 */
public record Opt(
    String condition,
    List<SequenceStatement> statements
) implements SequenceStatement {

    public Opt {
        condition = condition == null ? "" : condition;
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitOpt(this);
    }
}
