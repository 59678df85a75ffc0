package com.diagramparser.core.model.sequence;

import java.util.List;

/**
 * {@code critical condition ... option condition ... end}
 *
 * @param condition critical section label, may be empty
 * @param statements critical section body
 * @param options option branches in source order
 */
public record Critical(
    String condition,
    List<SequenceStatement> statements,
    List<Option> options
) implements SequenceStatement {

    public Critical {
        condition = condition == null ? "" : condition;
        statements = statements == null ? List.of() : List.copyOf(statements);
        options = options == null ? List.of() : List.copyOf(options);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCritical(this);
    }

    /**
     * @param condition option label, may be empty
     * @param statements option body
     */
    public record Option(
        String condition,
        List<SequenceStatement> statements
    ) {
        public Option {
            condition = condition == null ? "" : condition;
            statements = statements == null ? List.of() : List.copyOf(statements);
        }
    }
}
