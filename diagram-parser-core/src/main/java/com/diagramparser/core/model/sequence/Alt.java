package com.diagramparser.core.model.sequence;

import java.util.List;

/**
 * {@code alt condition ... else condition ... end}
 *
 * <p>Only one else branch is kept. Statements following further {@code else} lines are
 * appended to it; the first else condition wins.
 *
 * @param condition primary branch label, may be empty
 * @param statements primary branch body
 * @param elseBranch else branch, or {@code null} if the block had no {@code else}
 */
public record Alt(
    String condition,
    List<SequenceStatement> statements,
    ElseBranch elseBranch
) implements SequenceStatement {

    public Alt {
        condition = condition == null ? "" : condition;
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitAlt(this);
    }

    /**
     * @param condition text after {@code else}, or {@code null}
     * @param statements branch body
     */
    public record ElseBranch(
        String condition,
        List<SequenceStatement> statements
    ) {
        public ElseBranch {
            statements = statements == null ? List.of() : List.copyOf(statements);
        }
    }
}
