package com.diagramparser.core.model.sequence;

import java.util.List;

/**
 * {@code par label ... and label ... end}
 *
 * <p>The first branch comes from the {@code par} line itself, each {@code and} line
 * starts another one.
 *
 * @param branches parallel branches in source order, never empty
 */
public record Par(
    List<Branch> branches
) implements SequenceStatement {

    public Par {
        branches = branches == null ? List.of() : List.copyOf(branches);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPar(this);
    }

    /**
     * @param condition branch label, or {@code null}
     * @param statements branch body
     */
    public record Branch(
        String condition,
        List<SequenceStatement> statements
    ) {
        public Branch {
            statements = statements == null ? List.of() : List.copyOf(statements);
        }
    }
}
