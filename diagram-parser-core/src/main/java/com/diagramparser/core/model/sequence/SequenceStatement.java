package com.diagramparser.core.model.sequence;

/**
 * One statement in the body of a sequence diagram.
 *
 * <p>Block statements ({@link Loop}, {@link Alt}, {@link Opt}, {@link Par},
 * {@link Critical}) hold nested statement lists.
 *
 * @since 1.0.0
 */
public interface SequenceStatement {

    <R> R accept(Visitor<R> visitor);

    /**
     * Visitor over every statement variant.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitMessage(Message message);

        R visitNote(Note note);

        R visitLoop(Loop loop);

        R visitAlt(Alt alt);

        R visitOpt(Opt opt);

        R visitPar(Par par);

        R visitCritical(Critical critical);

        R visitActivate(Activate activate);

        R visitDeactivate(Deactivate deactivate);

        R visitCreate(Create create);

        R visitDestroy(Destroy destroy);
    }
}
