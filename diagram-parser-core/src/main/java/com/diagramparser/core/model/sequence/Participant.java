package com.diagramparser.core.model.sequence;

import java.util.Objects;

/**
 * Sequence diagram participant.
 *
 * <p>{@code actor} is the canonical name. Messages always refer to participants by
 * canonical name, never by alias.
 *
 * @param actor canonical name, unique within the diagram
 * @param alias alternate name from {@code participant X as Y}, or {@code null}
 * @param participantType participant or actor
 */
public record Participant(
    String actor,
    String alias,
    ParticipantType participantType
) {
    public Participant {
        Objects.requireNonNull(actor, "actor must not be null");
        Objects.requireNonNull(participantType, "participantType must not be null");
    }
}
