package com.diagramparser.core.grammar.impl.sequence;

import com.diagramparser.core.model.sequence.Participant;
import com.diagramparser.core.model.sequence.ParticipantType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Participants and aliases of a single parse.
 *
 * <p>{@code participant Alice as A} registers {@code Alice} as canonical name and maps
 * {@code A} to it. Every endpoint goes through {@link #resolve(String)} before use, so
 * the tree never stores an alias where a canonical name exists.
 *
 * <p>An alias may be declared after it was already used as a plain name. The
 * auto-created participant is then merged into the declared one, and
 * {@link #hasLateAliases()} tells the caller to resolve the statements emitted so far
 * again (see {@link EndpointResolver}).
 */
final class ParticipantRegistry {

    private static final Logger log = LoggerFactory.getLogger(ParticipantRegistry.class);

    private final Map<String, Participant> participants = new LinkedHashMap<>();
    private final Map<String, String> aliases = new HashMap<>();
    private final Set<String> declared = new HashSet<>();
    private boolean lateAliases;

    /**
     * Registers an explicit declaration. A participant that was only referenced so far
     * is replaced in place; a second explicit declaration of the same name is ignored.
     * An alias naming another explicitly declared participant is not mapped.
     *
     * @return the registered participant
     */
    Participant declare(String actor, String alias, ParticipantType type) {
        if (declared.contains(actor)) {
            return participants.get(actor);
        }
        declared.add(actor);

        String mappedAlias = alias;
        if (alias != null && !alias.equals(actor) && declared.contains(alias)) {
            log.debug("Alias '{}' of '{}' names a declared participant; not mapped", alias, actor);
            mappedAlias = null;
        }
        Participant participant = new Participant(actor, mappedAlias, type);
        if (mappedAlias != null && !mappedAlias.equals(actor)) {
            aliases.put(mappedAlias, actor);
            if (participants.containsKey(mappedAlias)) {
                mergeInto(mappedAlias, participant);
                lateAliases = true;
                return participant;
            }
        }
        participants.put(actor, participant);
        return participant;
    }

    /**
     * Maps an alias to its canonical name; other names are returned unchanged.
     */
    String resolve(String name) {
        return aliases.getOrDefault(name, name);
    }

    /**
     * Resolves a name and auto-creates a plain participant for it if needed.
     *
     * @return canonical name
     */
    String ensure(String name) {
        String canonical = resolve(name);
        participants.computeIfAbsent(canonical,
            key -> new Participant(key, null, ParticipantType.PARTICIPANT));
        return canonical;
    }

    /**
     * @return true if an alias was declared after being used as a plain name
     */
    boolean hasLateAliases() {
        return lateAliases;
    }

    List<Participant> toList() {
        return List.copyOf(participants.values());
    }

    /**
     * Replaces the auto-created entry {@code alias} with {@code participant}, keeping the
     * earlier of the two positions.
     */
    private void mergeInto(String alias, Participant participant) {
        String actor = participant.actor();
        boolean actorSeen = participants.containsKey(actor);
        Map<String, Participant> merged = new LinkedHashMap<>();
        for (Map.Entry<String, Participant> entry : participants.entrySet()) {
            String name = entry.getKey();
            if (name.equals(alias)) {
                if (!actorSeen) {
                    merged.put(actor, participant);
                }
            } else if (name.equals(actor)) {
                merged.put(actor, participant);
            } else {
                merged.put(name, entry.getValue());
            }
        }
        participants.clear();
        participants.putAll(merged);
    }
}
